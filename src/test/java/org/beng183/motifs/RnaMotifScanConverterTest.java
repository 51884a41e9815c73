package org.beng183.motifs;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * A test for {@link RnaMotifScanConverter}.
 * @author dmyersturnbull
 */
public class RnaMotifScanConverterTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File write(String name, String... lines) throws IOException {
		File file = folder.newFile(name);
		Files.write(file.toPath(), (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void testTabSeparated() throws Exception {
		File file = write("4v9f.tsv",
				"Motif_Name\tChain\tStart\tEnd\tScore\tSequence",
				"K-turn\tA\t77\t82\t12.5\tGGCGAA",
				"K-turn\tA\t93\t99\t\tCUGAUGA",
				"GNRA\tB\t250\t255\t9.1\tCGAAAG");
		Map<String, List<MotifInstance>> motifs = new RnaMotifScanConverter().convert(file, "4v9f");
		assertEquals(2, motifs.get("K-turn").size());
		assertEquals(1, motifs.get("GNRA").size());
		MotifInstance first = motifs.get("K-turn").get(0);
		assertEquals("4V9F", first.getPdbId());
		assertEquals("A", first.getChain());
		assertEquals(77, first.getResidueStart());
		assertEquals(82, first.getResidueEnd());
		assertEquals(12.5, first.getScore(), 0);
		assertEquals(RnaMotifScanConverter.SOURCE_ID, first.getSourceId());
		assertNull(motifs.get("K-turn").get(1).getScore());
	}

	@Test
	public void testCommaSeparatedWithAlternateColumnNames() throws Exception {
		File file = write("4v9f.csv", "Type,Chain,Start_Position,End_Position", "C-loop,0,100,110");
		Map<String, List<MotifInstance>> motifs = new RnaMotifScanConverter().convert(file, "4V9F");
		MotifInstance instance = motifs.get("C-loop").get(0);
		assertEquals("0", instance.getChain());
		assertEquals(100, instance.getResidueStart());
		assertEquals(110, instance.getResidueEnd());
	}

	@Test
	public void testMissingChainColumn() throws Exception {
		File file = write("4v9f.csv", "Motif_Name,Start,End,Score", "K-turn,77,82,12.5");
		try {
			new RnaMotifScanConverter().convert(file, "4V9F");
			fail("A header without a chain column was accepted");
		} catch (MalformedDataException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("Chain"));
		}
	}

	@Test
	public void testBadRowsAreSkipped() throws Exception {
		File file = write("4v9f.csv",
				"Motif_Name,Chain,Start,End,Score",
				"K-turn,A,0,10,1",
				"K-turn,A,20,10,1",
				"K-turn,A,x,10,1",
				"K-turn,,5,10,1",
				"K-turn,A,5,10,high",
				"K-turn,A,5,10,1");
		Map<String, List<MotifInstance>> motifs = new RnaMotifScanConverter().convert(file, "4V9F");
		assertEquals(1, motifs.get("K-turn").size());
	}

}
