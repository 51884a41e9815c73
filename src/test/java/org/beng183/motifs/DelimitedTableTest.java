package org.beng183.motifs;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * A test for {@link DelimitedTable}.
 * @author dmyersturnbull
 */
public class DelimitedTableTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testSplitQuoted() {
		String[] fields = DelimitedTable.split("1,\"a,b\",\"say \"\"hi\"\"\",", ',');
		assertArrayEquals(new String[] { "1", "a,b", "say \"hi\"", "" }, fields);
	}

	@Test
	public void testHeaderAfterBlankLinesAndBom() throws Exception {
		File file = folder.newFile("table.csv");
		Files.write(file.toPath(), "\uFEFF\n\nName,Chain\nGNRA,A\n\nUNCG,B\n".getBytes(StandardCharsets.UTF_8));
		DelimitedTable table = DelimitedTable.read(file, ',');
		assertEquals(2, table.getHeader().size());
		assertEquals(0, table.findColumn("name"));
		assertEquals(1, table.requireColumn("CHAIN"));
		assertEquals(-1, table.findColumn("Score"));
		assertEquals(2, table.getRows().size());
		assertEquals(4, table.getRows().get(0).getLineNumber());
		assertEquals("UNCG", table.getRows().get(1).get(0));
		assertNull(table.getRows().get(1).get(5));
	}

	@Test
	public void testDetectsTabs() throws Exception {
		File file = folder.newFile("table.txt");
		Files.write(file.toPath(), "Name\tChain\nGNRA\tA\n".getBytes(StandardCharsets.UTF_8));
		assertEquals('\t', DelimitedTable.readDetectingDelimiter(file).getDelimiter());
	}

	@Test(expected = MalformedDataException.class)
	public void testEmptyFile() throws Exception {
		DelimitedTable.read(folder.newFile("empty.csv"), ',');
	}

	@Test(expected = NotFoundException.class)
	public void testMissingFile() throws Exception {
		DelimitedTable.read(new File(folder.getRoot(), "nothing.csv"), ',');
	}

}
