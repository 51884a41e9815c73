package org.beng183.motifs;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads RNAMotifScan output as comma- or tab-separated text.
 * Column names vary a little between versions, so the converter accepts {@code Motif_Name}, {@code Motif} or {@code Type}
 * for the category, {@code Start}/{@code Start_Position}, {@code End}/{@code End_Position}, and a required {@code Chain}.
 * {@code Score} and {@code Sequence} are optional.
 * The file doesn't name the structure, so every instance gets the PDB Id the file was looked up by.
 * @author dmyersturnbull
 */
public class RnaMotifScanConverter implements MotifConverter {

	public static final String SOURCE_ID = "rnamotifscan";

	private static final Logger logger = LogManager.getLogger(RnaMotifScanConverter.class.getName());

	@Override
	public String getSourceId() {
		return SOURCE_ID;
	}

	@Override
	public Map<String, List<MotifInstance>> convert(File file, String pdbId) throws LoadException {

		String id = MotifInstance.normalizePdbId(pdbId);
		DelimitedTable table = DelimitedTable.readDetectingDelimiter(file);
		int nameColumn = table.requireColumn("Motif_Name", "Motif", "Type");
		int startColumn = table.requireColumn("Start", "Start_Position");
		int endColumn = table.requireColumn("End", "End_Position");
		int chainColumn = table.requireColumn("Chain");
		int scoreColumn = table.findColumn("Score");
		int sequenceColumn = table.findColumn("Sequence");

		List<MotifInstance> instances = new ArrayList<>();
		for (DelimitedTable.Row row : table.getRows()) {
			try {
				String name = row.get(nameColumn);
				if (name == null || name.isEmpty()) throw new MalformedDataException("empty motif name");
				String chain = row.get(chainColumn);
				if (chain == null || chain.isEmpty()) throw new MalformedDataException("empty chain");
				int start = parseInt(row.get(startColumn), "start");
				int end = parseInt(row.get(endColumn), "end");
				if (start <= 0 || end <= 0 || start > end) throw new MalformedDataException("invalid range " + start + "-" + end);
				instances.add(MotifInstance.builder().motifType(name).pdbId(id).chain(chain).residues(start, end)
						.score(parseScore(row.get(scoreColumn))).sequence(row.get(sequenceColumn)).sourceId(SOURCE_ID).build());
			} catch (MalformedDataException e) {
				logger.warn("Skipping row " + row.getLineNumber() + " of " + file + ": " + e.getMessage());
			}
		}

		logger.debug("Read " + instances.size() + " RNAMotifScan instances from " + file);
		return AnnotationResult.group(instances);
	}

	private static int parseInt(String value, String what) throws MalformedDataException {
		if (value == null || value.isEmpty()) throw new MalformedDataException("missing " + what);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new MalformedDataException("couldn't parse " + what + " '" + value + "'", e);
		}
	}

	private static Double parseScore(String value) throws MalformedDataException {
		if (value == null || value.isEmpty()) return null;
		try {
			return Double.valueOf(value);
		} catch (NumberFormatException e) {
			throw new MalformedDataException("couldn't parse score '" + value + "'", e);
		}
	}

}
