package org.beng183.motifs;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads the CSV that <a href="http://rna.bgsu.edu/FR3D/">FR3D</a> writes for a motif search.
 * The columns are {@code Motif order, Motif type, Resolution, Positions, Sequence, cWW, Description}.
 * Only {@code Motif type} and {@code Positions} are required.
 * A position is {@code PDB|chain|model|start-end}; several positions may be joined by {@code ;},
 * in which case the instance spans the lowest to the highest residue.
 * Rows for a structure other than the one asked for are skipped.
 * @author dmyersturnbull
 */
public class Fr3dConverter implements MotifConverter {

	public static final String SOURCE_ID = "fr3d";

	private static final Logger logger = LogManager.getLogger(Fr3dConverter.class.getName());

	/**
	 * One parsed {@code PDB|chain|model|start-end} position, with start and end in ascending order.
	 */
	public static final class Position {

		private final String pdbId;
		private final String chain;
		private final int model;
		private final int start;
		private final int end;

		Position(String pdbId, String chain, int model, int start, int end) {
			this.pdbId = pdbId;
			this.chain = chain;
			this.model = model;
			this.start = start;
			this.end = end;
		}

		public String getPdbId() {
			return pdbId;
		}

		public String getChain() {
			return chain;
		}

		public int getModel() {
			return model;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}
	}

	@Override
	public String getSourceId() {
		return SOURCE_ID;
	}

	@Override
	public Map<String, List<MotifInstance>> convert(File file, String pdbId) throws LoadException {

		DelimitedTable table = DelimitedTable.read(file, ',');
		int typeColumn = table.requireColumn("Motif type");
		int positionsColumn = table.requireColumn("Positions");
		int sequenceColumn = table.findColumn("Sequence");
		int descriptionColumn = table.findColumn("Description");
		int cwwColumn = table.findColumn("cWW");

		List<MotifInstance> instances = new ArrayList<>();
		for (DelimitedTable.Row row : table.getRows()) {
			try {
				String motifType = row.get(typeColumn);
				if (motifType == null || motifType.isEmpty()) throw new MalformedDataException("empty motif type");
				String positions = row.get(positionsColumn);
				if (positions == null) throw new MalformedDataException("missing positions");
				Position span = span(parsePositions(positions));
				if (!span.getPdbId().equalsIgnoreCase(pdbId)) {
					throw new MalformedDataException("row is for structure " + span.getPdbId() + ", not " + pdbId);
				}
				instances.add(MotifInstance.builder().motifType(motifType).pdbId(span.getPdbId()).chain(span.getChain())
						.modelNumber(span.getModel()).residues(span.getStart(), span.getEnd())
						.sequence(row.get(sequenceColumn)).score(parseScore(row.get(cwwColumn)))
						.description(row.get(descriptionColumn)).sourceId(SOURCE_ID).build());
			} catch (MalformedDataException | IllegalArgumentException e) {
				logger.warn("Skipping row " + row.getLineNumber() + " of " + file + ": " + e.getMessage());
			}
		}

		logger.debug("Read " + instances.size() + " FR3D instances from " + file);
		return AnnotationResult.group(instances);
	}

	/**
	 * Parses one or more {@code ;}-separated positions.
	 * @throws MalformedDataException If any position doesn't have exactly 4 components or a number doesn't parse
	 */
	public static List<Position> parsePositions(String positions) throws MalformedDataException {
		List<Position> list = new ArrayList<>();
		for (String part : positions.split(";")) {
			if (part.trim().isEmpty()) continue;
			String[] components = part.trim().split("\\|", -1);
			if (components.length != 4) {
				throw new MalformedDataException("Position " + part + " has " + components.length + " components instead of 4");
			}
			String[] range = components[3].trim().split("-", -1);
			if (range.length != 2) throw new MalformedDataException("Residue range " + components[3] + " is not start-end");
			try {
				int model = Integer.parseInt(components[2].trim());
				int a = Integer.parseInt(range[0].trim());
				int b = Integer.parseInt(range[1].trim());
				list.add(new Position(components[0].trim(), components[1].trim(), model, Math.min(a, b), Math.max(a, b)));
			} catch (NumberFormatException e) {
				throw new MalformedDataException("Couldn't parse numbers in position " + part, e);
			}
		}
		if (list.isEmpty()) throw new MalformedDataException("No positions in '" + positions + "'");
		return list;
	}

	private static Position span(List<Position> positions) throws MalformedDataException {
		Position first = positions.get(0);
		int start = first.getStart();
		int end = first.getEnd();
		for (Position p : positions) {
			if (!p.getPdbId().equalsIgnoreCase(first.getPdbId()) || !p.getChain().equals(first.getChain())) {
				throw new MalformedDataException("Positions span more than one chain: " + first.getPdbId() + "|" + first.getChain()
						+ " and " + p.getPdbId() + "|" + p.getChain());
			}
			start = Math.min(start, p.getStart());
			end = Math.max(end, p.getEnd());
		}
		return new Position(first.getPdbId(), first.getChain(), first.getModel(), start, end);
	}

	private static Double parseScore(String value) {
		if (value == null || value.isEmpty()) return null;
		try {
			return Double.valueOf(value);
		} catch (NumberFormatException e) {
			return null; // "NA" and the like
		}
	}

}
