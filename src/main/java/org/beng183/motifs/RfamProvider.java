package org.beng183.motifs;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link MotifProvider} backed by a bundled copy of the <a href="https://rfam.org/">Rfam</a> motif database.
 * Each motif has a sub-directory holding its alignment as a Stockholm {@code SEED} file;
 * the sub-directory name is the motif type.
 * Alignment rows named {@code PDB_CHAIN/start-end} (or {@code PDB/start-end}, read as chain A) become instances.
 * Everything is indexed by PDB Id when the provider is created.
 * @author dmyersturnbull
 */
public class RfamProvider implements IndexedMotifProvider {

	public static final String ID = "rfam";

	private static final Logger logger = LogManager.getLogger(RfamProvider.class.getName());

	private static final Pattern WITH_CHAIN = Pattern.compile("(\\w{4})_(\\w+)/(\\d+)-(\\d+)");
	private static final Pattern WITHOUT_CHAIN = Pattern.compile("(\\w{4})/(\\d+)-(\\d+)");

	private static final String DEFAULT_CHAIN = "A";

	private final File databaseDir;
	private final TreeSet<String> motifTypes = new TreeSet<>();
	private final Map<String, List<MotifInstance>> pdbIndex = new HashMap<>();

	public RfamProvider(File databaseDir) {
		this.databaseDir = databaseDir;
		File[] dirs = databaseDir.listFiles();
		if (dirs == null) {
			logger.warn("Rfam motif database " + databaseDir + " does not exist");
			return;
		}
		Arrays.sort(dirs);
		for (File dir : dirs) {
			File seed = new File(dir, "SEED");
			if (!dir.isDirectory() || dir.getName().startsWith(".") || !seed.isFile()) continue;
			try {
				index(dir.getName(), seed);
				motifTypes.add(dir.getName());
			} catch (LoadException e) {
				logger.warn("Skipping Rfam motif " + dir.getName() + ": " + e.getMessage(), e);
			}
		}
		logger.info("Indexed " + pdbIndex.size() + " structures from " + motifTypes.size() + " Rfam motifs");
	}

	private void index(String motifType, File seed) throws LoadException {

		List<String> lines = DelimitedTable.readLines(seed);
		if (lines.isEmpty() || !lines.get(0).startsWith("# STOCKHOLM")) {
			throw new MalformedDataException("File " + seed + " is not in Stockholm format");
		}

		StringBuilder description = new StringBuilder();
		Map<String, StringBuilder> sequences = new LinkedHashMap<>();
		for (String line : lines) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.equals("//")) continue;
			if (trimmed.startsWith("#=GF")) {
				String[] parts = trimmed.split("\\s+", 3);
				if (parts.length == 3 && parts[1].equals("DE")) {
					if (description.length() > 0) description.append(' ');
					description.append(parts[2]);
				}
				continue;
			}
			if (trimmed.startsWith("#")) continue;
			String[] parts = trimmed.split("\\s+");
			if (parts.length < 2) continue;
			// alignments may be interleaved in blocks
			StringBuilder sb = sequences.get(parts[0]);
			if (sb == null) {
				sb = new StringBuilder();
				sequences.put(parts[0], sb);
			}
			sb.append(parts[1]);
		}

		for (Map.Entry<String, StringBuilder> entry : sequences.entrySet()) {
			MotifInstance instance = toInstance(motifType, entry.getKey(), entry.getValue().toString(), description.toString());
			if (instance == null) {
				logger.trace("Alignment row " + entry.getKey() + " of " + seed + " doesn't name a structure");
				continue;
			}
			List<MotifInstance> list = pdbIndex.get(instance.getPdbId());
			if (list == null) {
				list = new ArrayList<>();
				pdbIndex.put(instance.getPdbId(), list);
			}
			list.add(instance);
		}
	}

	/**
	 * @return null if the sequence name isn't a PDB range
	 */
	static MotifInstance toInstance(String motifType, String name, String alignedSequence, String description) {
		String pdbId;
		String chain;
		int a;
		int b;
		Matcher matcher = WITH_CHAIN.matcher(name);
		if (matcher.matches()) {
			pdbId = matcher.group(1);
			chain = matcher.group(2);
			a = Integer.parseInt(matcher.group(3));
			b = Integer.parseInt(matcher.group(4));
		} else {
			matcher = WITHOUT_CHAIN.matcher(name);
			if (!matcher.matches()) return null;
			pdbId = matcher.group(1);
			chain = DEFAULT_CHAIN;
			a = Integer.parseInt(matcher.group(2));
			b = Integer.parseInt(matcher.group(3));
		}
		String sequence = alignedSequence.replaceAll("[.\\-~]", "").toUpperCase();
		return MotifInstance.builder().motifType(motifType).pdbId(pdbId).chain(chain).residues(Math.min(a, b), Math.max(a, b))
				.sequence(sequence).description(description).sourceId(ID).build();
	}

	@Override
	public AnnotationResult getMotifs(String pdbId) {
		String id = MotifInstance.normalizePdbId(pdbId);
		List<MotifInstance> instances = pdbIndex.get(id);
		if (instances == null) return AnnotationResult.empty(ID);
		return AnnotationResult.of(ID, System.currentTimeMillis(), instances);
	}

	@Override
	public List<String> getAvailablePdbIds() {
		List<String> ids = new ArrayList<>(pdbIndex.keySet());
		Collections.sort(ids);
		return ids;
	}

	@Override
	public ProviderInfo describe() {
		return new ProviderInfo(ID, "Rfam Motif Database", pdbIndex.size() + " structures, motifs " + motifTypes + " in " + databaseDir,
				SourceKind.LOCAL);
	}

}
