package org.beng183.motifs;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A {@link MotifProvider} backed by a bundled release of the <a href="http://rna.bgsu.edu/rna3dhub/motifs">RNA 3D Motif Atlas</a>.
 * The directory holds one JSON file per motif type, named like {@code hl_4.5.json}; when there are several releases of a type,
 * the newest is used. The whole release is indexed by PDB Id when the provider is created, so lookups don't touch the disk.
 * @author dmyersturnbull
 */
public class AtlasProvider implements IndexedMotifProvider {

	public static final String ID = "atlas";

	private static final Logger logger = LogManager.getLogger(AtlasProvider.class.getName());

	private static final Pattern FILE_NAME = Pattern.compile("([a-z]+\\d*)_(\\d+(?:\\.\\d+)*)\\.json", Pattern.CASE_INSENSITIVE);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final File databaseDir;
	private final Map<String, String> versions = new TreeMap<>();
	private final Map<String, List<MotifInstance>> pdbIndex = new HashMap<>();

	public AtlasProvider(File databaseDir) {
		this.databaseDir = databaseDir;
		Map<String, File> files = resolveFiles();
		if (files.isEmpty()) logger.warn("No RNA 3D Motif Atlas files found in " + databaseDir);
		for (Map.Entry<String, File> entry : files.entrySet()) {
			try {
				index(entry.getKey(), entry.getValue());
			} catch (MalformedDataException e) {
				logger.warn("Skipping Atlas file " + entry.getValue() + ": " + e.getMessage(), e);
			}
		}
		logger.info("Indexed " + pdbIndex.size() + " structures from RNA 3D Motif Atlas " + versions);
	}

	/**
	 * Finds the newest release file of each motif type.
	 */
	private Map<String, File> resolveFiles() {
		Map<String, File> chosen = new LinkedHashMap<>();
		File[] files = databaseDir.listFiles();
		if (files == null) return chosen;
		Arrays.sort(files);
		for (File file : files) {
			Matcher matcher = FILE_NAME.matcher(file.getName());
			if (!file.isFile() || !matcher.matches()) continue;
			String type = matcher.group(1).toUpperCase(Locale.ROOT);
			String version = matcher.group(2);
			try {
				parseVersion(version);
			} catch (NumberFormatException e) {
				logger.warn("Skipping Atlas file " + file + ": release " + version + " is not a version number");
				continue;
			}
			if (!versions.containsKey(type) || compareVersions(version, versions.get(type)) > 0) {
				versions.put(type, version);
				chosen.put(type, file);
			}
		}
		return chosen;
	}

	static int compareVersions(String a, String b) {
		int[] x = parseVersion(a);
		int[] y = parseVersion(b);
		for (int i = 0; i < Math.max(x.length, y.length); i++) {
			int p = i < x.length ? x[i] : 0;
			int q = i < y.length ? y[i] : 0;
			if (p != q) return Integer.compare(p, q);
		}
		return 0;
	}

	/**
	 * @throws NumberFormatException If a component isn't a number or doesn't fit in an int
	 */
	static int[] parseVersion(String version) {
		String[] parts = version.split("\\.");
		int[] numbers = new int[parts.length];
		for (int i = 0; i < parts.length; i++) numbers[i] = Integer.parseInt(parts[i]);
		return numbers;
	}

	private void index(String motifType, File file) throws MalformedDataException {
		JsonNode root;
		try {
			root = MAPPER.readTree(file);
		} catch (IOException e) {
			throw new MalformedDataException("Couldn't parse " + file, e);
		}
		if (root == null || !root.isArray()) throw new MalformedDataException("Expected a JSON array of motifs in " + file);
		int count = 0;
		for (JsonNode motif : root) {
			String motifId = motif.path("motif_id").asText("");
			JsonNode alignment = motif.path("alignment");
			Iterator<Map.Entry<String, JsonNode>> it = alignment.fields();
			while (it.hasNext()) {
				Map.Entry<String, JsonNode> entry = it.next();
				MotifInstance instance = toInstance(motifType, motifId, entry.getKey(), entry.getValue());
				if (instance == null) continue;
				List<MotifInstance> list = pdbIndex.get(instance.getPdbId());
				if (list == null) {
					list = new ArrayList<>();
					pdbIndex.put(instance.getPdbId(), list);
				}
				list.add(instance);
				count++;
			}
		}
		logger.debug("Read " + count + " " + motifType + " instances from " + file);
	}

	/**
	 * Builds an instance from residue specs {@code PDB|Model|Chain|Nucleotide|Number}, ordered by their alignment position.
	 * The range covers the residues on the chain of the first residue.
	 * @return null if no residue spec parses
	 */
	private static MotifInstance toInstance(String motifType, String motifId, String instanceId, JsonNode residueMap) {
		Map<Integer, String> ordered = new TreeMap<>();
		Iterator<Map.Entry<String, JsonNode>> it = residueMap.fields();
		int fallback = Integer.MAX_VALUE / 2;
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> entry = it.next();
			Integer position;
			try {
				position = Integer.valueOf(entry.getKey());
			} catch (NumberFormatException e) {
				position = fallback++;
			}
			ordered.put(position, entry.getValue().asText());
		}
		String pdbId = null;
		String chain = null;
		int model = 1;
		int start = Integer.MAX_VALUE;
		int end = Integer.MIN_VALUE;
		StringBuilder sequence = new StringBuilder();
		for (String spec : ordered.values()) {
			String[] parts = spec.split("\\|");
			if (parts.length < 5) continue;
			int number;
			try {
				number = Integer.parseInt(parts[4]);
			} catch (NumberFormatException e) {
				logger.debug("Bad residue number in " + spec + " of " + instanceId);
				continue;
			}
			if (pdbId == null) {
				pdbId = parts[0];
				chain = parts[2];
				try {
					model = Integer.parseInt(parts[1]);
				} catch (NumberFormatException e) {
					model = 1;
				}
			}
			sequence.append(parts[3]);
			if (!parts[2].equals(chain)) continue;
			start = Math.min(start, number);
			end = Math.max(end, number);
		}
		if (pdbId == null) return null;
		return MotifInstance.builder().motifType(motifType).pdbId(pdbId).chain(chain).modelNumber(model).residues(start, end)
				.sequence(sequence.toString()).description(motifId + " " + instanceId).sourceId(ID).build();
	}

	@Override
	public AnnotationResult getMotifs(String pdbId) {
		String id = MotifInstance.normalizePdbId(pdbId);
		List<MotifInstance> instances = pdbIndex.get(id);
		if (instances == null) return AnnotationResult.empty(ID);
		return AnnotationResult.of(ID, System.currentTimeMillis(), instances);
	}

	/**
	 * The structures this release has motifs for.
	 */
	@Override
	public List<String> getAvailablePdbIds() {
		List<String> ids = new ArrayList<>(pdbIndex.keySet());
		Collections.sort(ids);
		return ids;
	}

	@Override
	public ProviderInfo describe() {
		return new ProviderInfo(ID, "RNA 3D Motif Atlas", pdbIndex.size() + " structures, motif types " + versions.keySet(), SourceKind.LOCAL);
	}

}
