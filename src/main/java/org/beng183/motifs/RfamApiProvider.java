package org.beng183.motifs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A {@link MotifProvider} that asks the <a href="https://rfam.org/">Rfam</a> API which structures contain each of a fixed set of
 * named motifs (GNRA, K-turn, T-loop, ...).
 * For every configured motif accession it requests {@code <base>/motif/<accession>?content-type=application/json}
 * and keeps the structure mappings for the requested PDB Id.
 * A 404 for a motif means it has no structures; any other failure fails the whole call, so a partial answer is never returned.
 * @author dmyersturnbull
 */
public class RfamApiProvider implements MotifProvider {

	public static final String ID = "rfam_api";

	private static final Logger logger = LogManager.getLogger(RfamApiProvider.class.getName());

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String baseUrl;
	private final HttpFetcher fetcher;
	private final Map<String, String> motifs;

	/**
	 * @param motifs Rfam motif accessions (like {@code RM00008}) mapped to the motif type to report them as (like {@code GNRA})
	 */
	public RfamApiProvider(String baseUrl, HttpFetcher fetcher, Map<String, String> motifs) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.fetcher = fetcher;
		this.motifs = Collections.unmodifiableMap(new LinkedHashMap<>(motifs));
	}

	public Map<String, String> getMotifAccessions() {
		return motifs;
	}

	@Override
	public AnnotationResult getMotifs(String pdbId) throws LoadException {
		String id = MotifInstance.normalizePdbId(pdbId);
		List<MotifInstance> instances = new ArrayList<>();
		for (Map.Entry<String, String> motif : motifs.entrySet()) {
			String body;
			try {
				body = fetcher.get(baseUrl + "/motif/" + motif.getKey() + "?content-type=application/json", "application/json");
			} catch (NotFoundException e) {
				logger.debug("Rfam has no structures for motif " + motif.getKey());
				continue;
			}
			instances.addAll(parse(body, id, motif.getKey(), motif.getValue()));
		}
		logger.info("Rfam returned " + instances.size() + " motif instances for " + id);
		return AnnotationResult.of(ID, System.currentTimeMillis(), instances);
	}

	/**
	 * Reads the structure mappings of one motif that belong to {@code pdbId}.
	 * The mappings are in {@code structures} (or {@code pdb} in older responses).
	 */
	static List<MotifInstance> parse(String body, String pdbId, String accession, String motifType) throws MalformedDataException {
		JsonNode root;
		try {
			root = MAPPER.readTree(body);
		} catch (IOException e) {
			throw new MalformedDataException("Couldn't parse Rfam response for motif " + accession, e);
		}
		if (root == null || !root.isObject()) throw new MalformedDataException("Rfam response for motif " + accession + " is not an object");
		JsonNode structures = root.has("structures") ? root.get("structures") : root.path("pdb");
		List<MotifInstance> instances = new ArrayList<>();
		if (!structures.isArray()) return instances;
		for (JsonNode mapping : structures) {
			String structure = firstText(mapping, "pdb_id", "pdb");
			if (structure == null || !structure.trim().equalsIgnoreCase(pdbId)) continue;
			String chain = firstText(mapping, "chain", "auth_asym_id");
			String start = firstText(mapping, "seq_start", "pdb_start");
			String end = firstText(mapping, "seq_end", "pdb_end");
			try {
				int a = start == null ? 1 : Integer.parseInt(start.trim());
				int b = end == null ? a : Integer.parseInt(end.trim());
				instances.add(MotifInstance.builder().motifType(motifType).pdbId(pdbId).chain(chain == null ? "A" : chain)
						.residues(Math.min(a, b), Math.max(a, b)).description("Rfam motif " + accession).sourceId(ID).build());
			} catch (NumberFormatException e) {
				logger.warn("Skipping Rfam mapping of " + accession + " on " + pdbId + " with bad range " + start + "-" + end);
			}
		}
		return instances;
	}

	private static String firstText(JsonNode node, String... names) {
		for (String name : names) {
			JsonNode value = node.get(name);
			if (value != null && !value.isNull() && !value.asText().isEmpty()) return value.asText();
		}
		return null;
	}

	@Override
	public ProviderInfo describe() {
		Map<String, String> parameters = new TreeMap<>();
		parameters.put("motifs", String.join(",", motifs.keySet()));
		return new ProviderInfo(ID, "Rfam (online)", "Named motifs " + motifs.values(), SourceKind.REMOTE, parameters);
	}

}
