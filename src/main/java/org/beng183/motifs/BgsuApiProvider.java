package org.beng183.motifs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link MotifProvider} that downloads loops from the <a href="http://rna.bgsu.edu/rna3dhub">BGSU RNA 3D Hub</a>.
 * {@code GET <base>/<PDB>} answers with one quoted CSV pair per loop:
 * {@code "HL_4V9F_001","4V9F|1|0|U|55,4V9F|1|0|G|56,..."}, where the loop Id starts with the motif type
 * and the residues are {@code PDB|Model|Chain|Nucleotide|Number}.
 * Loops of types other than hairpins, internal loops and junctions are skipped.
 * @author dmyersturnbull
 */
public class BgsuApiProvider implements MotifProvider {

	public static final String ID = "bgsu_api";

	public static final Set<String> MOTIF_TYPES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("HL", "IL", "J3", "J4",
			"J5", "J6", "J7", "J8")));

	private static final Logger logger = LogManager.getLogger(BgsuApiProvider.class.getName());

	private static final Pattern LOOP = Pattern.compile("\"([^\"]+)\",\"([^\"]+)\"");

	private final String baseUrl;
	private final HttpFetcher fetcher;

	public BgsuApiProvider(String baseUrl, HttpFetcher fetcher) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.fetcher = fetcher;
	}

	@Override
	public AnnotationResult getMotifs(String pdbId) throws LoadException {
		String id = MotifInstance.normalizePdbId(pdbId);
		String body = fetcher.get(baseUrl + "/" + id, "text/csv, text/plain, */*");
		List<MotifInstance> instances = parse(body, id);
		logger.info("BGSU RNA 3D Hub returned " + instances.size() + " loops for " + id);
		return AnnotationResult.of(ID, System.currentTimeMillis(), instances);
	}

	/**
	 * Parses a loop download.
	 * @throws MalformedDataException If the body has content but not a single loop could be read from it
	 */
	static List<MotifInstance> parse(String body, String pdbId) throws MalformedDataException {
		List<MotifInstance> instances = new ArrayList<>();
		if (body.trim().isEmpty()) return instances;
		Matcher matcher = LOOP.matcher(body);
		int matched = 0;
		while (matcher.find()) {
			matched++;
			String loopId = matcher.group(1).trim();
			String motifType = loopId.split("_")[0];
			if (!MOTIF_TYPES.contains(motifType)) {
				logger.trace("Skipping loop " + loopId + " of unknown type");
				continue;
			}
			MotifInstance instance = toInstance(motifType, loopId, matcher.group(2), pdbId);
			if (instance == null) {
				logger.warn("Skipping loop " + loopId + " for " + pdbId + ": no residue could be parsed");
				continue;
			}
			instances.add(instance);
		}
		if (matched == 0) {
			throw new MalformedDataException("Response for " + pdbId + " contains no loops: "
					+ (body.length() > 80 ? body.substring(0, 80) + "..." : body));
		}
		return instances;
	}

	private static MotifInstance toInstance(String motifType, String loopId, String residueSpecs, String pdbId) {
		String chain = null;
		int model = 1;
		int start = Integer.MAX_VALUE;
		int end = Integer.MIN_VALUE;
		StringBuilder sequence = new StringBuilder();
		for (String spec : residueSpecs.split(",")) {
			String[] parts = spec.trim().split("\\|");
			if (parts.length < 5) continue;
			int number;
			try {
				number = Integer.parseInt(parts[4]);
			} catch (NumberFormatException e) {
				continue;
			}
			if (chain == null) {
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
		if (chain == null) return null;
		return MotifInstance.builder().motifType(motifType).pdbId(pdbId).chain(chain).modelNumber(model).residues(start, end)
				.sequence(sequence.toString()).description(loopId).sourceId(ID).build();
	}

	@Override
	public ProviderInfo describe() {
		return new ProviderInfo(ID, "BGSU RNA 3D Hub (online)", "Hairpin, internal and junction loops for RNA structures in the RNA 3D Hub",
				SourceKind.REMOTE);
	}

}
