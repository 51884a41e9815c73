package org.beng183.motifs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The motifs one or more sources know about a structure: a mapping of motif type to instances, plus where and when it came from.
 * Within each type, instances keep the order their source gave them, so instance numbering is reproducible.
 * The order of the types themselves carries no meaning.
 * @author dmyersturnbull
 */
public final class AnnotationResult {

	private final String providerId;
	private final long fetchedAt;
	private final Map<String, List<MotifInstance>> motifs;

	@JsonCreator
	public AnnotationResult(@JsonProperty("providerId") String providerId, @JsonProperty("fetchedAt") long fetchedAt,
			@JsonProperty("motifs") Map<String, List<MotifInstance>> motifs) {
		if (providerId == null) throw new IllegalArgumentException("Provider Id is null");
		this.providerId = providerId;
		this.fetchedAt = fetchedAt;
		Map<String, List<MotifInstance>> copy = new LinkedHashMap<>();
		if (motifs != null) {
			for (Map.Entry<String, List<MotifInstance>> entry : motifs.entrySet()) {
				if (entry.getValue() == null || entry.getValue().isEmpty()) continue;
				copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
			}
		}
		this.motifs = Collections.unmodifiableMap(copy);
	}

	/**
	 * Groups {@code instances} by motif type, keeping their order within each type.
	 */
	public static AnnotationResult of(String providerId, long fetchedAt, List<MotifInstance> instances) {
		return new AnnotationResult(providerId, fetchedAt, group(instances));
	}

	public static AnnotationResult empty(String providerId) {
		return new AnnotationResult(providerId, System.currentTimeMillis(), null);
	}

	static Map<String, List<MotifInstance>> group(List<MotifInstance> instances) {
		Map<String, List<MotifInstance>> map = new LinkedHashMap<>();
		for (MotifInstance instance : instances) {
			List<MotifInstance> list = map.get(instance.getMotifType());
			if (list == null) {
				list = new ArrayList<>();
				map.put(instance.getMotifType(), list);
			}
			list.add(instance);
		}
		return map;
	}

	/**
	 * The provider that produced this result, or a comma-separated list of providers for a merged result.
	 */
	public String getProviderId() {
		return providerId;
	}

	/**
	 * Milliseconds since the epoch.
	 */
	public long getFetchedAt() {
		return fetchedAt;
	}

	public Map<String, List<MotifInstance>> getMotifs() {
		return motifs;
	}

	/**
	 * @return The instances of {@code motifType}, or an empty list
	 */
	public List<MotifInstance> getInstances(String motifType) {
		List<MotifInstance> list = motifs.get(motifType);
		if (list == null) return Collections.emptyList();
		return list;
	}

	@JsonIgnore
	public Set<String> getMotifTypes() {
		return motifs.keySet();
	}

	@JsonIgnore
	public boolean isEmpty() {
		return motifs.isEmpty();
	}

	@JsonIgnore
	public int getInstanceCount() {
		int count = 0;
		for (List<MotifInstance> list : motifs.values()) count += list.size();
		return count;
	}

	/**
	 * A short human-readable description of the motif counts, sorted by type.
	 */
	public String toSummary(String pdbId) {
		String id = MotifInstance.normalizePdbId(pdbId);
		if (motifs.isEmpty()) return "No motifs found in " + id;
		StringBuilder sb = new StringBuilder("Motifs in " + id + " (" + providerId + "):");
		for (String type : new TreeSet<>(motifs.keySet())) {
			sb.append(System.getProperty("line.separator"));
			sb.append("  ").append(type).append(": ").append(motifs.get(type).size()).append(" instances");
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof AnnotationResult)) return false;
		AnnotationResult other = (AnnotationResult) obj;
		return fetchedAt == other.fetchedAt && providerId.equals(other.providerId) && motifs.equals(other.motifs);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * providerId.hashCode() + Long.hashCode(fetchedAt)) + motifs.hashCode();
	}

	@Override
	public String toString() {
		return "AnnotationResult[" + providerId + ", " + getInstanceCount() + " instances in " + motifs.size() + " types]";
	}

}
