package org.beng183.motifs;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metadata about a {@link MotifProvider}, for status display and for deriving cache keys.
 * @author dmyersturnbull
 */
public final class ProviderInfo {

	private final String id;
	private final String name;
	private final String coverage;
	private final SourceKind kind;
	private final Map<String, String> queryParameters;

	public ProviderInfo(String id, String name, String coverage, SourceKind kind) {
		this(id, name, coverage, kind, Collections.<String, String> emptyMap());
	}

	/**
	 * @param queryParameters Anything besides the PDB Id that changes what the provider returns
	 */
	public ProviderInfo(String id, String name, String coverage, SourceKind kind, Map<String, String> queryParameters) {
		this.id = id;
		this.name = name;
		this.coverage = coverage;
		this.kind = kind;
		this.queryParameters = Collections.unmodifiableMap(new TreeMap<>(queryParameters));
	}

	public String getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public String getCoverage() {
		return coverage;
	}

	public SourceKind getKind() {
		return kind;
	}

	/**
	 * Sorted by key.
	 */
	public Map<String, String> getQueryParameters() {
		return queryParameters;
	}

	@Override
	public String toString() {
		return name + " [" + id + ", " + kind.getName() + "]: " + coverage;
	}

}
