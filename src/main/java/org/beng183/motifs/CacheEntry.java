package org.beng183.motifs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What {@link MotifCache} writes to disk for one key. Entries are never modified; a refresh writes a new entry under the same key.
 * @author dmyersturnbull
 */
public final class CacheEntry {

	private final String key;
	private final String providerId;
	private final String pdbId;
	private final long createdAt;
	private final long ttlSeconds;
	private final AnnotationResult payload;

	@JsonCreator
	public CacheEntry(@JsonProperty("key") String key, @JsonProperty("providerId") String providerId,
			@JsonProperty("pdbId") String pdbId, @JsonProperty("createdAt") long createdAt,
			@JsonProperty("ttlSeconds") long ttlSeconds, @JsonProperty("payload") AnnotationResult payload) {
		this.key = key;
		this.providerId = providerId;
		this.pdbId = pdbId;
		this.createdAt = createdAt;
		this.ttlSeconds = ttlSeconds;
		this.payload = payload;
	}

	public String getKey() {
		return key;
	}

	public String getProviderId() {
		return providerId;
	}

	public String getPdbId() {
		return pdbId;
	}

	/**
	 * Milliseconds since the epoch.
	 */
	public long getCreatedAt() {
		return createdAt;
	}

	public long getTtlSeconds() {
		return ttlSeconds;
	}

	public AnnotationResult getPayload() {
		return payload;
	}

	/**
	 * An entry is still valid at exactly {@code createdAt + ttl}.
	 */
	@JsonIgnore
	public boolean isExpired(long nowMillis) {
		return nowMillis - createdAt > ttlSeconds * 1000L;
	}

}
