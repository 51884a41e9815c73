package org.beng183.motifs;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A snapshot of what is in a {@link MotifCache} directory.
 * @author dmyersturnbull
 */
public final class CacheStatistics {

	private final int entries;
	private final int expiredEntries;
	private final int corruptEntries;
	private final long totalBytes;
	private final Map<String, Integer> entriesByProvider;

	CacheStatistics(int entries, int expiredEntries, int corruptEntries, long totalBytes, Map<String, Integer> entriesByProvider) {
		this.entries = entries;
		this.expiredEntries = expiredEntries;
		this.corruptEntries = corruptEntries;
		this.totalBytes = totalBytes;
		this.entriesByProvider = Collections.unmodifiableMap(new TreeMap<>(entriesByProvider));
	}

	/**
	 * Readable entries, including expired ones.
	 */
	public int getEntries() {
		return entries;
	}

	public int getExpiredEntries() {
		return expiredEntries;
	}

	public int getCorruptEntries() {
		return corruptEntries;
	}

	public long getTotalBytes() {
		return totalBytes;
	}

	public Map<String, Integer> getEntriesByProvider() {
		return entriesByProvider;
	}

	@Override
	public String toString() {
		return entries + " entries (" + expiredEntries + " expired, " + corruptEntries + " corrupt), " + totalBytes / 1024 + " KB, by provider "
				+ entriesByProvider;
	}

}
