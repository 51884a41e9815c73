package org.beng183.motifs;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A directory of remote-provider responses, one JSON file per key, each valid for a fixed time-to-live.
 * <p>
 * Writes go to a temporary file that is then renamed over the entry, so a reader never sees a half-written entry.
 * Two writers of the same key may race; the last rename wins.
 * Expired entries are not swept: they stay on disk until they are overwritten, {@link #cleanupExpired() purged} or {@link #clear() cleared}.
 * A corrupt entry reads as a miss.
 * @author dmyersturnbull
 */
public class MotifCache {

	public static final long DEFAULT_TTL_SECONDS = 30L * 24 * 60 * 60;

	private static final Logger logger = LogManager.getLogger(MotifCache.class.getName());

	private static final String EXTENSION = ".json";
	private static final String TEMP_EXTENSION = ".tmp";

	private final Path dir;
	private final long ttlSeconds;
	private final Clock clock;
	private final ObjectMapper mapper = new ObjectMapper();

	public MotifCache(File dir) {
		this(dir, DEFAULT_TTL_SECONDS, Clock.systemUTC());
	}

	public MotifCache(File dir, long ttlSeconds, Clock clock) {
		this.dir = dir.toPath();
		this.ttlSeconds = ttlSeconds;
		this.clock = clock;
	}

	/**
	 * Derives the key for a query: a SHA-256 over the provider, the upper-case PDB Id and the sorted query parameters.
	 */
	public static String key(String providerId, String pdbId, Map<String, String> queryParameters) {
		StringBuilder sb = new StringBuilder();
		sb.append(providerId).append('\n').append(MotifInstance.normalizePdbId(pdbId)).append('\n');
		for (Map.Entry<String, String> entry : new TreeMap<>(queryParameters).entrySet()) {
			sb.append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
		}
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
			StringBuilder hex = new StringBuilder();
			for (byte b : hash) hex.append(String.format("%02x", b));
			return hex.toString();
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e); // every JRE has it
		}
	}

	public static String key(ProviderInfo provider, String pdbId) {
		return key(provider.getId(), pdbId, provider.getQueryParameters());
	}

	/**
	 * @return The cached result, or null if the key is absent, expired or unreadable
	 */
	public AnnotationResult get(String key) {
		CacheEntry entry = read(path(key));
		if (entry == null) return null;
		if (!key.equals(entry.getKey()) || entry.getPayload() == null) {
			logger.warn("Cache entry " + key + " is inconsistent; treating it as a miss");
			return null;
		}
		if (entry.isExpired(clock.millis())) {
			logger.debug("Cache entry " + key + " for " + entry.getPdbId() + " from " + entry.getProviderId() + " expired");
			return null;
		}
		logger.debug("Cache hit " + key + " for " + entry.getPdbId() + " from " + entry.getProviderId());
		return entry.getPayload();
	}

	/**
	 * Writes {@code result} under {@code key}, replacing any earlier entry.
	 */
	public void put(String key, String providerId, String pdbId, AnnotationResult result) throws IOException {
		Files.createDirectories(dir);
		CacheEntry entry = new CacheEntry(key, providerId, MotifInstance.normalizePdbId(pdbId), clock.millis(), ttlSeconds, result);
		byte[] bytes = mapper.writeValueAsBytes(entry);
		Path temp = Files.createTempFile(dir, key + ".", TEMP_EXTENSION);
		try {
			Files.write(temp, bytes);
			try {
				Files.move(temp, path(key), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				logger.debug("Atomic rename not supported in " + dir + "; replacing " + key + " non-atomically");
				Files.move(temp, path(key), StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(temp);
		}
		logger.debug("Cached " + result.getInstanceCount() + " instances for " + pdbId + " from " + providerId + " as " + key);
	}

	/**
	 * Removes every entry for the provider and PDB Id, whatever its query parameters.
	 * @return The number of entries removed
	 */
	public int invalidate(String providerId, String pdbId) throws IOException {
		String id = MotifInstance.normalizePdbId(pdbId);
		int count = 0;
		for (Path file : list(EXTENSION)) {
			CacheEntry entry = read(file);
			if (entry != null && providerId.equals(entry.getProviderId()) && id.equals(entry.getPdbId())) {
				if (Files.deleteIfExists(file)) count++;
			}
		}
		return count;
	}

	/**
	 * Removes all entries unconditionally, including leftover temporary files.
	 * @return The number of entries removed
	 */
	public int clear() throws IOException {
		int count = 0;
		for (Path file : list(EXTENSION)) {
			if (Files.deleteIfExists(file)) count++;
		}
		for (Path file : list(TEMP_EXTENSION)) {
			Files.deleteIfExists(file);
		}
		logger.info("Cleared " + count + " cache entries from " + dir);
		return count;
	}

	/**
	 * Removes expired and unreadable entries. Nothing calls this automatically.
	 * @return The number of entries removed
	 */
	public int cleanupExpired() throws IOException {
		long now = clock.millis();
		int count = 0;
		for (Path file : list(EXTENSION)) {
			CacheEntry entry = read(file);
			if (entry == null || entry.isExpired(now)) {
				if (Files.deleteIfExists(file)) count++;
			}
		}
		logger.info("Removed " + count + " expired or corrupt cache entries from " + dir);
		return count;
	}

	public CacheStatistics getStatistics() throws IOException {
		long now = clock.millis();
		int entries = 0;
		int expired = 0;
		int corrupt = 0;
		long bytes = 0;
		Map<String, Integer> byProvider = new HashMap<>();
		for (Path file : list(EXTENSION)) {
			try {
				bytes += Files.size(file);
			} catch (NoSuchFileException e) {
				continue; // removed by someone else meanwhile
			}
			CacheEntry entry = read(file);
			if (entry == null) {
				corrupt++;
				continue;
			}
			entries++;
			if (entry.isExpired(now)) expired++;
			Integer n = byProvider.get(entry.getProviderId());
			byProvider.put(entry.getProviderId(), n == null ? 1 : n + 1);
		}
		return new CacheStatistics(entries, expired, corrupt, bytes, byProvider);
	}

	public File getDirectory() {
		return dir.toFile();
	}

	public long getTtlSeconds() {
		return ttlSeconds;
	}

	private Path path(String key) {
		return dir.resolve(key + EXTENSION);
	}

	/**
	 * @return The entry, or null if the file is missing or can't be deserialized
	 */
	private CacheEntry read(Path file) {
		if (!Files.isRegularFile(file)) return null;
		try {
			return mapper.readValue(file.toFile(), CacheEntry.class);
		} catch (IOException | RuntimeException e) {
			logger.warn("Couldn't read cache entry " + file + "; treating it as a miss: " + e.getMessage());
			return null;
		}
	}

	private Iterable<Path> list(String extension) throws IOException {
		Map<String, Path> files = new TreeMap<>();
		if (!Files.isDirectory(dir)) return files.values();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + extension)) {
			for (Path file : stream) files.put(file.getFileName().toString(), file);
		}
		return files.values();
	}

}
