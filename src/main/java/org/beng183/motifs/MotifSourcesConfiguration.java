package org.beng183.motifs;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Typed settings for {@link MotifSources}, read from the {@code rna-motifs} section of a Typesafe {@link Config}.
 * Defaults come from {@code reference.conf}.
 * @author dmyersturnbull
 */
public final class MotifSourcesConfiguration {

	public static final String ROOT = "rna-motifs";

	private final File atlasDir;
	private final File rfamDir;
	private final File userAnnotationsDir;
	private final File cacheDir;
	private final long cacheTtlSeconds;
	private final int connectTimeoutMillis;
	private final int readTimeoutMillis;
	private final String userAgent;
	private final String bgsuBaseUrl;
	private final String rfamBaseUrl;
	private final Map<String, String> rfamMotifs;
	private final String defaultMode;
	private final long providerTimeoutMillis;

	/**
	 * @param root A config that contains the {@code rna-motifs} section
	 * @throws ConfigException If a key is missing or has the wrong type
	 */
	public MotifSourcesConfiguration(Config root) {
		Config config = root.getConfig(ROOT);
		atlasDir = new File(config.getString("database.atlas-dir"));
		rfamDir = new File(config.getString("database.rfam-dir"));
		userAnnotationsDir = new File(config.getString("user-annotations.dir"));
		cacheDir = new File(config.getString("cache.dir"));
		long days = config.getLong("cache.ttl-days");
		if (days <= 0) throw new ConfigException.BadValue(config.origin(), "cache.ttl-days", "must be positive, not " + days);
		cacheTtlSeconds = days * 24 * 60 * 60;
		connectTimeoutMillis = config.getInt("http.connect-timeout-ms");
		readTimeoutMillis = config.getInt("http.read-timeout-ms");
		userAgent = config.getString("http.user-agent");
		bgsuBaseUrl = config.getString("bgsu.base-url");
		rfamBaseUrl = config.getString("rfam.base-url");
		Map<String, String> motifs = new LinkedHashMap<>();
		for (Config motif : config.getConfigList("rfam.motifs")) {
			motifs.put(motif.getString("accession"), motif.getString("type"));
		}
		rfamMotifs = Collections.unmodifiableMap(motifs);
		defaultMode = config.getString("selector.default-mode");
		providerTimeoutMillis = config.getLong("selector.provider-timeout-ms");
	}

	/**
	 * Reads {@code application.conf}, system properties and {@code reference.conf}, in that order of precedence.
	 */
	public static MotifSourcesConfiguration load() {
		return new MotifSourcesConfiguration(ConfigFactory.load());
	}

	public File getAtlasDir() {
		return atlasDir;
	}

	public File getRfamDir() {
		return rfamDir;
	}

	public File getUserAnnotationsDir() {
		return userAnnotationsDir;
	}

	public File getCacheDir() {
		return cacheDir;
	}

	public long getCacheTtlSeconds() {
		return cacheTtlSeconds;
	}

	public int getConnectTimeoutMillis() {
		return connectTimeoutMillis;
	}

	public int getReadTimeoutMillis() {
		return readTimeoutMillis;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public String getBgsuBaseUrl() {
		return bgsuBaseUrl;
	}

	public String getRfamBaseUrl() {
		return rfamBaseUrl;
	}

	/**
	 * Rfam motif accessions mapped to the motif type they are reported as, in configured order.
	 */
	public Map<String, String> getRfamMotifs() {
		return rfamMotifs;
	}

	public String getDefaultMode() {
		return defaultMode;
	}

	public long getProviderTimeoutMillis() {
		return providerTimeoutMillis;
	}

}
