package org.beng183.motifs;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.typesafe.config.Config;

/**
 * Builds a ready {@link SourceSelector} with the Atlas and Rfam datasets, the BGSU and Rfam APIs, the user annotation tools and a cache.
 * @author dmyersturnbull
 */
public class MotifSources {

	private static final Logger logger = LogManager.getLogger(MotifSources.class.getName());

	public static SourceSelector create() throws ConfigurationException {
		return create(MotifSourcesConfiguration.load());
	}

	/**
	 * @throws ConfigurationException If {@code selector.default-mode} isn't a valid mode
	 */
	public static SourceSelector create(Config config) throws ConfigurationException {
		return create(new MotifSourcesConfiguration(config));
	}

	public static SourceSelector create(MotifSourcesConfiguration configuration) throws ConfigurationException {

		HttpFetcher fetcher = new HttpFetcher(configuration.getConnectTimeoutMillis(), configuration.getReadTimeoutMillis(),
				configuration.getUserAgent());

		List<MotifProvider> providers = new ArrayList<>();
		providers.add(new AtlasProvider(configuration.getAtlasDir()));
		providers.add(new RfamProvider(configuration.getRfamDir()));
		providers.add(new BgsuApiProvider(configuration.getBgsuBaseUrl(), fetcher));
		providers.add(new RfamApiProvider(configuration.getRfamBaseUrl(), fetcher, configuration.getRfamMotifs()));

		Map<UserTool, UserAnnotationProvider> userProviders = new EnumMap<>(UserTool.class);
		for (UserTool tool : UserTool.values()) {
			userProviders.put(tool, new UserAnnotationProvider(configuration.getUserAnnotationsDir(), tool));
		}

		MotifCache cache = new MotifCache(configuration.getCacheDir(), configuration.getCacheTtlSeconds(), Clock.systemUTC());

		SourceSelector selector = new SourceSelector(providers, userProviders, cache, configuration.getProviderTimeoutMillis());
		try {
			selector.setMode(configuration.getDefaultMode());
		} catch (ConfigurationException e) {
			selector.close();
			throw e;
		}
		logger.info("Motif sources ready: " + selector.getAvailableSources().size() + " sources, cache in " + cache.getDirectory()
				+ ", mode " + selector.getConfig());
		return selector;
	}

}
