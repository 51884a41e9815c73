package org.beng183.motifs;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * A test for {@link MotifSources} and {@link MotifSourcesConfiguration}.
 * @author dmyersturnbull
 */
public class MotifSourcesTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Config config(Map<String, Object> overrides) throws Exception {
		overrides.put("rna-motifs.cache.dir", folder.newFolder("cache").getPath());
		overrides.put("rna-motifs.user-annotations.dir", folder.newFolder("user").getPath());
		return ConfigFactory.parseMap(overrides).withFallback(ConfigFactory.load());
	}

	@Test
	public void testDefaults() throws Exception {
		MotifSourcesConfiguration configuration = new MotifSourcesConfiguration(ConfigFactory.load());
		assertEquals(MotifCache.DEFAULT_TTL_SECONDS, configuration.getCacheTtlSeconds());
		assertEquals("auto", configuration.getDefaultMode());
		assertEquals(12, configuration.getRfamMotifs().size());
		assertEquals("RM00008", configuration.getRfamMotifs().keySet().iterator().next());
		assertEquals("GNRA", configuration.getRfamMotifs().get("RM00008"));
		assertEquals("K-turn", configuration.getRfamMotifs().get("RM00010"));
	}

	@Test
	public void testLocalModeWithBundledData() throws Exception {
		Map<String, Object> overrides = new HashMap<>();
		overrides.put("rna-motifs.selector.default-mode", "local");
		try (SourceSelector selector = MotifSources.create(config(overrides))) {
			assertEquals(SourceMode.LOCAL, selector.getConfig().getMode());
			assertEquals(6, selector.getAvailableSources().size());
			assertEquals(2, selector.describeActiveSources().size());
			AnnotationResult result = selector.resolve("1S72");
			assertEquals(AtlasProvider.ID, result.getProviderId());
			selector.setMode("local", "rfam");
			assertEquals(RfamProvider.ID, selector.resolve("1S72").getProviderId());
		}
	}

	@Test
	public void testCheckAvailabilityWithBundledData() throws Exception {
		try (SourceSelector selector = MotifSources.create(config(new HashMap<String, Object>()))) {
			Map<String, Boolean> availability = selector.checkAvailability("4v9f");
			assertEquals(2, availability.size());
			assertTrue(availability.get(AtlasProvider.ID));
			assertFalse(availability.get(RfamProvider.ID));
			assertTrue(selector.checkAvailability("1S72").get(RfamProvider.ID));
		}
	}

	@Test(expected = InvalidModeException.class)
	public void testBadDefaultMode() throws Exception {
		Map<String, Object> overrides = new HashMap<>();
		overrides.put("rna-motifs.selector.default-mode", "sideways");
		MotifSources.create(config(overrides));
	}

	@Test(expected = ConfigException.BadValue.class)
	public void testBadTtl() throws Exception {
		Map<String, Object> overrides = new HashMap<>();
		overrides.put("rna-motifs.cache.ttl-days", 0);
		new MotifSourcesConfiguration(config(overrides));
	}

}
