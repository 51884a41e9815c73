package org.beng183.motifs;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

/**
 * A test for {@link SourceSelector}, with mock providers.
 * @author dmyersturnbull
 */
public class SourceSelectorTest {

	private static final long TIMEOUT = 1000;

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File userDir;
	private MotifCache cache;
	private Map<UserTool, UserAnnotationProvider> userProviders;
	private SourceSelector selector;

	@Before
	public void setUp() throws Exception {
		userDir = folder.newFolder("user_annotations");
		cache = new MotifCache(folder.newFolder("cache"));
		userProviders = new EnumMap<>(UserTool.class);
		for (UserTool tool : UserTool.values()) userProviders.put(tool, new UserAnnotationProvider(userDir, tool));
	}

	@After
	public void tearDown() {
		if (selector != null) selector.close();
	}

	private SourceSelector selector(MotifProvider... providers) {
		selector = new SourceSelector(Arrays.asList(providers), userProviders, cache, TIMEOUT);
		return selector;
	}

	private static MotifProvider provider(String id, SourceKind kind, AnnotationResult result) throws LoadException {
		MotifProvider provider = mock(MotifProvider.class);
		when(provider.describe()).thenReturn(new ProviderInfo(id, id + " source", "test data", kind));
		when(provider.getMotifs(anyString())).thenReturn(result);
		return provider;
	}

	private static MotifProvider failing(String id, SourceKind kind, LoadException e) throws LoadException {
		MotifProvider provider = mock(MotifProvider.class);
		when(provider.describe()).thenReturn(new ProviderInfo(id, id + " source", "test data", kind));
		when(provider.getMotifs(anyString())).thenThrow(e);
		return provider;
	}

	private static MotifProvider sleeping(String id, SourceKind kind, final long millis, final AnnotationResult result) throws LoadException {
		MotifProvider provider = mock(MotifProvider.class);
		when(provider.describe()).thenReturn(new ProviderInfo(id, id + " source", "test data", kind));
		when(provider.getMotifs(anyString())).thenAnswer(new Answer<AnnotationResult>() {
			@Override
			public AnnotationResult answer(InvocationOnMock invocation) throws Throwable {
				Thread.sleep(millis);
				return result;
			}
		});
		return provider;
	}

	/**
	 * One instance of each type, in order, all from {@code providerId}.
	 */
	private static AnnotationResult result(String providerId, String... types) {
		List<MotifInstance> instances = new ArrayList<>();
		int start = 1;
		for (String type : types) {
			instances.add(MotifInstance.builder().motifType(type).pdbId("1S72").chain("0").residues(start, start + 4).sourceId(providerId)
					.build());
			start += 10;
		}
		return AnnotationResult.of(providerId, 0, instances);
	}

	@Test
	public void testAutoReturnsFirstNonEmpty() throws Exception {
		AnnotationResult first = result("atlas", "HL", "IL");
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, first);
		MotifProvider rfam = provider("rfam", SourceKind.LOCAL, result("rfam", "GNRA"));
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "HL"));
		AnnotationResult result = selector(atlas, rfam, bgsu).resolve("1s72");
		assertSame(first, result);
		verify(atlas).getMotifs("1S72");
		verify(rfam, never()).getMotifs(anyString());
		verify(bgsu, never()).getMotifs(anyString());
	}

	@Test
	public void testAutoFallsBackPastEmptyAndFailingSources() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, AnnotationResult.empty("atlas"));
		MotifProvider rfam = failing("rfam", SourceKind.LOCAL, new MalformedDataException("bad SEED"));
		MotifProvider bgsu = failing("bgsu_api", SourceKind.REMOTE, new UnavailableException("connection refused"));
		MotifProvider rfamApi = provider("rfam_api", SourceKind.REMOTE, result("rfam_api", "GNRA"));
		// remote first in the list; local ones are still asked first
		AnnotationResult result = selector(bgsu, rfamApi, atlas, rfam).resolve("1S72");
		assertEquals("rfam_api", result.getProviderId());
		assertEquals(1, result.getInstanceCount());
		verify(atlas).getMotifs("1S72");
		verify(bgsu).getMotifs("1S72");
	}

	@Test
	public void testNothingAnywhereIsEmpty() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, AnnotationResult.empty("atlas"));
		MotifProvider bgsu = failing("bgsu_api", SourceKind.REMOTE, new NotFoundException("404"));
		AnnotationResult result = selector(atlas, bgsu).resolve("1S72");
		assertTrue(result.isEmpty());
		assertEquals("", result.getProviderId());
	}

	@Test
	public void testAllUnionsEverySource() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, result("atlas", "HL", "IL", "HL"));
		MotifProvider rfam = provider("rfam", SourceKind.LOCAL, result("rfam", "GNRA"));
		MotifProvider bgsu = failing("bgsu_api", SourceKind.REMOTE, new UnavailableException("timeout"));
		MotifProvider rfamApi = provider("rfam_api", SourceKind.REMOTE, result("rfam_api", "HL", "GNRA"));
		selector(atlas, rfam, bgsu, rfamApi).setMode("all");
		AnnotationResult result = selector.resolve("1S72");
		assertEquals(3 + 1 + 0 + 2, result.getInstanceCount());
		assertEquals("atlas,rfam,rfam_api", result.getProviderId());
		List<MotifInstance> hairpins = result.getInstances("HL");
		assertEquals(3, hairpins.size());
		assertEquals("atlas", hairpins.get(0).getSourceId());
		assertEquals("atlas", hairpins.get(1).getSourceId());
		assertEquals("rfam_api", hairpins.get(2).getSourceId());
		List<MotifInstance> gnra = result.getInstances("GNRA");
		assertEquals("rfam", gnra.get(0).getSourceId());
		assertEquals("rfam_api", gnra.get(1).getSourceId());
	}

	@Test
	public void testAllDoesNotWaitForSlowSource() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, result("atlas", "HL"));
		MotifProvider slow = mock(MotifProvider.class);
		when(slow.describe()).thenReturn(new ProviderInfo("slow", "slow", "test data", SourceKind.REMOTE));
		when(slow.getMotifs(anyString())).thenAnswer(new Answer<AnnotationResult>() {
			@Override
			public AnnotationResult answer(InvocationOnMock invocation) throws Throwable {
				Thread.sleep(TIMEOUT * 10);
				return result("slow", "HL");
			}
		});
		selector(atlas, slow).setMode("all");
		long start = System.currentTimeMillis();
		AnnotationResult result = selector.resolve("1S72");
		assertTrue(System.currentTimeMillis() - start < TIMEOUT * 5);
		assertEquals("atlas", result.getProviderId());
		assertEquals(1, result.getInstanceCount());
	}

	@Test
	public void testConcurrentAllResolutionsEachGetEverySource() throws Exception {
		MotifProvider atlas = sleeping("atlas", SourceKind.LOCAL, 600, result("atlas", "HL"));
		MotifProvider rfam = sleeping("rfam", SourceKind.LOCAL, 600, result("rfam", "GNRA"));
		selector(atlas, rfam).setMode("all");
		Callable<AnnotationResult> resolution = new Callable<AnnotationResult>() {
			@Override
			public AnnotationResult call() throws Exception {
				return selector.resolve("1S72");
			}
		};
		ExecutorService callers = Executors.newFixedThreadPool(2);
		try {
			Future<AnnotationResult> first = callers.submit(resolution);
			Future<AnnotationResult> second = callers.submit(resolution);
			assertEquals(2, first.get().getInstanceCount());
			assertEquals(2, second.get().getInstanceCount());
			assertEquals("atlas,rfam", second.get().getProviderId());
		} finally {
			callers.shutdownNow();
		}
		verify(atlas, times(2)).getMotifs("1S72");
		verify(rfam, times(2)).getMotifs("1S72");
	}

	@Test
	public void testCheckAvailabilityCoversLocalSources() throws Exception {
		IndexedMotifProvider atlas = mock(IndexedMotifProvider.class);
		when(atlas.describe()).thenReturn(new ProviderInfo("atlas", "atlas source", "test data", SourceKind.LOCAL));
		when(atlas.getAvailablePdbIds()).thenReturn(Arrays.asList("1S72", "4V9F"));
		MotifProvider rfam = provider("rfam", SourceKind.LOCAL, AnnotationResult.empty("rfam"));
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "HL"));
		Map<String, Boolean> availability = selector(bgsu, atlas, rfam).checkAvailability("1s72");
		assertEquals(Arrays.asList("atlas", "rfam"), new ArrayList<>(availability.keySet()));
		assertTrue(availability.get("atlas"));
		assertFalse(availability.get("rfam"));
		assertFalse(selector.checkAvailability("2ABC").get("atlas"));
		verify(atlas, never()).getMotifs(anyString());
		verify(bgsu, never()).getMotifs(anyString());
	}

	@Test
	public void testMergeIsOrderedByInput() {
		AnnotationResult merged = SourceSelector.merge(Arrays.asList(result("b", "HL"), AnnotationResult.empty("x"), result("a", "HL")));
		assertEquals("b,a", merged.getProviderId());
		assertEquals("b", merged.getInstances("HL").get(0).getSourceId());
		assertEquals("a", merged.getInstances("HL").get(1).getSourceId());
	}

	@Test
	public void testNarrowedWebQueriesOnlyThatSource() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, result("atlas", "HL"));
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "IL"));
		MotifProvider rfamApi = provider("rfam_api", SourceKind.REMOTE, result("rfam_api", "GNRA"));
		selector(atlas, bgsu, rfamApi).setMode("web", "RFAM_API");
		assertEquals("rfam_api", selector.resolve("1S72").getProviderId());
		verify(atlas, never()).getMotifs(anyString());
		verify(bgsu, never()).getMotifs(anyString());
		assertEquals(1, selector.describeActiveSources().size());
		assertEquals("rfam_api", selector.describeActiveSources().get(0).getId());
	}

	@Test
	public void testLocalWithoutNarrowing() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, AnnotationResult.empty("atlas"));
		MotifProvider rfam = provider("rfam", SourceKind.LOCAL, result("rfam", "GNRA"));
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "IL"));
		selector(atlas, rfam, bgsu).setMode("local");
		assertEquals("rfam", selector.resolve("1S72").getProviderId());
		verify(bgsu, never()).getMotifs(anyString());
	}

	@Test
	public void testRemoteResultsAreCached() throws Exception {
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "HL", "IL"));
		selector(bgsu);
		AnnotationResult first = selector.resolve("1S72");
		AnnotationResult second = selector.resolve("1s72");
		assertEquals(first, second);
		verify(bgsu, times(1)).getMotifs(anyString());
		selector.forceRefresh(null);
		verify(bgsu, times(2)).getMotifs(anyString());
		assertEquals(1, cache.getStatistics().getEntries());
		assertEquals(1, selector.clearCache());
		selector.resolve("1S72");
		verify(bgsu, times(3)).getMotifs(anyString());
	}

	@Test
	public void testLocalAndEmptyResultsAreNotCached() throws Exception {
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, AnnotationResult.empty("atlas"));
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, AnnotationResult.empty("bgsu_api"));
		selector(atlas, bgsu);
		selector.resolve("1S72");
		selector.resolve("1S72");
		verify(bgsu, times(2)).getMotifs(anyString());
		assertEquals(0, cache.getStatistics().getEntries());
	}

	@Test(expected = IllegalStateException.class)
	public void testRefreshNeedsAnIdentifier() throws Exception {
		selector(provider("atlas", SourceKind.LOCAL, result("atlas", "HL"))).forceRefresh(null);
	}

	@Test
	public void testUserModeIgnoresOtherSources() throws Exception {
		File fr3d = new File(userDir, "fr3d");
		assertTrue(fr3d.mkdir());
		Files.write(new File(fr3d, "1s72.csv").toPath(), ("Motif type,Positions\nHairpin,\"1S72|0|1|13-20\"\n")
				.getBytes(StandardCharsets.UTF_8));
		MotifProvider atlas = provider("atlas", SourceKind.LOCAL, result("atlas", "HL"));
		MotifProvider bgsu = provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "IL"));
		selector(atlas, bgsu).selectUserTool("FR3D");
		AnnotationResult result = selector.resolve("1S72");
		assertEquals("user_fr3d", result.getProviderId());
		assertEquals(1, result.getInstances("Hairpin").size());
		verify(atlas, never()).getMotifs(anyString());
		verify(bgsu, never()).getMotifs(anyString());
		assertEquals(0, cache.getStatistics().getEntries());
		assertEquals(Arrays.asList("1S72"), selector.listAvailableUserFiles());
		assertTrue(selector.resolve("4V9F").isEmpty());
	}

	@Test
	public void testUnsupportedToolLeavesConfigAlone() throws Exception {
		selector(provider("atlas", SourceKind.LOCAL, result("atlas", "HL"))).setMode("web");
		SourceConfig before = selector.getConfig();
		try {
			selector.selectUserTool("fr3dd");
			fail("Accepted a misspelled tool");
		} catch (UnsupportedToolException e) {
			assertEquals("fr3dd", e.getToolName());
		}
		assertSame(before, selector.getConfig());
		try {
			selector.setMode("user", "motifscan");
			fail("Accepted a misspelled tool");
		} catch (UnsupportedToolException e) {
			assertSame(before, selector.getConfig());
		}
	}

	@Test
	public void testInvalidModesLeaveConfigAlone() throws Exception {
		selector(provider("atlas", SourceKind.LOCAL, result("atlas", "HL")), provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "HL")));
		SourceConfig before = selector.getConfig();
		String[][] invalid = { { "everything", null }, { "", null }, { null, null }, { "local", "bgsu_api" }, { "web", "atlas" },
				{ "auto", "atlas" }, { "all", "rfam" }, { "user", null } };
		for (String[] mode : invalid) {
			try {
				selector.setMode(mode[0], mode[1]);
				fail("Accepted mode " + Arrays.toString(mode));
			} catch (InvalidModeException e) {
				assertSame(before, selector.getConfig());
			}
		}
	}

	@Test
	public void testUserModeRemembersTool() throws Exception {
		selector(provider("atlas", SourceKind.LOCAL, result("atlas", "HL")));
		selector.selectUserTool("rnamotifscan");
		selector.setMode("auto");
		SourceConfig config = selector.setMode("user");
		assertEquals(SourceMode.USER, config.getMode());
		assertEquals(UserTool.RNAMOTIFSCAN, config.getUserTool());
	}

	@Test
	public void testAvailableSources() throws Exception {
		selector(provider("bgsu_api", SourceKind.REMOTE, result("bgsu_api", "HL")), provider("atlas", SourceKind.LOCAL, result("atlas", "HL")));
		List<ProviderInfo> infos = selector.getAvailableSources();
		assertEquals(2 + UserTool.values().length, infos.size());
		assertEquals("atlas", infos.get(0).getId());
		assertEquals("bgsu_api", infos.get(1).getId());
		assertEquals(SourceKind.USER, infos.get(2).getKind());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUserProviderIsNotARegularSource() {
		selector(new UserAnnotationProvider(userDir, UserTool.FR3D));
	}

}
