package org.beng183.motifs;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides which {@link MotifProvider providers} to ask for a PDB Id and how to combine their answers, according to the live {@link SourceConfig}.
 * <ul>
 * <li>{@link SourceMode#AUTO}, {@link SourceMode#LOCAL} and {@link SourceMode#WEB} ask providers one at a time in priority order
 * (local before remote) and stop at the first non-empty result.</li>
 * <li>{@link SourceMode#ALL} asks every provider concurrently, each bounded by a timeout, and concatenates their instances per motif type
 * in provider order. Nothing is deduplicated; every instance keeps its source Id.</li>
 * <li>{@link SourceMode#USER} reads only the active tool's annotation files and never touches the cache.</li>
 * </ul>
 * Remote providers are read through the {@link MotifCache}. A provider that fails contributes nothing; only configuration mistakes reach the caller.
 * @author dmyersturnbull
 */
public class SourceSelector implements Closeable {

	private static final Logger logger = LogManager.getLogger(SourceSelector.class.getName());

	private final List<MotifProvider> providers;
	private final Map<UserTool, UserAnnotationProvider> userProviders;
	private final MotifCache cache;
	private final long providerTimeoutMillis;
	private final ExecutorService executor;

	private volatile SourceConfig config = SourceConfig.defaults();
	private volatile String lastIdentifier;

	/**
	 * @param providers Local and remote providers; they are queried local first, otherwise in the order given
	 * @param userProviders One provider per supported {@link UserTool}
	 * @param cache May be null to disable caching
	 * @param providerTimeoutMillis How long {@link SourceMode#ALL} waits for the providers
	 */
	public SourceSelector(List<MotifProvider> providers, Map<UserTool, UserAnnotationProvider> userProviders, MotifCache cache,
			long providerTimeoutMillis) {
		List<MotifProvider> sorted = new ArrayList<>(providers);
		for (MotifProvider provider : sorted) {
			if (provider.describe().getKind() == SourceKind.USER) {
				throw new IllegalArgumentException("User annotation provider " + provider.describe().getId() + " can't be a regular source");
			}
		}
		Collections.sort(sorted, new Comparator<MotifProvider>() {
			@Override
			public int compare(MotifProvider a, MotifProvider b) {
				return a.describe().getKind().compareTo(b.describe().getKind());
			}
		});
		this.providers = Collections.unmodifiableList(sorted);
		Map<UserTool, UserAnnotationProvider> users = new EnumMap<>(UserTool.class);
		users.putAll(userProviders);
		this.userProviders = Collections.unmodifiableMap(users);
		this.cache = cache;
		this.providerTimeoutMillis = providerTimeoutMillis;
		// unbounded: a provider task starts when it is submitted, so its timeout runs from its start
		this.executor = Executors.newCachedThreadPool(new ThreadFactory() {
			private final AtomicInteger count = new AtomicInteger();

			@Override
			public Thread newThread(Runnable runnable) {
				Thread thread = new Thread(runnable, "motif-source-" + count.incrementAndGet());
				thread.setDaemon(true);
				return thread;
			}
		});
	}

	/**
	 * Returns the motifs for the PDB Id under the current configuration.
	 * An empty result means no source had anything, and is not an error.
	 */
	public AnnotationResult resolve(String identifier) {
		String id = MotifInstance.normalizePdbId(identifier);
		lastIdentifier = id;
		return resolve(id, config, false);
	}

	/**
	 * Like {@link #resolve(String)}, but skips cache reads and rewrites the cache entries of the remote providers it asks.
	 * @param identifier The PDB Id, or null for the one last resolved
	 * @throws IllegalStateException If {@code identifier} is null and nothing has been resolved yet
	 */
	public AnnotationResult forceRefresh(String identifier) {
		String id = identifier == null ? lastIdentifier : MotifInstance.normalizePdbId(identifier);
		if (id == null) throw new IllegalStateException("No PDB Id to refresh");
		lastIdentifier = id;
		logger.info("Refreshing motifs for " + id);
		return resolve(id, config, true);
	}

	private AnnotationResult resolve(String id, SourceConfig snapshot, boolean refresh) {
		AnnotationResult result;
		switch (snapshot.getMode()) {
		case USER:
			result = fetch(userProviders.get(snapshot.getUserTool()), id, false);
			break;
		case ALL:
			result = union(providers, id, refresh);
			break;
		default:
			result = firstNonEmpty(candidates(snapshot), id, refresh);
			break;
		}
		if (result.isEmpty()) {
			logger.info("No motifs found for " + id + " in mode " + snapshot);
		} else {
			logger.info("Resolved " + result.getInstanceCount() + " instances of " + result.getMotifTypes().size() + " motif types for " + id
					+ " from " + result.getProviderId() + " in mode " + snapshot);
		}
		return result;
	}

	/**
	 * The providers the fallback modes try, in order.
	 */
	private List<MotifProvider> candidates(SourceConfig snapshot) {
		if (snapshot.getMode() == SourceMode.AUTO || snapshot.getMode() == SourceMode.ALL) return providers;
		if (snapshot.getMode() == SourceMode.USER) {
			List<MotifProvider> list = new ArrayList<>();
			list.add(userProviders.get(snapshot.getUserTool()));
			return list;
		}
		SourceKind kind = snapshot.getMode() == SourceMode.LOCAL ? SourceKind.LOCAL : SourceKind.REMOTE;
		List<MotifProvider> list = new ArrayList<>();
		for (MotifProvider provider : providers) {
			ProviderInfo info = provider.describe();
			if (info.getKind() != kind) continue;
			if (snapshot.getNarrowing() != null && !snapshot.getNarrowing().equals(info.getId())) continue;
			list.add(provider);
		}
		return list;
	}

	private AnnotationResult firstNonEmpty(List<MotifProvider> candidates, String id, boolean refresh) {
		for (MotifProvider provider : candidates) {
			AnnotationResult result = fetch(provider, id, refresh);
			if (!result.isEmpty()) return result;
		}
		return AnnotationResult.empty("");
	}

	private AnnotationResult union(List<MotifProvider> candidates, final String id, final boolean refresh) {

		List<Future<AnnotationResult>> futures = new ArrayList<>();
		for (final MotifProvider provider : candidates) {
			futures.add(executor.submit(new Callable<AnnotationResult>() {
				@Override
				public AnnotationResult call() {
					return fetch(provider, id, refresh);
				}
			}));
		}

		// collect in provider order so the merge doesn't depend on completion order
		long deadline = System.currentTimeMillis() + providerTimeoutMillis;
		List<AnnotationResult> results = new ArrayList<>();
		boolean interrupted = false;
		for (int i = 0; i < futures.size(); i++) {
			Future<AnnotationResult> future = futures.get(i);
			String providerId = candidates.get(i).describe().getId();
			if (interrupted) {
				future.cancel(true);
				continue;
			}
			try {
				long remaining = Math.max(0, deadline - System.currentTimeMillis());
				results.add(future.get(remaining, TimeUnit.MILLISECONDS));
			} catch (TimeoutException e) {
				future.cancel(true);
				logger.warn("Source " + providerId + " did not answer for " + id + " within " + providerTimeoutMillis + " ms");
			} catch (ExecutionException e) {
				logger.error("Source " + providerId + " failed for " + id, e.getCause());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				interrupted = true;
				future.cancel(true);
				logger.warn("Interrupted while waiting for " + providerId + "; merging what has arrived for " + id);
			}
		}

		return merge(results);
	}

	/**
	 * Concatenates the instances of each motif type across results, in result order.
	 */
	static AnnotationResult merge(List<AnnotationResult> results) {
		Map<String, List<MotifInstance>> merged = new LinkedHashMap<>();
		List<String> contributors = new ArrayList<>();
		for (AnnotationResult result : results) {
			if (result.isEmpty()) continue;
			contributors.add(result.getProviderId());
			for (Map.Entry<String, List<MotifInstance>> entry : result.getMotifs().entrySet()) {
				List<MotifInstance> list = merged.get(entry.getKey());
				if (list == null) {
					list = new ArrayList<>();
					merged.put(entry.getKey(), list);
				}
				list.addAll(entry.getValue());
			}
		}
		return new AnnotationResult(String.join(",", contributors), System.currentTimeMillis(), merged);
	}

	/**
	 * Asks one provider, through the cache if it is remote. Never throws a {@link LoadException}: a failure becomes an empty result.
	 */
	private AnnotationResult fetch(MotifProvider provider, String id, boolean refresh) {

		ProviderInfo info = provider.describe();
		boolean cached = cache != null && info.getKind() == SourceKind.REMOTE;
		String key = cached ? MotifCache.key(info, id) : null;
		if (cached && !refresh) {
			AnnotationResult hit = cache.get(key);
			if (hit != null) return hit;
		}

		AnnotationResult result;
		try {
			result = provider.getMotifs(id);
		} catch (NotFoundException e) {
			logger.info("Source " + info.getId() + " has nothing for " + id + ": " + e.getMessage());
			return AnnotationResult.empty(info.getId());
		} catch (UnavailableException e) {
			logger.warn("Source " + info.getId() + " is unavailable for " + id + ": " + e.getMessage());
			return AnnotationResult.empty(info.getId());
		} catch (MalformedDataException e) {
			logger.warn("Source " + info.getId() + " returned malformed data for " + id + ": " + e.getMessage(), e);
			return AnnotationResult.empty(info.getId());
		} catch (LoadException e) {
			logger.warn("Source " + info.getId() + " failed for " + id + ": " + e.getMessage(), e);
			return AnnotationResult.empty(info.getId());
		}

		if (cached && !result.isEmpty()) {
			try {
				cache.put(key, info.getId(), id, result);
			} catch (IOException e) {
				logger.warn("Couldn't cache motifs for " + id + " from " + info.getId(), e);
			}
		}
		return result;
	}

	/**
	 * Changes the mode. {@code narrowing} names a single provider for {@link SourceMode#LOCAL} and {@link SourceMode#WEB},
	 * or the tool for {@link SourceMode#USER}; it must be null for the other modes.
	 * Nothing changes if this throws.
	 * @throws InvalidModeException If the mode is unknown or the narrowing doesn't fit it
	 * @throws UnsupportedToolException If the mode is {@code user} and the tool is unknown
	 */
	public synchronized SourceConfig setMode(String mode, String narrowing) throws ConfigurationException {
		SourceMode parsed = SourceMode.fromName(mode);
		String narrow = narrowing == null || narrowing.trim().isEmpty() ? null : narrowing.trim().toLowerCase(Locale.ROOT);
		SourceConfig current = config;
		SourceConfig next;
		switch (parsed) {
		case USER:
			UserTool tool = narrow == null ? current.getUserTool() : UserTool.fromName(narrow);
			if (tool == null) throw new InvalidModeException("Mode user needs an annotation tool; expected one of " + UserTool.names());
			if (!userProviders.containsKey(tool)) throw new UnsupportedToolException(tool.getName());
			next = new SourceConfig(SourceMode.USER, null, tool);
			break;
		case LOCAL:
		case WEB:
			if (narrow != null) requireProvider(parsed, narrow);
			next = new SourceConfig(parsed, narrow, current.getUserTool());
			break;
		default:
			if (narrow != null) throw new InvalidModeException("Mode " + parsed.getName() + " can't be narrowed to " + narrowing);
			next = new SourceConfig(parsed, null, current.getUserTool());
			break;
		}
		config = next;
		logger.info("Source mode is now " + next);
		return next;
	}

	public SourceConfig setMode(String mode) throws ConfigurationException {
		return setMode(mode, null);
	}

	private void requireProvider(SourceMode mode, String providerId) throws InvalidModeException {
		SourceKind kind = mode == SourceMode.LOCAL ? SourceKind.LOCAL : SourceKind.REMOTE;
		List<String> ids = new ArrayList<>();
		for (MotifProvider provider : providers) {
			ProviderInfo info = provider.describe();
			if (info.getKind() != kind) continue;
			if (info.getId().equals(providerId)) return;
			ids.add(info.getId());
		}
		throw new InvalidModeException("Mode " + mode.getName() + " has no source '" + providerId + "'; expected one of " + ids);
	}

	/**
	 * Switches to {@link SourceMode#USER} with the named tool.
	 * @throws UnsupportedToolException If the tool is unknown; the configuration is then left as it was
	 */
	public synchronized SourceConfig selectUserTool(String toolName) throws UnsupportedToolException {
		UserTool tool = UserTool.fromName(toolName);
		if (!userProviders.containsKey(tool)) throw new UnsupportedToolException(toolName);
		SourceConfig next = new SourceConfig(SourceMode.USER, null, tool);
		config = next;
		logger.info("Source mode is now " + next);
		return next;
	}

	public SourceConfig getConfig() {
		return config;
	}

	/**
	 * The PDB Ids that have annotation files for the active tool, or for any tool if none is active.
	 */
	public List<String> listAvailableUserFiles() {
		UserTool active = config.getUserTool();
		TreeSet<String> ids = new TreeSet<>();
		for (Map.Entry<UserTool, UserAnnotationProvider> entry : userProviders.entrySet()) {
			if (active == null || entry.getKey() == active) ids.addAll(entry.getValue().listAvailableIdentifiers());
		}
		return new ArrayList<>(ids);
	}

	/**
	 * Reports which local sources have data for the PDB Id, by provider Id in priority order.
	 * Remote sources are left out, since finding out would take a query.
	 */
	public Map<String, Boolean> checkAvailability(String identifier) {
		String id = MotifInstance.normalizePdbId(identifier);
		Map<String, Boolean> availability = new LinkedHashMap<>();
		for (MotifProvider provider : providers) {
			ProviderInfo info = provider.describe();
			if (info.getKind() != SourceKind.LOCAL) continue;
			if (provider instanceof IndexedMotifProvider) {
				availability.put(info.getId(), ((IndexedMotifProvider) provider).getAvailablePdbIds().contains(id));
			} else {
				availability.put(info.getId(), !fetch(provider, id, false).isEmpty());
			}
		}
		return availability;
	}

	/**
	 * Describes the providers the current configuration would ask, in order, for status display.
	 */
	public List<ProviderInfo> describeActiveSources() {
		List<ProviderInfo> infos = new ArrayList<>();
		for (MotifProvider provider : candidates(config)) infos.add(provider.describe());
		return infos;
	}

	/**
	 * Every provider, including the user annotation providers.
	 */
	public List<ProviderInfo> getAvailableSources() {
		List<ProviderInfo> infos = new ArrayList<>();
		for (MotifProvider provider : providers) infos.add(provider.describe());
		for (UserAnnotationProvider provider : userProviders.values()) infos.add(provider.describe());
		return infos;
	}

	/**
	 * @return The number of entries removed
	 */
	public int clearCache() throws IOException {
		if (cache == null) return 0;
		return cache.clear();
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}

}
