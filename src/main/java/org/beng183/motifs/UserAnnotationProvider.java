package org.beng183.motifs;

import java.io.File;
import java.io.FileFilter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link MotifProvider} that reads files a user produced with an external {@link UserTool}.
 * Files live in {@code <annotations-dir>/<tool>/} and are named {@code <pdbid>.<ext>} or {@code <pdbid>_<anything>.<ext>},
 * ignoring case, where the extension is {@code csv}, {@code tsv} or {@code txt}.
 * All matching files are read in file-name order and their instances concatenated per motif type.
 * A file that can't be read is skipped with a warning, unless every file fails.
 * Results are never cached; the files are re-read on every call.
 * @author dmyersturnbull
 */
public class UserAnnotationProvider implements MotifProvider {

	private static final Logger logger = LogManager.getLogger(UserAnnotationProvider.class.getName());

	private static final String[] EXTENSIONS = { ".csv", ".tsv", ".txt" };

	private final File annotationsDir;
	private final UserTool tool;
	private final MotifConverter converter;

	public UserAnnotationProvider(File annotationsDir, UserTool tool) {
		this.annotationsDir = annotationsDir;
		this.tool = tool;
		this.converter = tool.createConverter();
	}

	public UserTool getTool() {
		return tool;
	}

	/**
	 * The directory this provider reads files from.
	 */
	public File getToolDir() {
		return new File(annotationsDir, tool.getName());
	}

	@Override
	public ProviderInfo describe() {
		return new ProviderInfo("user_" + tool.getName(), "User annotations (" + tool.getDisplayName() + ")",
				"Files in " + getToolDir().getPath(), SourceKind.USER);
	}

	@Override
	public AnnotationResult getMotifs(String pdbId) throws LoadException {
		String id = MotifInstance.normalizePdbId(pdbId);
		List<File> files = findFiles(id);
		if (files.isEmpty()) {
			throw new NotFoundException("No " + tool.getDisplayName() + " annotation file for " + id + " in " + getToolDir());
		}
		List<MotifInstance> instances = new ArrayList<>();
		LoadException lastFailure = null;
		int read = 0;
		for (File file : files) {
			logger.info("Loading " + tool.getDisplayName() + " annotations for " + id + " from " + file);
			Map<String, List<MotifInstance>> motifs;
			try {
				motifs = converter.convert(file, id);
			} catch (LoadException e) {
				logger.warn("Skipping " + file + ": " + e.getMessage());
				lastFailure = e;
				continue;
			}
			read++;
			for (List<MotifInstance> list : motifs.values()) instances.addAll(list);
		}
		if (read == 0) throw lastFailure; // every file failed
		return AnnotationResult.of(describe().getId(), System.currentTimeMillis(), instances);
	}

	/**
	 * @return The files for the PDB Id, sorted by name
	 */
	List<File> findFiles(final String pdbId) {
		final String prefix = pdbId.toLowerCase(Locale.ROOT);
		File[] files = getToolDir().listFiles(new FileFilter() {
			@Override
			public boolean accept(File file) {
				if (!file.isFile()) return false;
				String stem = stem(file);
				return stem != null && (stem.equals(prefix) || stem.startsWith(prefix + "_"));
			}
		});
		if (files == null) return new ArrayList<>();
		Arrays.sort(files, new Comparator<File>() {
			@Override
			public int compare(File a, File b) {
				return a.getName().compareTo(b.getName());
			}
		});
		return Arrays.asList(files);
	}

	/**
	 * Lists the PDB Ids that have at least one parsable file for this tool.
	 */
	public List<String> listAvailableIdentifiers() {
		TreeSet<String> ids = new TreeSet<>();
		File[] files = getToolDir().listFiles();
		if (files == null) return new ArrayList<>();
		for (File file : files) {
			if (!file.isFile()) continue;
			String stem = stem(file);
			if (stem == null || stem.isEmpty()) continue;
			int underscore = stem.indexOf('_');
			String id = underscore < 0 ? stem : stem.substring(0, underscore);
			if (!id.isEmpty()) ids.add(id.toUpperCase(Locale.ROOT));
		}
		return new ArrayList<>(ids);
	}

	/**
	 * @return The lower-case file name without a supported extension, or null if the extension isn't supported
	 */
	private static String stem(File file) {
		String name = file.getName().toLowerCase(Locale.ROOT);
		for (String extension : EXTENSIONS) {
			if (name.endsWith(extension)) return name.substring(0, name.length() - extension.length());
		}
		return null;
	}

}
