package org.beng183.motifs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How the {@link SourceSelector} chooses and combines providers.
 * @author dmyersturnbull
 */
public enum SourceMode {

	/**
	 * Local providers, then remote ones; the first non-empty result wins.
	 */
	AUTO("auto"),

	/**
	 * One local provider, or the first non-empty of all local providers.
	 */
	LOCAL("local"),

	/**
	 * One remote provider, or the first non-empty of all remote providers.
	 */
	WEB("web"),

	/**
	 * Every local and remote provider, with their results concatenated per motif type.
	 */
	ALL("all"),

	/**
	 * Only the files of the selected user annotation tool.
	 */
	USER("user");

	private final String name;

	private SourceMode(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	/**
	 * @throws InvalidModeException If no mode has that name
	 */
	public static SourceMode fromName(String name) throws InvalidModeException {
		if (name != null) {
			String key = name.trim().toLowerCase(Locale.ROOT);
			for (SourceMode mode : values()) {
				if (mode.name.equals(key)) return mode;
			}
		}
		throw new InvalidModeException("Unknown source mode '" + name + "'; expected one of " + names());
	}

	public static List<String> names() {
		List<String> names = new ArrayList<>();
		for (SourceMode mode : values()) names.add(mode.name);
		return names;
	}

}
