package org.beng183.motifs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * An external tool whose output files can be loaded as user annotations.
 * @author dmyersturnbull
 */
public enum UserTool {

	FR3D("fr3d", "FR3D") {
		@Override
		public MotifConverter createConverter() {
			return new Fr3dConverter();
		}
	},

	RNAMOTIFSCAN("rnamotifscan", "RNAMotifScan") {
		@Override
		public MotifConverter createConverter() {
			return new RnaMotifScanConverter();
		}
	};

	private final String name;
	private final String displayName;

	private UserTool(String name, String displayName) {
		this.name = name;
		this.displayName = displayName;
	}

	public abstract MotifConverter createConverter();

	/**
	 * The lower-case name, which is also the name of the tool's sub-directory of user annotation files.
	 */
	public String getName() {
		return name;
	}

	public String getDisplayName() {
		return displayName;
	}

	/**
	 * Looks up a tool by name, ignoring case and surrounding whitespace.
	 * @throws UnsupportedToolException If no tool has that name
	 */
	public static UserTool fromName(String name) throws UnsupportedToolException {
		if (name != null) {
			String key = name.trim().toLowerCase(Locale.ROOT);
			for (UserTool tool : values()) {
				if (tool.name.equals(key)) return tool;
			}
		}
		throw new UnsupportedToolException(name);
	}

	public static List<String> names() {
		List<String> names = new ArrayList<>();
		for (UserTool tool : values()) names.add(tool.name);
		return names;
	}

}
