package org.beng183.motifs;

/**
 * Where a {@link MotifProvider} gets its data. Only {@link #REMOTE} providers go through the {@link MotifCache}.
 * @author dmyersturnbull
 */
public enum SourceKind {

	LOCAL("local"), REMOTE("web"), USER("user");

	private final String name;

	private SourceKind(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

}
