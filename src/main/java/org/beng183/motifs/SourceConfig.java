package org.beng183.motifs;

/**
 * The selection state of a {@link SourceSelector}: a mode, an optional provider it is narrowed to, and the active user tool.
 * Immutable; a resolution reads one snapshot from start to finish.
 * @author dmyersturnbull
 */
public final class SourceConfig {

	private final SourceMode mode;
	private final String narrowing;
	private final UserTool userTool;

	SourceConfig(SourceMode mode, String narrowing, UserTool userTool) {
		this.mode = mode;
		this.narrowing = narrowing;
		this.userTool = userTool;
	}

	public static SourceConfig defaults() {
		return new SourceConfig(SourceMode.AUTO, null, null);
	}

	public SourceMode getMode() {
		return mode;
	}

	/**
	 * The Id of the single provider a {@link SourceMode#LOCAL} or {@link SourceMode#WEB} mode is narrowed to, or null.
	 */
	public String getNarrowing() {
		return narrowing;
	}

	/**
	 * The selected annotation tool; set in {@link SourceMode#USER} mode, and may be remembered from earlier in others.
	 */
	public UserTool getUserTool() {
		return userTool;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(mode.getName());
		if (mode == SourceMode.USER && userTool != null) sb.append(" (").append(userTool.getName()).append(")");
		else if (narrowing != null) sb.append(" (").append(narrowing).append(")");
		return sb.toString();
	}

}
