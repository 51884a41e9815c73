package org.beng183.motifs;

/**
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class UnsupportedToolException extends ConfigurationException {

	private final String toolName;

	public UnsupportedToolException(String toolName) {
		super("Unsupported annotation tool '" + toolName + "'; expected one of " + UserTool.names());
		this.toolName = toolName;
	}

	public String getToolName() {
		return toolName;
	}

}
