package org.beng183.motifs;

/**
 * A usage mistake in selecting sources. Unlike a {@link LoadException}, this always reaches the caller.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class ConfigurationException extends Exception {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
