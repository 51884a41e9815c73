package org.beng183.motifs;

/**
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class InvalidModeException extends ConfigurationException {

	public InvalidModeException(String message) {
		super(message);
	}

}
