package org.beng183.motifs;

/**
 * The source could not be reached: a timeout, a connection failure or a non-success HTTP status.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class UnavailableException extends LoadException {

	public UnavailableException(String message) {
		super(message);
	}

	public UnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

}
