package org.beng183.motifs;

/**
 * The source legitimately has nothing for the identifier. A normal outcome, not an error.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class NotFoundException extends LoadException {

	public NotFoundException(String message) {
		super(message);
	}

	public NotFoundException(String message, Throwable cause) {
		super(message, cause);
	}

}
