package org.beng183.motifs;

/**
 * The source answered, but the content failed validation (bad header, bad encoding, unparsable payload).
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class MalformedDataException extends LoadException {

	public MalformedDataException(String message) {
		super(message);
	}

	public MalformedDataException(String message, Throwable cause) {
		super(message, cause);
	}

}
