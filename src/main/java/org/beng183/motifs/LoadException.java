package org.beng183.motifs;

/**
 * A failure to get motif data out of a source.
 * Providers throw one of the subclasses; the {@link SourceSelector} absorbs all of them into "contributes nothing".
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class LoadException extends Exception {

	public LoadException() {
		super();
	}

	public LoadException(String message, Throwable cause) {
		super(message, cause);
	}

	public LoadException(String message) {
		super(message);
	}

	public LoadException(Throwable cause) {
		super(cause);
	}

}
