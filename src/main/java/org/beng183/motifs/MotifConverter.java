package org.beng183.motifs;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * Turns the output file of an external annotation tool into motif instances grouped by motif type.
 * This is the only place that knows about tool-specific columns and delimiters.
 * @author dmyersturnbull
 */
public interface MotifConverter {

	/**
	 * Reads the whole file.
	 * Malformed rows are skipped with a warning; a malformed header fails the whole file.
	 * @param pdbId The structure the file describes, for formats that don't name it per row
	 * @return Instances by motif type, in file order within each type
	 * @throws MalformedDataException If the header is invalid or the file isn't UTF-8
	 * @throws NotFoundException If the file doesn't exist
	 * @throws UnavailableException If the file couldn't be read
	 */
	Map<String, List<MotifInstance>> convert(File file, String pdbId) throws LoadException;

	/**
	 * The Id stamped on every instance this converter produces.
	 */
	String getSourceId();

}
