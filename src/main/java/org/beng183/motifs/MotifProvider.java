package org.beng183.motifs;

/**
 * A source of motif annotations for a structure.
 * Implementations upper-case the PDB Id they are given and never return a result with missing fields.
 * @author dmyersturnbull
 */
public interface MotifProvider {

	/**
	 * Returns the motifs this source knows for the PDB Id.
	 * An empty result means the source has no data for the structure.
	 * @throws NotFoundException If the source has nothing for the structure and says so explicitly
	 * @throws UnavailableException If the source could not be reached
	 * @throws MalformedDataException If the source's content failed validation
	 */
	AnnotationResult getMotifs(String pdbId) throws LoadException;

	ProviderInfo describe();

}
