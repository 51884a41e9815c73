package org.beng183.motifs;

import java.util.List;

/**
 * A {@link MotifProvider} that knows up front which structures it has data for.
 * @author dmyersturnbull
 */
public interface IndexedMotifProvider extends MotifProvider {

	/**
	 * @return Upper-case PDB Ids, sorted
	 */
	List<String> getAvailablePdbIds();

}
