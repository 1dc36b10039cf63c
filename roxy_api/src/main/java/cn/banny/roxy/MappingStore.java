package cn.banny.roxy;

import java.io.IOException;
import java.util.Collection;
import java.util.Set;

/**
 * Durable registry of (remote host, protocol) to external port associations.
 */
public interface MappingStore {

	/**
	 * Returns the external port already assigned to the pair, or allocates, persists and
	 * returns a new one. Concurrent calls for the same pair observe a single allocation.
	 * @throws IOException if the new mapping could not be persisted; nothing is committed then
	 */
	int resolve(String host, Protocol protocol) throws IOException;

	/**
	 * @return all mappings; an empty, missing or unreadable store yields an empty set
	 */
	Set<Mapping> load();

	/**
	 * Replaces the stored contents with <code>mappings</code>.
	 */
	void persist(Collection<Mapping> mappings) throws IOException;

	/**
	 * @return <code>true</code> if a mapping for the pair existed and was removed
	 */
	boolean delete(String host, String protocol) throws IOException;

}
