package cn.banny.roxy;

import java.util.Collection;

/**
 * Derives the external port for a new mapping.
 */
public interface PortAllocator {

    int nextPort(Collection<Mapping> existing);

}
