package cn.banny.roxy.server.store;

import cn.banny.roxy.Mapping;
import cn.banny.roxy.PortAllocator;

import java.util.Collection;

/**
 * Hands out <code>startPort</code> for an empty set, otherwise one above the highest assigned port.
 * Ports vacated by deleted mappings below the maximum are never handed out again.
 */
public class HighWaterMarkPortAllocator implements PortAllocator {

    public static final int DEFAULT_START_PORT = 10000;

    private final int startPort;

    public HighWaterMarkPortAllocator() {
        this(DEFAULT_START_PORT);
    }

    public HighWaterMarkPortAllocator(int startPort) {
        if (startPort < 1 || startPort > 0xffff) {
            throw new IllegalArgumentException("startPort out of range: " + startPort);
        }
        this.startPort = startPort;
    }

    public int getStartPort() {
        return startPort;
    }

    @Override
    public int nextPort(Collection<Mapping> existing) {
        if (existing.isEmpty()) {
            return startPort;
        }

        int max = 0;
        for (Mapping mapping : existing) {
            max = Math.max(max, mapping.getExternalPort());
        }
        if (max >= 0xffff) {
            throw new IllegalStateException("External ports exhausted: max=" + max);
        }
        return max + 1;
    }

}
