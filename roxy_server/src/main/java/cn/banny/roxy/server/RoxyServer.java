package cn.banny.roxy.server;

import cn.banny.roxy.BootstrapResult;
import cn.banny.roxy.Mapping;
import cn.banny.roxy.MappingStore;
import cn.banny.roxy.PortForwardService;
import cn.banny.roxy.Protocol;
import cn.banny.roxy.ProxyStatus;
import cn.banny.roxy.Roxy;
import cn.banny.roxy.server.registry.EnsureResult;
import cn.banny.roxy.server.registry.ProxyRegistry;
import cn.banny.roxy.server.store.HighWaterMarkPortAllocator;
import cn.banny.roxy.server.store.JsonMappingStore;
import org.apache.mina.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ties the mapping store to the proxy registry: resolves requested pairs to external ports,
 * keeps a listener running for each of them and rebuilds the listeners on start.
 */
public class RoxyServer implements PortForwardService {

    private static final Logger log = LoggerFactory.getLogger(RoxyServer.class);

    private final MappingStore store;
    private final ProxyRegistry registry;

    private final Map<String, ReentrantLock> pairLocks = new ConcurrentHashMap<>();

    public RoxyServer(MappingStore store, ProxyRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    public static RoxyServer create(RoxyConfig config) {
        MappingStore store = new JsonMappingStore(config.getMappingFile(), new HighWaterMarkPortAllocator(config.getStartPort()));
        ProxyRegistry registry = new ProxyRegistry();
        registry.setBindLocal(config.isBindLocal());
        registry.setConnectTimeout(config.getConnectTimeout());
        registry.setStopTimeout(config.getStopTimeout());
        registry.setCloseConnectionsOnStop(config.isCloseConnectionsOnStop());
        return new RoxyServer(store, registry);
    }

    public MappingStore getStore() {
        return store;
    }

    public ProxyRegistry getRegistry() {
        return registry;
    }

    @Override
    public int requestForward(String host, String protocol) throws IOException {
        if (Roxy.isEmpty(host)) {
            throw new IllegalArgumentException("Please specify both protocol and IP.");
        }
        Protocol resolved = Protocol.forName(protocol);

        ReentrantLock lock = lockFor(host, protocol);
        lock.lock();
        try {
            int port = store.resolve(host, resolved);
            EnsureResult result = registry.ensure(port, host, resolved.getInternalPort());
            log.debug("requestForward: host={}, protocol={}, port={}, result={}", host, protocol, port, result);
            return port;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs under the same per-pair lock as {@link #requestForward(String, String)}, so a
     * concurrent request for the pair sees either the mapping with its listener or neither.
     */
    @Override
    public boolean removeForward(String host, String protocol) throws IOException {
        ReentrantLock lock = lockFor(host, protocol);
        lock.lock();
        try {
            Mapping found = null;
            for (Mapping mapping : store.load()) {
                if (mapping.matches(host, protocol)) {
                    found = mapping;
                    break;
                }
            }
            if (found == null) {
                return false;
            }

            boolean deleted = store.delete(host, protocol);
            registry.stop(found.getExternalPort());
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String host, String protocol) {
        String key = Roxy.toKey(host, protocol);
        ReentrantLock lock = pairLocks.get(key);
        if (lock == null) {
            ReentrantLock created = new ReentrantLock();
            lock = pairLocks.putIfAbsent(key, created);
            if (lock == null) {
                lock = created;
            }
        }
        return lock;
    }

    @Override
    public Set<Mapping> getMappings() {
        return store.load();
    }

    @Override
    public List<ProxyStatus> getStatus() {
        return registry.getStatus();
    }

    @Override
    public BootstrapResult bootstrap() {
        final BootstrapReport report = new BootstrapReport();
        Set<Mapping> mappings = store.load();
        if (mappings.isEmpty()) {
            log.info("No port mappings configured");
            return report;
        }

        ExecutorService executorService = Executors.newCachedThreadPool(new DaemonThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(mappings.size());
            for (final Mapping mapping : mappings) {
                if (!mapping.isSupported()) {
                    log.warn("Protocol '{}' not recognized. Skipping mapping for {}:{}", mapping.getProtocol(), mapping.getHost(), mapping.getExternalPort());
                    report.addSkipped(mapping);
                    continue;
                }

                futures.add(executorService.submit(new Runnable() {
                    @Override
                    public void run() {
                        restart(mapping, report);
                    }
                }));
            }

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.warn("bootstrap task failed", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("bootstrap interrupted: {}", report);
        } finally {
            executorService.shutdown();
        }

        log.info("Bootstrap finished: {}", report);
        return report;
    }

    private void restart(Mapping mapping, BootstrapReport report) {
        int port = mapping.getExternalPort();
        int internalPort = mapping.getInternalPort();
        try {
            registry.ensure(port, mapping.getHost(), internalPort);
            report.addStarted(port);
            log.info("Restarted proxy on port {} to {}:{}", port, mapping.getHost(), internalPort);
        } catch (IOException | RuntimeException e) {
            report.addFailure(port, String.valueOf(e.getMessage()));
            log.warn("Failed to restart proxy on port {} to {}:{}", port, mapping.getHost(), internalPort, e);
        }
    }

    @Override
    public void shutdown() {
        registry.stopAll();
    }

}
