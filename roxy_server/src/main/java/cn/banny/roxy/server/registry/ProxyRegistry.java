package cn.banny.roxy.server.registry;

import cn.banny.roxy.ProxyState;
import cn.banny.roxy.ProxyStatus;
import cn.banny.roxy.forward.AcceptLoopListener;
import cn.banny.roxy.forward.PortForwarder;
import cn.banny.roxy.server.forward.BIOPortForwarder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Table of active listeners keyed by external port, and the only place listeners are started,
 * replaced and stopped. Transitions on one port are serialized by that port's lock; transitions
 * on different ports run independently.
 */
public class ProxyRegistry implements AcceptLoopListener {

    private static final Logger log = LoggerFactory.getLogger(ProxyRegistry.class);

    private static class ProxyEntry {
        final PortForwarder forwarder;
        volatile ProxyState state = ProxyState.STARTING;
        ProxyEntry(PortForwarder forwarder) {
            this.forwarder = forwarder;
        }
    }

    private final Map<Integer, ReentrantLock> portLocks = new ConcurrentHashMap<>();
    private final Map<Integer, ProxyEntry> proxies = new ConcurrentHashMap<>();

    private boolean bindLocal;
    private int connectTimeout = 30000;
    private long stopTimeout = 5000;
    private boolean closeConnectionsOnStop;

    public void setBindLocal(boolean bindLocal) {
        this.bindLocal = bindLocal;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public void setStopTimeout(long stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public void setCloseConnectionsOnStop(boolean closeConnectionsOnStop) {
        this.closeConnectionsOnStop = closeConnectionsOnStop;
    }

    private ReentrantLock lockFor(int port) {
        ReentrantLock lock = portLocks.get(port);
        if (lock == null) {
            ReentrantLock created = new ReentrantLock();
            lock = portLocks.putIfAbsent(port, created);
            if (lock == null) {
                lock = created;
            }
        }
        return lock;
    }

    /**
     * Makes sure a listener on <code>port</code> forwards to <code>remoteHost:remotePort</code>.
     * A listener with another target is stopped first; connections it already accepted are only
     * closed when <code>closeConnectionsOnStop</code> is set.
     * @throws IOException if binding failed; the port is left {@link ProxyState#ABSENT}
     */
    public EnsureResult ensure(int port, String remoteHost, int remotePort) throws IOException {
        if (port < 1 || port > 0xffff) {
            throw new IllegalArgumentException("port out of range: " + port);
        }

        ReentrantLock lock = lockFor(port);
        lock.lock();
        try {
            boolean replaced = false;
            ProxyEntry existing = proxies.get(port);
            if (existing != null) {
                PortForwarder forwarder = existing.forwarder;
                if (existing.state == ProxyState.RUNNING && forwarder.isRunning() && forwarder.hasTarget(remoteHost, remotePort)) {
                    return EnsureResult.ALREADY_RUNNING;
                }
                log.info("Replacing proxy on port {}: {}:{} => {}:{}", port, forwarder.getOutHost(), forwarder.getOutPort(), remoteHost, remotePort);
                stopEntry(port, existing);
                replaced = true;
            }

            ProxyEntry entry = new ProxyEntry(createForwarder(port, remoteHost, remotePort));
            proxies.put(port, entry);
            try {
                entry.forwarder.start();
            } catch (IOException | RuntimeException e) {
                proxies.remove(port, entry);
                log.warn("Failed to start proxy on port {}: {}", port, e.getMessage());
                throw e;
            }
            entry.state = ProxyState.RUNNING;
            return replaced ? EnsureResult.REPLACED : EnsureResult.STARTED;
        } finally {
            lock.unlock();
        }
    }

    protected PortForwarder createForwarder(int port, String remoteHost, int remotePort) {
        return new BIOPortForwarder(bindLocal, port, remoteHost, remotePort, connectTimeout, this);
    }

    /**
     * @return <code>false</code> if no listener was running on the port
     */
    public boolean stop(int port) {
        ReentrantLock lock = lockFor(port);
        lock.lock();
        try {
            ProxyEntry entry = proxies.get(port);
            if (entry == null) {
                log.debug("stop: proxy on port {} was not running", port);
                return false;
            }
            stopEntry(port, entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void stopEntry(int port, ProxyEntry entry) {
        entry.state = ProxyState.STOPPING;
        try {
            if (!entry.forwarder.stop(closeConnectionsOnStop, stopTimeout)) {
                log.warn("Proxy on port {} did not stop within {}ms, removed anyway", port, stopTimeout);
            }
        } finally {
            entry.state = ProxyState.ABSENT;
            proxies.remove(port, entry);
        }
        log.info("Stopped proxy on port {}", port);
    }

    /**
     * Stops every listener, in port order.
     */
    public void stopAll() {
        for (Integer port : new TreeSet<>(proxies.keySet())) {
            stop(port);
        }
    }

    /* (non-Javadoc)
     * @see cn.banny.roxy.forward.AcceptLoopListener#onAcceptLoopTerminated(cn.banny.roxy.forward.PortForwarder, java.lang.Throwable)
     */
    @Override
    public void onAcceptLoopTerminated(PortForwarder forwarder, Throwable cause) {
        for (Map.Entry<Integer, ProxyEntry> entry : proxies.entrySet()) {
            ProxyEntry proxy = entry.getValue();
            if (proxy.forwarder == forwarder && proxies.remove(entry.getKey(), proxy)) {
                proxy.state = ProxyState.ABSENT;
                log.warn("Proxy on port {} terminated unexpectedly and was removed", entry.getKey(), cause);
            }
        }
    }

    public ProxyState getState(int port) {
        ProxyEntry entry = proxies.get(port);
        return entry == null ? ProxyState.ABSENT : entry.state;
    }

    public boolean isRunning(int port) {
        ProxyEntry entry = proxies.get(port);
        return entry != null && entry.state == ProxyState.RUNNING && entry.forwarder.isRunning();
    }

    /**
     * @return running listeners sorted by port
     */
    public List<ProxyStatus> getStatus() {
        Map<Integer, ProxyStatus> sorted = new TreeMap<>();
        for (Map.Entry<Integer, ProxyEntry> entry : proxies.entrySet()) {
            ProxyEntry proxy = entry.getValue();
            if (proxy.state != ProxyState.RUNNING || !proxy.forwarder.isRunning()) {
                continue;
            }
            PortForwarder forwarder = proxy.forwarder;
            sorted.put(entry.getKey(), new ProxyStatus(entry.getKey(), forwarder.getOutHost(), forwarder.getOutPort(), forwarder.getConnectionCount()));
        }
        return new ArrayList<>(sorted.values());
    }

}
