package cn.banny.roxy.server;

import cn.banny.roxy.BootstrapResult;
import cn.banny.roxy.Mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

class BootstrapReport implements BootstrapResult {

    private final List<Integer> startedPorts = new ArrayList<>();
    private final List<Mapping> skipped = new ArrayList<>();
    private final Map<Integer, String> failures = new TreeMap<>();

    synchronized void addStarted(int port) {
        startedPorts.add(port);
    }

    synchronized void addSkipped(Mapping mapping) {
        skipped.add(mapping);
    }

    synchronized void addFailure(int port, String reason) {
        failures.put(port, reason);
    }

    @Override
    public synchronized List<Integer> getStartedPorts() {
        List<Integer> ports = new ArrayList<>(startedPorts);
        Collections.sort(ports);
        return ports;
    }

    @Override
    public synchronized List<Mapping> getSkipped() {
        return new ArrayList<>(skipped);
    }

    @Override
    public synchronized Map<Integer, String> getFailures() {
        return new TreeMap<>(failures);
    }

    @Override
    public synchronized String toString() {
        return "BootstrapReport{" +
                "started=" + startedPorts.size() +
                ", skipped=" + skipped.size() +
                ", failed=" + failures.size() +
                '}';
    }

}
