package cn.banny.roxy.daemon;

import cn.banny.roxy.Mapping;
import cn.banny.roxy.ProxyStatus;

import java.io.PrintStream;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Plain text rendering of the registry and mapping snapshots.
 */
class StatusTable {

    static void printStatus(PrintStream out, List<ProxyStatus> status) {
        if (status.isEmpty()) {
            out.println("No active proxies");
            return;
        }
        out.println(String.format("%-8s %-40s %-8s %s", "PORT", "TARGET HOST", "TARGET", "CONNECTIONS"));
        for (ProxyStatus proxy : status) {
            out.println(String.format("%-8d %-40s %-8d %d", proxy.getPort(), proxy.getTargetHost(), proxy.getTargetPort(), proxy.getConnectionCount()));
        }
        out.println(status.size() == 1 ? "1 active proxy" : status.size() + " active proxies");
    }

    static void printMappings(PrintStream out, Collection<Mapping> mappings) {
        if (mappings.isEmpty()) {
            out.println("No port mappings configured");
            return;
        }
        out.println(String.format("%-40s %-8s %-8s %s", "IP ADDRESS", "PROTOCOL", "INTERNAL", "EXTERNAL"));
        for (Mapping mapping : new TreeSet<>(mappings)) {
            String internal = mapping.isSupported() ? String.valueOf(mapping.getInternalPort()) : "?";
            out.println(String.format("%-40s %-8s %-8s %d", mapping.getHost(), mapping.getProtocol(), internal, mapping.getExternalPort()));
        }
        out.println(mappings.size() == 1 ? "1 port mapping configured" : mappings.size() + " port mappings configured");
    }

}
