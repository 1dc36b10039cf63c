package cn.banny.roxy;

/**
 * A persisted association of a (remote host, protocol) pair with its external port.
 * <p>
 * The protocol is kept as the raw name read from the store, so stale records with a
 * protocol that is no longer supported can still be loaded and reported.
 */
public final class Mapping implements Comparable<Mapping> {

    private final String host;
    private final String protocol;
    private final int externalPort;

    public Mapping(String host, String protocol, int externalPort) {
        if (Roxy.isEmpty(host)) {
            throw new IllegalArgumentException("host is empty");
        }
        if (Roxy.isEmpty(protocol)) {
            throw new IllegalArgumentException("protocol is empty");
        }
        if (externalPort < 1 || externalPort > 0xffff) {
            throw new IllegalArgumentException("externalPort out of range: " + externalPort);
        }
        this.host = host;
        this.protocol = protocol;
        this.externalPort = externalPort;
    }

    public Mapping(String host, Protocol protocol, int externalPort) {
        this(host, protocol.getName(), externalPort);
    }

    public String getHost() {
        return host;
    }

    public String getProtocol() {
        return protocol;
    }

    public int getExternalPort() {
        return externalPort;
    }

    public boolean isSupported() {
        return Protocol.isSupported(protocol);
    }

    /**
     * @throws UnsupportedProtocolException for a stale record
     */
    public Protocol resolveProtocol() {
        return Protocol.forName(protocol);
    }

    /**
     * @return the port on the remote host traffic is forwarded to
     * @throws UnsupportedProtocolException for a stale record
     */
    public int getInternalPort() {
        return resolveProtocol().getInternalPort();
    }

    public String getKey() {
        return Roxy.toKey(host, protocol);
    }

    public boolean matches(String host, String protocol) {
        return this.host.equals(host) && this.protocol.equals(protocol);
    }

    @Override
    public int compareTo(Mapping o) {
        int result = Integer.compare(externalPort, o.externalPort);
        if (result == 0) {
            result = host.compareTo(o.host);
        }
        if (result == 0) {
            result = protocol.compareTo(o.protocol);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Mapping mapping = (Mapping) o;
        return externalPort == mapping.externalPort &&
                host.equals(mapping.host) &&
                protocol.equals(mapping.protocol);
    }

    @Override
    public int hashCode() {
        int result = host.hashCode();
        result = 31 * result + protocol.hashCode();
        result = 31 * result + externalPort;
        return result;
    }

    @Override
    public String toString() {
        return "Mapping{" +
                "host='" + host + '\'' +
                ", protocol='" + protocol + '\'' +
                ", externalPort=" + externalPort +
                '}';
    }

}
