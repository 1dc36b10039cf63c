package cn.banny.roxy;

/**
 * Read-only snapshot of one active listener.
 */
public final class ProxyStatus {

    private final int port;
    private final String targetHost;
    private final int targetPort;
    private final int connectionCount;

    public ProxyStatus(int port, String targetHost, int targetPort, int connectionCount) {
        this.port = port;
        this.targetHost = targetHost;
        this.targetPort = targetPort;
        this.connectionCount = connectionCount;
    }

    public int getPort() {
        return port;
    }

    public String getTargetHost() {
        return targetHost;
    }

    public int getTargetPort() {
        return targetPort;
    }

    public int getConnectionCount() {
        return connectionCount;
    }

    @Override
    public String toString() {
        return "ProxyStatus{" +
                "port=" + port +
                ", target=" + targetHost + ':' + targetPort +
                ", connections=" + connectionCount +
                '}';
    }

}
