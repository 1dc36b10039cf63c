package cn.banny.roxy;

/**
 * Protocols that can be forwarded, each bound to the port it is served on by the remote host.
 */
public enum Protocol {

    SSH("ssh", 22),
    TELNET("telnet", 23),
    HTTP("http", 80),
    HTTPS("https", 443);

    private final String name;
    private final int internalPort;

    Protocol(String name, int internalPort) {
        this.name = name;
        this.internalPort = internalPort;
    }

    /**
     * @return the lowercase name used in requests and in the mapping store
     */
    public String getName() {
        return name;
    }

    public int getInternalPort() {
        return internalPort;
    }

    /**
     * @param name exact lowercase protocol name
     * @throws UnsupportedProtocolException if the name is not in the table
     */
    public static Protocol forName(String name) {
        for (Protocol protocol : values()) {
            if (protocol.name.equals(name)) {
                return protocol;
            }
        }
        throw new UnsupportedProtocolException(name);
    }

    public static boolean isSupported(String name) {
        for (Protocol protocol : values()) {
            if (protocol.name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }

}
