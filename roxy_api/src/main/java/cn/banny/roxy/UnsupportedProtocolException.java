package cn.banny.roxy;

/**
 * Thrown when a protocol name has no entry in the {@link Protocol} table.
 */
public class UnsupportedProtocolException extends IllegalArgumentException {

    private static final long serialVersionUID = 2025787433245046187L;

    private final String protocol;

    public UnsupportedProtocolException(String protocol) {
        super("Unsupported protocol '" + protocol + "'.");
        this.protocol = protocol;
    }

    public String getProtocol() {
        return protocol;
    }

}
