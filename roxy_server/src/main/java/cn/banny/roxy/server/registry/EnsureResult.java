package cn.banny.roxy.server.registry;

public enum EnsureResult {

    /**
     * No listener was running, one has been bound.
     */
    STARTED,

    /**
     * A listener was already forwarding to the same target.
     */
    ALREADY_RUNNING,

    /**
     * A listener forwarding to another target was stopped and a new one bound.
     */
    REPLACED

}
