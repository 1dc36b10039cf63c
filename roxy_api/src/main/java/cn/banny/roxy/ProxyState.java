package cn.banny.roxy;

/**
 * Lifecycle of the listener bound on one external port.
 */
public enum ProxyState {

    ABSENT,
    STARTING,
    RUNNING,
    STOPPING

}
