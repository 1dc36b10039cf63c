package cn.banny.roxy.forward;

/**
 * Receives the exit of an accept loop that was not requested through {@link PortForwarder#stop(boolean, long)}.
 */
public interface AcceptLoopListener {

    void onAcceptLoopTerminated(PortForwarder forwarder, Throwable cause);

}
