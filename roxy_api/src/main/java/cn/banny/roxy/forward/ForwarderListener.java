package cn.banny.roxy.forward;

import java.net.SocketAddress;

public interface ForwarderListener {

	void notifyForwarderClosed(ConnectionForwarder forwarder);

	void notifyConnectSuccess(ConnectionForwarder forwarder, SocketAddress localAddress);

}
