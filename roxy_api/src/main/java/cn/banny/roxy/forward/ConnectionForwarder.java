package cn.banny.roxy.forward;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * One accepted client connection paired with its outbound connection.
 */
public interface ConnectionForwarder extends Closeable, Runnable {

	SocketAddress getClientAddress();

	InetSocketAddress getDestAddress();

	boolean isClosed();

}
