package cn.banny.roxy.forward;

import java.io.IOException;
import java.util.concurrent.ThreadFactory;

/**
 * A listener bound on one external port that forwards every accepted connection to a
 * fixed remote target.
 */
public interface PortForwarder extends ForwarderListener, ThreadFactory {

	int BUFFER_SIZE = 4096;

	String getOutHost();
	int getOutPort();

	int getListenPort();

	/**
	 * Binds the listening socket and starts the accept loop.
	 * @return the bound port
	 * @throws IOException if binding failed; no thread is left running then
	 */
	int start() throws IOException;

	/**
	 * Closes the listening socket and waits for the accept loop to exit.
	 * @param closeConnections also close connections already being forwarded
	 * @param timeoutMillis bound on the wait for the accept loop
	 * @return <code>true</code> if the accept loop acknowledged termination in time
	 */
	boolean stop(boolean closeConnections, long timeoutMillis);

	boolean isRunning();

	/**
	 * @return number of connection pairs currently being forwarded
	 */
	int getConnectionCount();

	ConnectionForwarder[] getForwarders();

	boolean hasTarget(String outHost, int outPort);

}
