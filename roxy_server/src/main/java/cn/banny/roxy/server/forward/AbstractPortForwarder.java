package cn.banny.roxy.server.forward;

import cn.banny.roxy.Roxy;
import cn.banny.roxy.forward.ConnectionForwarder;
import cn.banny.roxy.forward.PortForwarder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public abstract class AbstractPortForwarder implements PortForwarder {

	private static final Logger log = LoggerFactory.getLogger(AbstractPortForwarder.class);

	private final boolean bindLocal;
	protected final int inPort;
	final String outHost;
	final int outPort;

	final Set<ConnectionForwarder> forwards = ConcurrentHashMap.newKeySet();

	AbstractPortForwarder(boolean bindLocal, int inPort, String outHost, int outPort) {
		super();
		if (Roxy.isEmpty(outHost)) {
			throw new IllegalArgumentException("outHost is empty");
		}
		this.bindLocal = bindLocal;
		this.inPort = inPort;
		this.outHost = outHost;
		this.outPort = outPort;
	}

	final InetSocketAddress createBindAddress() {
		return bindLocal ? new InetSocketAddress(InetAddress.getLoopbackAddress(), inPort) : new InetSocketAddress(inPort);
	}

	int listenPort;

	@Override
	public int getListenPort() {
		return listenPort > 0 ? listenPort : inPort;
	}

	@Override
	public String getOutHost() {
		return outHost;
	}

	@Override
	public int getOutPort() {
		return outPort;
	}

	@Override
	public boolean hasTarget(String outHost, int outPort) {
		return this.outHost.equals(outHost) && this.outPort == outPort;
	}

	@Override
	public int getConnectionCount() {
		return forwards.size();
	}

	@Override
	public final ConnectionForwarder[] getForwarders() {
		return forwards.toArray(new ConnectionForwarder[0]);
	}

	final void closeForwarders() {
		for (ConnectionForwarder forwarder : getForwarders()) {
			Roxy.closeQuietly(forwarder);
		}
	}

	/* (non-Javadoc)
	 * @see cn.banny.roxy.forward.ForwarderListener#notifyForwarderClosed(cn.banny.roxy.forward.ConnectionForwarder)
	 */
	@Override
	public final void notifyForwarderClosed(ConnectionForwarder forwarder) {
		boolean removed = forwards.remove(forwarder);
		log.debug("notifyForwarderClosed: client={}, dest={}, removed={}", forwarder.getClientAddress(), forwarder.getDestAddress(), removed);
	}

	@Override
	public void notifyConnectSuccess(ConnectionForwarder forwarder, SocketAddress localAddress) {
		log.debug("notifyConnectSuccess: client={}, dest={}, local={}", forwarder.getClientAddress(), forwarder.getDestAddress(), localAddress);
	}

	@Override
	public final Thread newThread(Runnable r) {
		Thread thread = new Thread(r, getClass().getSimpleName() + ", in=" + inPort + ", host=" + outHost + ", out=" + outPort);
		thread.setDaemon(true);
		return thread;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" +
				"in=" + getListenPort() +
				", out=" + outHost + ':' + outPort +
				'}';
	}

}
