package cn.banny.roxy.server.forward;

import cn.banny.roxy.Roxy;
import cn.banny.roxy.forward.ConnectionForwarder;
import cn.banny.roxy.forward.ForwarderListener;
import cn.banny.roxy.forward.PortForwarder;
import cn.banny.roxy.pipe.CloseTogetherShutdownListener;
import cn.banny.roxy.pipe.StreamPipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects to the remote target on behalf of one accepted client, then relays both directions.
 * The calling thread copies client to remote, a pool thread copies remote to client.
 */
public class BIOConnectionForwarder implements ConnectionForwarder {

    private static final Logger log = LoggerFactory.getLogger(BIOConnectionForwarder.class);

    private final Socket socket;
    private final ForwarderListener forwarderListener;
    private final InetSocketAddress address;
    private final int connectTimeout;
    private final ExecutorService executorService;

    private final Socket remote = new Socket();
    private final AtomicBoolean closed = new AtomicBoolean();

    BIOConnectionForwarder(Socket socket, ForwarderListener forwarderListener, String host, int port, int connectTimeout, ExecutorService executorService) {
        this.socket = socket;
        this.forwarderListener = forwarderListener;
        this.address = InetSocketAddress.createUnresolved(host, port);
        this.connectTimeout = connectTimeout;
        this.executorService = executorService;
    }

    @Override
    public SocketAddress getClientAddress() {
        return socket.getRemoteSocketAddress();
    }

    @Override
    public InetSocketAddress getDestAddress() {
        return address;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void run() {
        try {
            remote.connect(new InetSocketAddress(address.getHostString(), address.getPort()), connectTimeout);
        } catch (IOException e) {
            log.warn("Failed to connect to {}:{}: client={}, {}", address.getHostString(), address.getPort(), getClientAddress(), e.getMessage());
            close();
            return;
        }
        if (closed.get()) {
            Roxy.closeQuietly(remote);
            return;
        }
        forwarderListener.notifyConnectSuccess(this, remote.getLocalSocketAddress());

        DateFormat dateFormat = new SimpleDateFormat("[yyyy-MM-dd HH:mm:ss]");
        String name = dateFormat.format(new Date()) + "ConnectionForwarder => " + socket.getRemoteSocketAddress() + " => " + remote.getRemoteSocketAddress();
        try {
            InputStream clientIn = socket.getInputStream();
            OutputStream clientOut = socket.getOutputStream();
            InputStream remoteIn = remote.getInputStream();
            OutputStream remoteOut = remote.getOutputStream();

            CloseTogetherShutdownListener listener = new CloseTogetherShutdownListener(new Runnable() {
                @Override
                public void run() {
                    close();
                }
            });
            executorService.submit(new StreamPipe(name + " <=", remote, remoteIn, socket, clientOut, PortForwarder.BUFFER_SIZE, listener));
            new StreamPipe(name + " =>", socket, clientIn, remote, remoteOut, PortForwarder.BUFFER_SIZE, listener).run();
        } catch (IOException | RejectedExecutionException e) {
            log.debug("start forward failed: client={}, remote={}", socket, remote, e);
            close();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            Roxy.closeQuietly(socket);
            Roxy.closeQuietly(remote);
            forwarderListener.notifyForwarderClosed(this);
        }
    }

    @Override
    public String toString() {
        return "BIOConnectionForwarder{" +
                "client=" + socket.getRemoteSocketAddress() +
                ", dest=" + address.getHostString() + ':' + address.getPort() +
                '}';
    }

}
