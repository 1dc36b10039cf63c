package cn.banny.roxy.server.forward;

import cn.banny.roxy.Roxy;
import cn.banny.roxy.forward.AcceptLoopListener;
import cn.banny.roxy.forward.ConnectionForwarder;
import cn.banny.roxy.forward.PortForwarder;
import org.apache.mina.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Blocking listener: one thread runs the accept loop, every accepted socket is handed to a
 * {@link BIOConnectionForwarder} on the connection pool.
 */
public class BIOPortForwarder extends AbstractPortForwarder implements PortForwarder, Runnable {

    private static final Logger log = LoggerFactory.getLogger(BIOPortForwarder.class);

    static final long ACCEPT_RETRY_DELAY_MILLIS = 100;

    private final int connectTimeout;
    private final AcceptLoopListener acceptLoopListener;

    public BIOPortForwarder(boolean bindLocal, int inPort, String outHost, int outPort, int connectTimeout, AcceptLoopListener acceptLoopListener) {
        super(bindLocal, inPort, outHost, outPort);
        this.connectTimeout = connectTimeout;
        this.acceptLoopListener = acceptLoopListener;
    }

    private volatile boolean canStop;
    private volatile boolean running;
    private ServerSocket serverSocket;
    private ExecutorService executorService;
    private Thread acceptThread;
    private final CountDownLatch acceptLoopExited = new CountDownLatch(1);

    @Override
    public synchronized int start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Already started: " + this);
        }

        ServerSocket serverSocket = new ServerSocket();
        try {
            serverSocket.setReuseAddress(true);
            serverSocket.bind(createBindAddress());
        } catch (IOException e) {
            Roxy.closeQuietly(serverSocket);
            throw e;
        }

        this.serverSocket = serverSocket;
        executorService = Executors.newCachedThreadPool(new DaemonThreadFactory());
        listenPort = serverSocket.getLocalPort();
        canStop = false;
        running = true;
        acceptThread = newThread(this);
        acceptThread.start();
        return listenPort;
    }

    @Override
    public boolean stop(boolean closeConnections, long timeoutMillis) {
        ServerSocket serverSocket;
        ExecutorService executorService;
        Thread acceptThread;
        synchronized (this) {
            serverSocket = this.serverSocket;
            executorService = this.executorService;
            acceptThread = this.acceptThread;
        }
        if (serverSocket == null) {
            return true;
        }

        canStop = true;
        Roxy.closeQuietly(serverSocket);

        boolean acknowledged = true;
        if (Thread.currentThread() != acceptThread) {
            try {
                acknowledged = acceptLoopExited.await(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                acknowledged = false;
            }
        }
        if (!acknowledged) {
            log.warn("Accept loop did not acknowledge stop within {}ms: {}", timeoutMillis, this);
        }

        if (closeConnections) {
            closeForwarders();
            executorService.shutdownNow();
        } else {
            executorService.shutdown();
        }
        return acknowledged;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        log.info("Started proxy on port {} to {}:{}", listenPort, outHost, outPort);
        Throwable cause = null;
        try {
            while (!canStop) {
                Socket socket;
                try {
                    socket = accept(serverSocket);
                } catch (IOException e) {
                    if (canStop || serverSocket.isClosed()) {
                        break;
                    }
                    log.warn("accept failed: {}", this, e);
                    try {
                        TimeUnit.MILLISECONDS.sleep(ACCEPT_RETRY_DELAY_MILLIS);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        cause = ie;
                        break;
                    }
                    continue;
                }

                ConnectionForwarder forwarder = createForward(socket);
                forwards.add(forwarder);
                try {
                    executorService.submit(forwarder);
                    log.debug("Accepted connection from {} on port {}", socket.getRemoteSocketAddress(), listenPort);
                } catch (RejectedExecutionException e) {
                    log.debug("createForward rejected: socket={}", socket, e);
                    Roxy.closeQuietly(forwarder);
                }
            }
        } catch (Throwable t) {
            cause = t;
            log.warn("Accept loop failed: {}", this, t);
        } finally {
            running = false;
            Roxy.closeQuietly(serverSocket);
            acceptLoopExited.countDown();
            log.info("Proxy on port {} has been stopped.", listenPort);
            if (!canStop && acceptLoopListener != null) {
                acceptLoopListener.onAcceptLoopTerminated(this, cause);
            }
        }
    }

    protected Socket accept(ServerSocket serverSocket) throws IOException {
        return serverSocket.accept();
    }

    private ConnectionForwarder createForward(Socket socket) {
        return new BIOConnectionForwarder(socket, this, outHost, outPort, connectTimeout, executorService);
    }

}
