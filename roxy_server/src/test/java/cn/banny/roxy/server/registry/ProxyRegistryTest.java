package cn.banny.roxy.server.registry;

import cn.banny.roxy.ProxyState;
import cn.banny.roxy.ProxyStatus;
import cn.banny.roxy.forward.ConnectionForwarder;
import cn.banny.roxy.forward.PortForwarder;
import cn.banny.roxy.server.EchoServer;
import junit.framework.TestCase;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class ProxyRegistryTest extends TestCase {

    private EchoServer first;
    private EchoServer second;
    private ProxyRegistry registry;
    private int port;

    @Override
    protected void setUp() throws Exception {
        super.setUp();

        first = new EchoServer("first\n");
        second = new EchoServer("second\n");
        registry = new ProxyRegistry();
        registry.setBindLocal(true);
        registry.setConnectTimeout(2000);
        registry.setStopTimeout(2000);
        port = EchoServer.freePort();
    }

    @Override
    protected void tearDown() throws Exception {
        registry.stopAll();
        first.close();
        second.close();

        super.tearDown();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket();
        socket.setSoTimeout(5000);
        socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 2000);
        return socket;
    }

    private static String read(InputStream in, int length) throws IOException {
        byte[] data = new byte[length];
        IOUtils.readFully(in, data);
        return new String(data, StandardCharsets.UTF_8);
    }

    private static void write(OutputStream out, String data) throws IOException {
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private void waitConnectionCount(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(5);
        int count = -1;
        while (System.currentTimeMillis() < deadline) {
            List<ProxyStatus> status = registry.getStatus();
            count = status.isEmpty() ? -1 : status.get(0).getConnectionCount();
            if (count == expected) {
                return;
            }
            TimeUnit.MILLISECONDS.sleep(20);
        }
        fail("connection count expected " + expected + " but was " + count);
    }

    public void testEnsureRelaysBothDirections() throws Exception {
        assertEquals(ProxyState.ABSENT, registry.getState(port));
        assertEquals(EnsureResult.STARTED, registry.ensure(port, "127.0.0.1", first.getPort()));
        assertEquals(ProxyState.RUNNING, registry.getState(port));
        assertTrue(registry.isRunning(port));

        try (Socket client = connect()) {
            InputStream in = client.getInputStream();
            assertEquals("first\n", read(in, 6));

            String payload = "SSH-2.0-roxy payload é中";
            write(client.getOutputStream(), payload);
            assertEquals(payload, read(in, payload.getBytes(StandardCharsets.UTF_8).length));

            List<ProxyStatus> status = registry.getStatus();
            assertEquals(1, status.size());
            assertEquals(port, status.get(0).getPort());
            assertEquals("127.0.0.1", status.get(0).getTargetHost());
            assertEquals(first.getPort(), status.get(0).getTargetPort());
            assertEquals(1, status.get(0).getConnectionCount());
        }
        waitConnectionCount(0);
    }

    public void testEnsureSameTargetIsNoop() throws Exception {
        assertEquals(EnsureResult.STARTED, registry.ensure(port, "127.0.0.1", first.getPort()));
        assertEquals(EnsureResult.ALREADY_RUNNING, registry.ensure(port, "127.0.0.1", first.getPort()));
        assertEquals(1, registry.getStatus().size());
    }

    public void testReplaceKeepsExistingConnections() throws Exception {
        registry.ensure(port, "127.0.0.1", first.getPort());

        try (Socket old = connect()) {
            assertEquals("first\n", read(old.getInputStream(), 6));

            assertEquals(EnsureResult.REPLACED, registry.ensure(port, "127.0.0.1", second.getPort()));
            assertEquals(second.getPort(), registry.getStatus().get(0).getTargetPort());

            try (Socket fresh = connect()) {
                assertEquals("second\n", read(fresh.getInputStream(), 7));
            }

            write(old.getOutputStream(), "still there");
            assertEquals("still there", read(old.getInputStream(), 11));
        }
    }

    public void testStopRefusesNewConnections() throws Exception {
        registry.ensure(port, "127.0.0.1", first.getPort());

        assertTrue(registry.stop(port));
        assertEquals(ProxyState.ABSENT, registry.getState(port));
        assertTrue(registry.getStatus().isEmpty());
        try {
            connect().close();
            fail("connection to a stopped port must be refused");
        } catch (ConnectException expected) {
        }

        assertFalse(registry.stop(port));
    }

    public void testStopCanCloseConnections() throws Exception {
        registry.setCloseConnectionsOnStop(true);
        registry.ensure(port, "127.0.0.1", first.getPort());

        try (Socket client = connect()) {
            InputStream in = client.getInputStream();
            assertEquals("first\n", read(in, 6));

            registry.stop(port);
            try {
                assertEquals(-1, in.read());
            } catch (IOException reset) {
                // closed by peer
            }
        }
    }

    public void testBindFailureRollsBack() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            int busy = occupied.getLocalPort();
            try {
                registry.ensure(busy, "127.0.0.1", first.getPort());
                fail("bind on a busy port must fail");
            } catch (IOException expected) {
            }
            assertEquals(ProxyState.ABSENT, registry.getState(busy));
            assertFalse(registry.isRunning(busy));
            assertTrue(registry.getStatus().isEmpty());
            assertFalse(registry.stop(busy));
        }
    }

    public void testUnexpectedAcceptLoopExitRemovesEntry() throws Exception {
        final PortForwarder[] created = new PortForwarder[1];
        ProxyRegistry registry = new ProxyRegistry() {
            @Override
            protected PortForwarder createForwarder(int port, String remoteHost, int remotePort) {
                created[0] = super.createForwarder(port, remoteHost, remotePort);
                return created[0];
            }
        };
        registry.setBindLocal(true);
        registry.ensure(port, "127.0.0.1", first.getPort());
        assertEquals(1, registry.getStatus().size());

        registry.onAcceptLoopTerminated(created[0], new IOException("accept loop died"));
        assertEquals(ProxyState.ABSENT, registry.getState(port));
        assertTrue(registry.getStatus().isEmpty());

        assertTrue(created[0].stop(false, 2000));
        assertEquals(EnsureResult.STARTED, registry.ensure(port, "127.0.0.1", first.getPort()));
        registry.stopAll();
    }

    public void testForwarderReportsEndpoints() throws Exception {
        final PortForwarder[] created = new PortForwarder[1];
        ProxyRegistry registry = new ProxyRegistry() {
            @Override
            protected PortForwarder createForwarder(int port, String remoteHost, int remotePort) {
                created[0] = super.createForwarder(port, remoteHost, remotePort);
                return created[0];
            }
        };
        registry.setBindLocal(true);
        registry.ensure(port, "127.0.0.1", first.getPort());
        try (Socket client = connect()) {
            assertEquals("first\n", read(client.getInputStream(), 6));

            ConnectionForwarder[] forwarders = created[0].getForwarders();
            assertEquals(1, forwarders.length);
            assertFalse(forwarders[0].isClosed());
            assertEquals(client.getLocalSocketAddress(), forwarders[0].getClientAddress());
            assertEquals("127.0.0.1", forwarders[0].getDestAddress().getHostString());
            assertEquals(first.getPort(), forwarders[0].getDestAddress().getPort());
        } finally {
            registry.stopAll();
        }
    }

    public void testConnectFailureClosesClient() throws Exception {
        int closed = EchoServer.freePort();
        registry.ensure(port, "127.0.0.1", closed);

        try (Socket client = connect()) {
            try {
                assertEquals(-1, client.getInputStream().read());
            } catch (IOException reset) {
                // closed by peer
            }
        }
        waitConnectionCount(0);
        assertTrue(registry.isRunning(port));
    }

}
