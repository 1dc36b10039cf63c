package cn.banny.roxy.server;

import cn.banny.roxy.Roxy;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Remote target for tests: greets every connection, then echoes what it receives.
 */
public class EchoServer implements Runnable, AutoCloseable {

    private final ServerSocket serverSocket;
    private final byte[] greeting;

    public EchoServer(String greeting) throws IOException {
        this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        this.greeting = greeting.getBytes(StandardCharsets.UTF_8);

        Thread thread = new Thread(this, "EchoServer-" + serverSocket.getLocalPort());
        thread.setDaemon(true);
        thread.start();
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public void run() {
        while (!serverSocket.isClosed()) {
            final Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                return;
            }
            Thread thread = new Thread(new Runnable() {
                @Override
                public void run() {
                    echo(socket);
                }
            });
            thread.setDaemon(true);
            thread.start();
        }
    }

    private void echo(Socket socket) {
        try {
            InputStream in = socket.getInputStream();
            OutputStream out = socket.getOutputStream();
            out.write(greeting);
            out.flush();
            byte[] buf = new byte[1024];
            int read;
            while ((read = in.read(buf)) != Roxy.EOF) {
                out.write(buf, 0, read);
                out.flush();
            }
        } catch (IOException ignored) {
        } finally {
            Roxy.closeQuietly(socket);
        }
    }

    @Override
    public void close() {
        Roxy.closeQuietly(serverSocket);
    }

    public static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

}
