package cn.banny.roxy.pipe;

import cn.banny.roxy.Roxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * Copies bytes from one socket to another until end-of-stream or an I/O error.
 */
public class StreamPipe implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamPipe.class);

    private final String name;
    private final Socket in;
    private final InputStream inputStream;
    private final Socket out;
    private final OutputStream outputStream;
    private final int bufferSize;
    private final ShutdownListener shutdownListener;

    private volatile long transferred;

    public StreamPipe(String name, Socket in, InputStream inputStream, Socket out, OutputStream outputStream, int bufferSize, ShutdownListener shutdownListener) {
        this.name = name;
        this.in = in;
        this.inputStream = inputStream;
        this.out = out;
        this.outputStream = outputStream;
        this.bufferSize = bufferSize;
        this.shutdownListener = shutdownListener;
    }

    public long getTransferred() {
        return transferred;
    }

    @Override
    public void run() {
        Thread thread = Thread.currentThread();
        String backupThreadName = thread.getName();
        if (name != null) {
            thread.setName(name);
        }
        try {
            byte[] buf = new byte[bufferSize];
            int read;
            while ((read = inputStream.read(buf)) != Roxy.EOF) {
                outputStream.write(buf, 0, read);
                outputStream.flush();
                transferred += read;
            }
            log.debug("stream end: in={}, out={}, transferred={}", in, out, transferred);
        } catch (IOException e) {
            log.debug("stream failed: in={}, out={}, transferred={}", in, out, transferred, e);
        } finally {
            try {
                shutdownListener.onStreamEnd(in, out);
            } finally {
                thread.setName(backupThreadName);
            }
        }
    }

}
