package cn.banny.roxy.pipe;

import cn.banny.roxy.Roxy;

import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tears the whole pairing down as soon as either direction ends: half-closed streams are not kept.
 */
public class CloseTogetherShutdownListener implements ShutdownListener {

    private final CountDownLatch countDownLatch = new CountDownLatch(2);
    private final AtomicBoolean closed = new AtomicBoolean();

    private final Runnable onClose;

    public CloseTogetherShutdownListener(Runnable onClose) {
        this.onClose = onClose;
    }

    @Override
    public void onStreamEnd(Socket in, Socket out) {
        try {
            if (closed.compareAndSet(false, true)) {
                Roxy.closeQuietly(in);
                Roxy.closeQuietly(out);
                if (onClose != null) {
                    onClose.run();
                }
            }
        } finally {
            countDownLatch.countDown();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Blocks until both directions have ended.
     */
    public void waitCountDown(long timeout, TimeUnit unit) throws InterruptedException, IOException {
        if (!countDownLatch.await(timeout, unit)) {
            throw new IOException("Wait failed");
        }
    }

}
