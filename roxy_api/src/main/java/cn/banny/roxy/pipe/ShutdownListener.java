package cn.banny.roxy.pipe;

import java.net.Socket;

public interface ShutdownListener {

    /**
     * Called once per direction after it read end-of-stream or failed.
     * @param in the socket the direction was reading from
     * @param out the socket the direction was writing to
     */
    void onStreamEnd(Socket in, Socket out);

}
