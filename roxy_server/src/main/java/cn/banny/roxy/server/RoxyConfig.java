package cn.banny.roxy.server;

import cn.banny.roxy.server.store.HighWaterMarkPortAllocator;
import cn.banny.roxy.server.store.JsonMappingStore;

import java.io.File;

public class RoxyConfig {

    private File mappingFile = new File(JsonMappingStore.DEFAULT_FILE);
    private int startPort = HighWaterMarkPortAllocator.DEFAULT_START_PORT;
    private boolean bindLocal;
    private int connectTimeout = 30000;
    private long stopTimeout = 5000;
    private boolean closeConnectionsOnStop;
    private boolean debug;

    public File getMappingFile() {
        return mappingFile;
    }

    public void setMappingFile(File mappingFile) {
        this.mappingFile = mappingFile;
    }

    public int getStartPort() {
        return startPort;
    }

    public void setStartPort(int startPort) {
        this.startPort = startPort;
    }

    public boolean isBindLocal() {
        return bindLocal;
    }

    public void setBindLocal(boolean bindLocal) {
        this.bindLocal = bindLocal;
    }

    /**
     * @return milliseconds allowed for connecting to the remote target
     */
    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    /**
     * @return milliseconds to wait for an accept loop to exit after its socket was closed
     */
    public long getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(long stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public boolean isCloseConnectionsOnStop() {
        return closeConnectionsOnStop;
    }

    public void setCloseConnectionsOnStop(boolean closeConnectionsOnStop) {
        this.closeConnectionsOnStop = closeConnectionsOnStop;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    @Override
    public String toString() {
        return "RoxyConfig{" +
                "mappingFile=" + mappingFile +
                ", startPort=" + startPort +
                ", bindLocal=" + bindLocal +
                ", connectTimeout=" + connectTimeout +
                ", stopTimeout=" + stopTimeout +
                ", closeConnectionsOnStop=" + closeConnectionsOnStop +
                ", debug=" + debug +
                '}';
    }

}
