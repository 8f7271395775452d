package org.fibercable.server;

public class CableConfig {

    private int heartbeatIntervalInMs = 3000;
    private int workerPoolSize = 4;
    private String internalTopicPrefix = "cable/internal/";
    private long shutdownTimeoutInMs = 5000;

    /**
     * @param ms interval between pings, 0 or less to disable them.
     */
    public void setHeartbeatIntervalInMs(int ms) {
        this.heartbeatIntervalInMs = ms;
    }

    public int getHeartbeatIntervalInMs() {
        return heartbeatIntervalInMs;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be positive: " + workerPoolSize);
        }
        this.workerPoolSize = workerPoolSize;
    }

    public String getInternalTopicPrefix() {
        return internalTopicPrefix;
    }

    public void setInternalTopicPrefix(String internalTopicPrefix) {
        this.internalTopicPrefix = internalTopicPrefix;
    }

    public long getShutdownTimeoutInMs() {
        return shutdownTimeoutInMs;
    }

    /**
     * @param ms how long dispose waits for each connection's teardown.
     */
    public void setShutdownTimeoutInMs(long ms) {
        this.shutdownTimeoutInMs = ms;
    }
}
