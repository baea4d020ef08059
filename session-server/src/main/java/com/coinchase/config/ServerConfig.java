package com.coinchase.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server settings. Immutable; build with {@link #builder()} or parse from
 * {@code key=value} command line arguments with {@link #fromArgs(String[])}.
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    private final int httpPort;
    private final int workerCount;
    private final int workerBasePort;
    private final int readIdleSeconds;
    private final int dialTimeoutSeconds;
    private final int faultTolerance;
    private final long broadcastIntervalMillis;
    private final long livenessIntervalMillis;
    private final long livenessTimeoutMillis;
    private final int mapSize;
    private final int coinCount;
    private final int itemCount;
    private final int eventQueueCapacity;

    private ServerConfig(Builder builder) {
        this.httpPort = builder.httpPort;
        this.workerCount = builder.workerCount;
        this.workerBasePort = builder.workerBasePort;
        this.readIdleSeconds = builder.readIdleSeconds;
        this.dialTimeoutSeconds = builder.dialTimeoutSeconds;
        this.faultTolerance = builder.faultTolerance;
        this.broadcastIntervalMillis = builder.broadcastIntervalMillis;
        this.livenessIntervalMillis = builder.livenessIntervalMillis;
        this.livenessTimeoutMillis = builder.livenessTimeoutMillis;
        this.mapSize = builder.mapSize;
        this.coinCount = builder.coinCount;
        this.itemCount = builder.itemCount;
        this.eventQueueCapacity = builder.eventQueueCapacity;
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    /**
     * Parses arguments such as {@code httpPort=9000 workers=4}. Unknown keys
     * and malformed values are logged and the default is kept.
     */
    public static ServerConfig fromArgs(String[] args) {
        Builder builder = builder();
        for (String arg : args) {
            int separator = arg.indexOf('=');
            if (separator <= 0) {
                logger.warn("Ignoring argument '{}', expected key=value", arg);
                continue;
            }
            String key = arg.substring(0, separator).trim();
            String value = arg.substring(separator + 1).trim();
            try {
                builder.set(key, value);
            } catch (NumberFormatException e) {
                logger.warn("Invalid value '{}' for {}, keeping the default", value, key);
            }
        }
        return builder.build();
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Port of worker 0; worker i listens on base + i. Zero lets the OS pick.
     */
    public int getWorkerBasePort() {
        return workerBasePort;
    }

    public int workerPort(int workerId) {
        return workerBasePort == 0 ? 0 : workerBasePort + workerId;
    }

    public int getReadIdleSeconds() {
        return readIdleSeconds;
    }

    public int getDialTimeoutSeconds() {
        return dialTimeoutSeconds;
    }

    public int getFaultTolerance() {
        return faultTolerance;
    }

    public long getBroadcastIntervalMillis() {
        return broadcastIntervalMillis;
    }

    public long getLivenessIntervalMillis() {
        return livenessIntervalMillis;
    }

    public long getLivenessTimeoutMillis() {
        return livenessTimeoutMillis;
    }

    public int getMapSize() {
        return mapSize;
    }

    public int getCoinCount() {
        return coinCount;
    }

    public int getItemCount() {
        return itemCount;
    }

    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int httpPort = 8080;
        private int workerCount = 16;
        private int workerBasePort = 40000;
        private int readIdleSeconds = 300;
        private int dialTimeoutSeconds = 300;
        private int faultTolerance = 100;
        private long broadcastIntervalMillis = 100;
        private long livenessIntervalMillis = 10_000;
        private long livenessTimeoutMillis = 2_000;
        private int mapSize = 100;
        private int coinCount = 100;
        private int itemCount = 10;
        private int eventQueueCapacity = 4096;

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder workerBasePort(int workerBasePort) {
            this.workerBasePort = workerBasePort;
            return this;
        }

        public Builder readIdleSeconds(int readIdleSeconds) {
            this.readIdleSeconds = readIdleSeconds;
            return this;
        }

        public Builder dialTimeoutSeconds(int dialTimeoutSeconds) {
            this.dialTimeoutSeconds = dialTimeoutSeconds;
            return this;
        }

        public Builder faultTolerance(int faultTolerance) {
            this.faultTolerance = faultTolerance;
            return this;
        }

        public Builder broadcastIntervalMillis(long broadcastIntervalMillis) {
            this.broadcastIntervalMillis = broadcastIntervalMillis;
            return this;
        }

        public Builder livenessIntervalMillis(long livenessIntervalMillis) {
            this.livenessIntervalMillis = livenessIntervalMillis;
            return this;
        }

        public Builder livenessTimeoutMillis(long livenessTimeoutMillis) {
            this.livenessTimeoutMillis = livenessTimeoutMillis;
            return this;
        }

        public Builder mapSize(int mapSize) {
            this.mapSize = mapSize;
            return this;
        }

        public Builder coinCount(int coinCount) {
            this.coinCount = coinCount;
            return this;
        }

        public Builder itemCount(int itemCount) {
            this.itemCount = itemCount;
            return this;
        }

        public Builder eventQueueCapacity(int eventQueueCapacity) {
            this.eventQueueCapacity = eventQueueCapacity;
            return this;
        }

        Builder set(String key, String value) {
            switch (key) {
                case "httpPort" -> httpPort(Integer.parseInt(value));
                case "workers" -> workerCount(Integer.parseInt(value));
                case "workerBasePort" -> workerBasePort(Integer.parseInt(value));
                case "readIdleSeconds" -> readIdleSeconds(Integer.parseInt(value));
                case "dialTimeoutSeconds" -> dialTimeoutSeconds(Integer.parseInt(value));
                case "faultTolerance" -> faultTolerance(Integer.parseInt(value));
                case "broadcastIntervalMillis" -> broadcastIntervalMillis(Long.parseLong(value));
                case "livenessIntervalSeconds" -> livenessIntervalMillis(Long.parseLong(value) * 1000);
                case "livenessTimeoutMillis" -> livenessTimeoutMillis(Long.parseLong(value));
                case "mapSize" -> mapSize(Integer.parseInt(value));
                case "coinCount" -> coinCount(Integer.parseInt(value));
                case "itemCount" -> itemCount(Integer.parseInt(value));
                case "eventQueueCapacity" -> eventQueueCapacity(Integer.parseInt(value));
                default -> logger.warn("Unknown setting '{}', ignored", key);
            }
            return this;
        }

        public ServerConfig build() {
            if (workerCount <= 0) {
                throw new IllegalArgumentException("workers must be positive: " + workerCount);
            }
            if (livenessTimeoutMillis > livenessIntervalMillis) {
                throw new IllegalArgumentException("liveness timeout must not exceed the check interval");
            }
            return new ServerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "httpPort=" + httpPort +
                ", workers=" + workerCount +
                ", workerBasePort=" + workerBasePort +
                ", readIdleSeconds=" + readIdleSeconds +
                ", faultTolerance=" + faultTolerance +
                ", broadcastIntervalMillis=" + broadcastIntervalMillis +
                ", livenessIntervalMillis=" + livenessIntervalMillis +
                '}';
    }
}
