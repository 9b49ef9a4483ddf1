package com.tcpchat.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tcpchat.protocol.FrameCodec;

/**
 * Settings of the chat server.
 *
 * JSON format (every field optional):
 * {
 *     "host": "0.0.0.0",
 *     "port": 12000,
 *     "maxPendingConnections": 10,
 *     "maxFrameLength": 16777216,
 *     "readerIdleSeconds": 0
 * }
 *
 * A readerIdleSeconds of 0 disables the idle timeout: reads may then block
 * for as long as the peer stays connected.
 *
 * Instances are not modified after loading; derive changed settings with
 * {@link #toBuilder()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 12000;
    public static final int DEFAULT_MAX_PENDING_CONNECTIONS = 10;

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private int maxPendingConnections = DEFAULT_MAX_PENDING_CONNECTIONS;
    private int maxFrameLength = FrameCodec.DEFAULT_MAX_FRAME_LENGTH;
    private int readerIdleSeconds;

    // Default constructor for Jackson deserialization
    public ServerConfig() {
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getMaxPendingConnections() {
        return maxPendingConnections;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    public int getReaderIdleSeconds() {
        return readerIdleSeconds;
    }

    // Setters for Jackson deserialization only
    private void setHost(String host) {
        this.host = host;
    }

    private void setPort(int port) {
        this.port = port;
    }

    private void setMaxPendingConnections(int maxPendingConnections) {
        this.maxPendingConnections = maxPendingConnections;
    }

    private void setMaxFrameLength(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
    }

    private void setReaderIdleSeconds(int readerIdleSeconds) {
        this.readerIdleSeconds = readerIdleSeconds;
    }

    /**
     * Checks the settings before the server binds.
     *
     * @throws IllegalArgumentException naming the first invalid field
     */
    public ServerConfig validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxPendingConnections < 1) {
            throw new IllegalArgumentException("maxPendingConnections must be at least 1: " + maxPendingConnections);
        }
        if (maxFrameLength < 1) {
            throw new IllegalArgumentException("maxFrameLength must be at least 1: " + maxFrameLength);
        }
        if (readerIdleSeconds < 0) {
            throw new IllegalArgumentException("readerIdleSeconds must not be negative: " + readerIdleSeconds);
        }
        return this;
    }

    public static Builder builder() {
        return new Builder(new ServerConfig());
    }

    /**
     * @return a builder preset with these settings; this instance stays unchanged
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder starting from the defaults or from an existing config.
     */
    public static class Builder {
        private String host;
        private int port;
        private int maxPendingConnections;
        private int maxFrameLength;
        private int readerIdleSeconds;

        private Builder(ServerConfig from) {
            this.host = from.host;
            this.port = from.port;
            this.maxPendingConnections = from.maxPendingConnections;
            this.maxFrameLength = from.maxFrameLength;
            this.readerIdleSeconds = from.readerIdleSeconds;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxPendingConnections(int maxPendingConnections) {
            this.maxPendingConnections = maxPendingConnections;
            return this;
        }

        public Builder maxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public Builder readerIdleSeconds(int readerIdleSeconds) {
            this.readerIdleSeconds = readerIdleSeconds;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is invalid
         */
        public ServerConfig build() {
            ServerConfig config = new ServerConfig();
            config.setHost(host);
            config.setPort(port);
            config.setMaxPendingConnections(maxPendingConnections);
            config.setMaxFrameLength(maxFrameLength);
            config.setReaderIdleSeconds(readerIdleSeconds);
            return config.validate();
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", maxPendingConnections=" + maxPendingConnections +
                ", maxFrameLength=" + maxFrameLength +
                ", readerIdleSeconds=" + readerIdleSeconds +
                '}';
    }
}
