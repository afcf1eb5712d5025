package com.questrail.coedit.protocol.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the collaboration runtime.
 *
 * @param bindHost      local address the host listens on
 * @param defaultPort   port used when a caller does not name one
 * @param connectTimeout bound on a client's dial
 * @param maxFrameBytes largest accepted frame body, in bytes
 */
public record CollabRuntimeConfig(
    String bindHost,
    int defaultPort,
    Duration connectTimeout,
    int maxFrameBytes
) {
    public static final String DEFAULT_BIND_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 54321;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    public static final String BIND_HOST_PROPERTY = "coedit.bind-host";
    public static final String PORT_PROPERTY = "coedit.port";
    public static final String CONNECT_TIMEOUT_PROPERTY = "coedit.connect-timeout-ms";
    public static final String MAX_FRAME_BYTES_PROPERTY = "coedit.max-frame-bytes";

    public CollabRuntimeConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (bindHost.isBlank()) {
            throw new IllegalArgumentException("bindHost must not be blank");
        }
        if (defaultPort < 0 || defaultPort > 0xFFFF) {
            throw new IllegalArgumentException("defaultPort out of range: " + defaultPort);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
    }

    public static CollabRuntimeConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code coedit.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a present value is not a valid number
     *         or is out of range
     */
    public static CollabRuntimeConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String host = properties.getProperty(BIND_HOST_PROPERTY);
        if (host != null) {
            builder.withBindHost(host.trim());
        }
        String port = properties.getProperty(PORT_PROPERTY);
        if (port != null) {
            builder.withDefaultPort(parseInt(PORT_PROPERTY, port));
        }
        String timeout = properties.getProperty(CONNECT_TIMEOUT_PROPERTY);
        if (timeout != null) {
            builder.withConnectTimeout(Duration.ofMillis(parseInt(CONNECT_TIMEOUT_PROPERTY, timeout)));
        }
        String maxFrame = properties.getProperty(MAX_FRAME_BYTES_PROPERTY);
        if (maxFrame != null) {
            builder.withMaxFrameBytes(parseInt(MAX_FRAME_BYTES_PROPERTY, maxFrame));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String bindHost = DEFAULT_BIND_HOST;
        private int defaultPort = DEFAULT_PORT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withDefaultPort(int defaultPort) {
            this.defaultPort = defaultPort;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public CollabRuntimeConfig build() {
            return new CollabRuntimeConfig(bindHost, defaultPort, connectTimeout, maxFrameBytes);
        }
    }
}
