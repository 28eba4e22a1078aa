package com.questrail.amqp.transport.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeout configuration for a socket frame handler.
 *
 * <ul>
 *   <li>{@code connectionTimeout}: bound on each TCP connect attempt.</li>
 *   <li>{@code readTimeout}: socket {@code SO_TIMEOUT} applied to frame reads.</li>
 *   <li>{@code writeTimeout}: bound on each outbound write or flush; {@link Duration#ZERO} disables it.</li>
 * </ul>
 */
public record FrameHandlerConfig(
    Duration connectionTimeout,
    Duration readTimeout,
    Duration writeTimeout
) {
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(30);

    public FrameHandlerConfig {
        requireNonNegative(connectionTimeout, "connectionTimeout");
        requireNonNegative(readTimeout, "readTimeout");
        requireNonNegative(writeTimeout, "writeTimeout");
        if (connectionTimeout.isZero()) {
            throw new IllegalArgumentException("connectionTimeout must be > 0");
        }
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }

    public static FrameHandlerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;

        public Builder withConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public FrameHandlerConfig build() {
            return new FrameHandlerConfig(connectionTimeout, readTimeout, writeTimeout);
        }
    }
}
