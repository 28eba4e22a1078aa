package com.questrail.amqp.transport;

import com.questrail.amqp.transport.tls.SslOption;

import java.util.Objects;

/**
 * Immutable description of the broker to connect to.
 *
 * <p>{@code maxMessageSize} bounds the payload of any inbound frame; {@code 0}
 * disables the check.</p>
 */
public record AmqpTcpEndpoint(
    String hostName,
    int port,
    AddressFamily addressFamily,
    ProtocolVersion protocol,
    SslOption ssl,
    long maxMessageSize
) {
    public static final int DEFAULT_PORT = 5672;
    public static final int DEFAULT_TLS_PORT = 5671;
    public static final long DEFAULT_MAX_MESSAGE_SIZE = 128L * 1024 * 1024;

    public AmqpTcpEndpoint {
        Objects.requireNonNull(hostName, "hostName");
        Objects.requireNonNull(addressFamily, "addressFamily");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(ssl, "ssl");
        if (hostName.isBlank()) {
            throw new IllegalArgumentException("hostName must not be blank");
        }
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port must be 0-65535, got " + port);
        }
        if (maxMessageSize < 0 || maxMessageSize > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("maxMessageSize must be 0-4294967295, got " + maxMessageSize);
        }
    }

    public static Builder builder(String hostName) {
        return new Builder(hostName);
    }

    @Override
    public String toString() {
        return (ssl.enabled() ? "amqps://" : "amqp://") + hostName + ":" + port;
    }

    public static final class Builder {
        private final String hostName;
        private Integer port;
        private AddressFamily addressFamily = AddressFamily.UNSPECIFIED;
        private ProtocolVersion protocol = ProtocolVersion.AMQP_0_9_1;
        private SslOption ssl = SslOption.disabled();
        private long maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;

        private Builder(String hostName) {
            this.hostName = hostName;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withAddressFamily(AddressFamily addressFamily) {
            this.addressFamily = addressFamily;
            return this;
        }

        public Builder withProtocol(ProtocolVersion protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder withSsl(SslOption ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder withMaxMessageSize(long maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public AmqpTcpEndpoint build() {
            Objects.requireNonNull(ssl, "ssl");
            int effectivePort = port != null
                ? port
                : (ssl.enabled() ? DEFAULT_TLS_PORT : DEFAULT_PORT);
            return new AmqpTcpEndpoint(hostName, effectivePort, addressFamily, protocol, ssl, maxMessageSize);
        }
    }
}
