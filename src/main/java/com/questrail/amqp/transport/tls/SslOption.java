package com.questrail.amqp.transport.tls;

import javax.net.ssl.SSLContext;
import java.util.List;
import java.util.Optional;

/**
 * TLS settings for an endpoint.
 *
 * <p>{@code serverName} is the name presented via SNI and checked by hostname
 * verification; when {@code null} the endpoint host name is used. A
 * {@code null} {@code sslContext} selects {@link SSLContext#getDefault()}. An
 * empty {@code enabledProtocols} list keeps the provider defaults.</p>
 */
public record SslOption(
    boolean enabled,
    String serverName,
    SSLContext sslContext,
    List<String> enabledProtocols,
    boolean hostnameVerification
) {
    private static final SslOption DISABLED = new SslOption(false, null, null, List.of(), false);

    public SslOption {
        enabledProtocols = enabledProtocols == null ? List.of() : List.copyOf(enabledProtocols);
    }

    public static SslOption disabled() {
        return DISABLED;
    }

    /**
     * TLS with the JVM default context and hostname verification enabled.
     */
    public static SslOption enabledFor(String serverName) {
        return new SslOption(true, serverName, null, List.of(), true);
    }

    public Optional<String> serverNameOverride() {
        return Optional.ofNullable(serverName);
    }

    public SslOption withSslContext(SSLContext context) {
        return new SslOption(enabled, serverName, context, enabledProtocols, hostnameVerification);
    }

    public SslOption withEnabledProtocols(List<String> protocols) {
        return new SslOption(enabled, serverName, sslContext, protocols, hostnameVerification);
    }

    public SslOption withHostnameVerification(boolean verify) {
        return new SslOption(enabled, serverName, sslContext, enabledProtocols, verify);
    }
}
