package com.questrail.amqp.transport.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.Socket;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * {@link SecureStreamUpgrader} backed by JSSE.
 *
 * <p>Layers an {@link SSLSocket} over the connected socket (closing the
 * TLS socket closes the raw one), applies protocol and hostname-verification
 * settings, and completes the handshake before returning.</p>
 */
public final class JsseStreamUpgrader implements SecureStreamUpgrader
{
    private static final Logger log = LoggerFactory.getLogger(JsseStreamUpgrader.class);

    @Override
    public Socket upgrade(Socket raw, SslOption ssl, String serverName) throws IOException
    {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(ssl, "ssl");

        String peerName = ssl.serverNameOverride().orElse(serverName);
        SSLSocketFactory factory = context(ssl).getSocketFactory();

        SSLSocket tls = (SSLSocket) factory.createSocket(raw, peerName, raw.getPort(), true);
        try {
            if (!ssl.enabledProtocols().isEmpty()) {
                tls.setEnabledProtocols(ssl.enabledProtocols().toArray(new String[0]));
            }
            if (ssl.hostnameVerification()) {
                SSLParameters params = tls.getSSLParameters();
                params.setEndpointIdentificationAlgorithm("HTTPS");
                tls.setSSLParameters(params);
            }
            tls.setUseClientMode(true);
            tls.startHandshake();
        }
        catch (IOException | RuntimeException e) {
            try {
                tls.close();
            }
            catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }

        log.debug("TLS handshake with {} complete: {} {}", peerName,
            tls.getSession().getProtocol(), tls.getSession().getCipherSuite());
        return tls;
    }

    private static SSLContext context(SslOption ssl) throws IOException
    {
        if (ssl.sslContext() != null) {
            return ssl.sslContext();
        }
        try {
            return SSLContext.getDefault();
        }
        catch (NoSuchAlgorithmException e) {
            throw new IOException("No default TLS context available", e);
        }
    }
}
