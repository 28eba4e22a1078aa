package com.questrail.amqp.transport.tls;

import java.io.IOException;
import java.net.Socket;

/**
 * SecureStreamUpgrader
 * -----------------------------------------------------------------------------
 * Port that wraps a connected plain socket in transport encryption.
 *
 * <p>Certificate validation and handshake policy belong entirely to the
 * implementation. The frame handler only requires that on return the
 * handshake is complete and the returned socket's streams carry encrypted
 * traffic. On failure the implementation may leave the raw socket open; the
 * caller closes it.</p>
 */
@FunctionalInterface
public interface SecureStreamUpgrader
{
    /**
     * @param raw        connected plain socket
     * @param ssl        TLS settings of the endpoint
     * @param serverName host name to present and verify when
     *                   {@link SslOption#serverName()} is not set
     * @return the secured socket layered over {@code raw}
     */
    Socket upgrade(Socket raw, SslOption ssl, String serverName) throws IOException;
}
