package com.questrail.amqp.transport.connect;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves a host name to its candidate addresses.
 *
 * <p>Resolution mechanics (caching, DNS servers, hosts file) are entirely up
 * to the implementation; the connector only filters the result by address
 * family.</p>
 */
@FunctionalInterface
public interface HostResolver
{
    /** Resolver backed by {@link InetAddress#getAllByName(String)}. */
    HostResolver SYSTEM = InetAddress::getAllByName;

    InetAddress[] resolve(String hostName) throws UnknownHostException;
}
