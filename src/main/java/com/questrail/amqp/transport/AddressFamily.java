package com.questrail.amqp.transport;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Address family requested for a connection.
 *
 * <p>{@link #UNSPECIFIED} lets the dual-stack connector try IPv6 first and
 * fall back to IPv4. {@link #IPV4} never attempts IPv6. {@link #IPV6} fails
 * when the host has no IPv6 address.</p>
 */
public enum AddressFamily
{
    UNSPECIFIED,
    IPV4,
    IPV6;

    /**
     * @return {@code true} if {@code address} belongs to this family;
     *         {@link #UNSPECIFIED} matches any address.
     */
    public boolean matches(InetAddress address)
    {
        return switch (this) {
            case IPV4 -> address instanceof Inet4Address;
            case IPV6 -> address instanceof Inet6Address;
            case UNSPECIFIED -> true;
        };
    }
}
