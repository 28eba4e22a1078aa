package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;

import java.io.IOException;

/**
 * Creates an unconnected {@link TransportSocket} for one address family.
 */
@FunctionalInterface
public interface TransportSocketFactory
{
    TransportSocket create(AddressFamily family) throws IOException;
}
