package com.questrail.amqp.transport.frame;

import com.questrail.amqp.transport.ProtocolVersion;

import java.io.IOException;

/**
 * The broker answered the protocol header with its own header instead of a
 * frame, meaning it does not speak the version we announced.
 */
public final class ProtocolVersionMismatchException extends IOException
{
    private final ProtocolVersion serverVersion;

    public ProtocolVersionMismatchException(ProtocolVersion serverVersion) {
        super("Broker rejected the protocol header; it supports AMQP " + serverVersion);
        this.serverVersion = serverVersion;
    }

    public ProtocolVersion serverVersion() {
        return serverVersion;
    }
}
