package com.questrail.amqp.transport.connect;

import java.io.IOException;

/**
 * The single failure kind raised while resolving a host or establishing a
 * TCP connection. The underlying fault (resolution error, socket error,
 * unsupported operation, timeout) is always carried as the cause.
 */
public final class ConnectFailureException extends IOException
{
    public ConnectFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
