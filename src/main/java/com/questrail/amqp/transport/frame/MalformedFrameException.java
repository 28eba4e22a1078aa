package com.questrail.amqp.transport.frame;

import java.io.IOException;

/**
 * Raised when bytes read from the broker do not form a valid frame. The
 * connection is out of sync afterwards and must be closed.
 */
public class MalformedFrameException extends IOException
{
    public MalformedFrameException(String message) {
        super(message);
    }
}
