package com.questrail.amqp.transport.frame;

import java.util.Optional;

/**
 * Frame types defined by AMQP 0-9-1.
 */
public enum FrameType
{
    METHOD(1),
    HEADER(2),
    BODY(3),
    HEARTBEAT(8);

    private final int wireValue;

    FrameType(int wireValue)
    {
        this.wireValue = wireValue;
    }

    public int wireValue()
    {
        return wireValue;
    }

    public static Optional<FrameType> fromWire(int value)
    {
        for (FrameType t : values()) {
            if (t.wireValue == value) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
