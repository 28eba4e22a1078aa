package com.questrail.amqp.transport.frame;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * One frame read from the wire, header fields decoded and terminator stripped.
 *
 * <p>{@code type} is kept as the raw wire byte so that frame types unknown to
 * this layer still reach the protocol layer above.</p>
 */
public record InboundFrame(int type, int channel, byte[] payload) {

    public InboundFrame {
        Objects.requireNonNull(payload, "payload");
    }

    public Optional<FrameType> frameType() {
        return FrameType.fromWire(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InboundFrame other)) {
            return false;
        }
        return type == other.type && channel == other.channel && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, channel) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "InboundFrame[type=" + type + ", channel=" + channel + ", payload=" + payload.length + " bytes]";
    }
}
