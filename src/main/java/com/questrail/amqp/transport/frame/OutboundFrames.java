package com.questrail.amqp.transport.frame;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.util.Objects;

/**
 * Serializes frames into pooled buffers ready to hand to
 * {@code FrameHandler#write(ByteBuf)}.
 *
 * <p>The returned buffer is owned by the caller until it is written; the
 * write pipeline releases it back to the allocator's pool.</p>
 */
public final class OutboundFrames
{
    private static final byte[] EMPTY = new byte[0];

    private OutboundFrames() {}

    public static ByteBuf encode(ByteBufAllocator allocator, int type, int channel, byte[] payload)
    {
        Objects.requireNonNull(allocator, "allocator");
        Objects.requireNonNull(payload, "payload");
        if (type < 0 || type > 0xFF) {
            throw new IllegalArgumentException("type must be 0-255, got " + type);
        }
        if (channel < 0 || channel > 0xFFFF) {
            throw new IllegalArgumentException("channel must be 0-65535, got " + channel);
        }

        ByteBuf buf = allocator.buffer(payload.length + FrameConstants.FRAME_OVERHEAD);
        buf.writeShort(channel);
        buf.writeInt(payload.length);
        buf.writeByte(type);
        buf.writeBytes(payload);
        buf.writeByte(FrameConstants.FRAME_END);
        return buf;
    }

    public static ByteBuf encode(ByteBufAllocator allocator, FrameType type, int channel, byte[] payload)
    {
        return encode(allocator, type.wireValue(), channel, payload);
    }

    /**
     * Heartbeats always travel on channel 0 with an empty payload.
     */
    public static ByteBuf heartbeat(ByteBufAllocator allocator)
    {
        return encode(allocator, FrameType.HEARTBEAT, 0, EMPTY);
    }
}
