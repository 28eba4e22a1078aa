package com.questrail.amqp.transport.frame;

/**
 * A frame header declared a payload larger than the configured maximum.
 * Raised before any payload byte is consumed.
 */
public final class FrameTooLargeException extends MalformedFrameException
{
    private final long declaredSize;
    private final long maxSize;

    public FrameTooLargeException(long declaredSize, long maxSize) {
        super("Frame payload size '" + declaredSize + "' exceeds maximum of '" + maxSize + "' bytes");
        this.declaredSize = declaredSize;
        this.maxSize = maxSize;
    }

    public long declaredSize() {
        return declaredSize;
    }

    public long maxSize() {
        return maxSize;
    }
}
