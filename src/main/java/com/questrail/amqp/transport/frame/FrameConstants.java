package com.questrail.amqp.transport.frame;

/**
 * Wire constants of the frame layer.
 *
 * <pre>
 *   +---------+----------------+------+-----------------+-----------+
 *   | channel | payload length | type | payload         | frame end |
 *   | u16 BE  | u32 BE         | u8   | length bytes    | 0xCE      |
 *   +---------+----------------+------+-----------------+-----------+
 * </pre>
 */
public final class FrameConstants
{
    /** Size of the fixed header preceding the payload. */
    public static final int HEADER_SIZE = 7;

    /** Terminator byte following every payload. */
    public static final int FRAME_END = 0xCE;

    /** Header plus terminator: bytes on the wire around each payload. */
    public static final int FRAME_OVERHEAD = HEADER_SIZE + 1;

    /** Length of the protocol header sent once at connection start. */
    public static final int PROTOCOL_HEADER_SIZE = 8;

    private FrameConstants() {}
}
