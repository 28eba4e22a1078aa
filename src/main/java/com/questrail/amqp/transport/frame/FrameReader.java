package com.questrail.amqp.transport.frame;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * FrameReader
 * -----------------------------------------------------------------------------
 * Reads complete frames from a (buffered) input stream.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Read the 7-byte header: channel, payload length, type.</li>
 *   <li>Reject a payload length above the maximum <em>before</em> reading it.</li>
 *   <li>Read exactly that many payload bytes.</li>
 *   <li>Read and check the terminator byte.</li>
 * </ol>
 *
 * <p>A header starting with {@code AMQP} is the broker's protocol header,
 * sent back when it refuses our version; it is reported as
 * {@link ProtocolVersionMismatchException}.</p>
 *
 * <p>Not thread-safe: a connection has a single reader.</p>
 */
public final class FrameReader
{
    private static final int MAX_ARRAY_PAYLOAD = Integer.MAX_VALUE - 8;

    private final InputStream in;
    private final long maxMessageSize;
    private final byte[] header = new byte[FrameConstants.PROTOCOL_HEADER_SIZE];

    /**
     * @param maxMessageSize largest accepted payload in bytes; {@code 0} for no limit
     */
    public FrameReader(InputStream in, long maxMessageSize)
    {
        this.in = Objects.requireNonNull(in, "in");
        if (maxMessageSize < 0) {
            throw new IllegalArgumentException("maxMessageSize must be >= 0");
        }
        this.maxMessageSize = maxMessageSize;
    }

    public InboundFrame readFrame() throws IOException
    {
        int first = in.read();
        if (first == -1) {
            throw new EOFException("Reached EOF while reading frame header");
        }
        header[0] = (byte) first;
        readFully(header, 1, FrameConstants.HEADER_SIZE - 1, "frame header");

        if (ProtocolHeader.startsWithSignature(header)) {
            readFully(header, FrameConstants.HEADER_SIZE, 1, "protocol header");
            throw new ProtocolVersionMismatchException(ProtocolHeader.decodeVersion(header));
        }

        int channel = ((header[0] & 0xFF) << 8) | (header[1] & 0xFF);
        long payloadSize = ((long) (header[2] & 0xFF) << 24)
            | ((header[3] & 0xFF) << 16)
            | ((header[4] & 0xFF) << 8)
            | (header[5] & 0xFF);
        int type = header[6] & 0xFF;

        if (maxMessageSize > 0 && payloadSize > maxMessageSize) {
            throw new FrameTooLargeException(payloadSize, maxMessageSize);
        }
        if (payloadSize > MAX_ARRAY_PAYLOAD) {
            throw new FrameTooLargeException(payloadSize, MAX_ARRAY_PAYLOAD);
        }

        byte[] payload = new byte[(int) payloadSize];
        readFully(payload, 0, payload.length, "frame payload");

        int end = in.read();
        if (end == -1) {
            throw new EOFException("Reached EOF while reading frame end marker");
        }
        if (end != FrameConstants.FRAME_END) {
            throw new MalformedFrameException("Bad frame end marker: " + end);
        }

        return new InboundFrame(type, channel, payload);
    }

    private void readFully(byte[] buf, int off, int len, String what) throws IOException
    {
        int read = 0;
        while (read < len) {
            int n = in.read(buf, off + read, len - read);
            if (n == -1) {
                throw new EOFException("Reached EOF while reading " + what
                    + " (" + read + " of " + len + " bytes)");
            }
            read += n;
        }
    }
}
