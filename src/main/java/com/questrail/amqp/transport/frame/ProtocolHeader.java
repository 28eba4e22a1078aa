package com.questrail.amqp.transport.frame;

import com.questrail.amqp.transport.ProtocolVersion;

import java.util.Objects;

/**
 * The 8-byte protocol header exchanged at connection start.
 *
 * <ul>
 *   <li>Bytes 0-3: ASCII {@code AMQP}.</li>
 *   <li>Nonzero revision: {@code 0, major, minor, revision}.</li>
 *   <li>Zero revision: {@code 1, 1, major, minor}.</li>
 * </ul>
 */
public final class ProtocolHeader
{
    private static final byte[] SIGNATURE = { 'A', 'M', 'Q', 'P' };

    private ProtocolHeader() {}

    public static byte[] encode(ProtocolVersion version)
    {
        Objects.requireNonNull(version, "version");

        byte[] header = new byte[FrameConstants.PROTOCOL_HEADER_SIZE];
        System.arraycopy(SIGNATURE, 0, header, 0, SIGNATURE.length);

        if (version.revision() != 0) {
            header[4] = 0;
            header[5] = (byte) version.major();
            header[6] = (byte) version.minor();
            header[7] = (byte) version.revision();
        }
        else {
            header[4] = 1;
            header[5] = 1;
            header[6] = (byte) version.major();
            header[7] = (byte) version.minor();
        }
        return header;
    }

    /**
     * @return {@code true} if {@code bytes} starts with the ASCII signature
     */
    static boolean startsWithSignature(byte[] bytes)
    {
        if (bytes.length < SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (bytes[i] != SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decodes the version announced by a header. Inverse of {@link #encode}.
     */
    static ProtocolVersion decodeVersion(byte[] header)
    {
        int b4 = header[4] & 0xFF;
        int b5 = header[5] & 0xFF;
        int b6 = header[6] & 0xFF;
        int b7 = header[7] & 0xFF;
        if (b4 == 0) {
            return new ProtocolVersion(b5, b6, b7);
        }
        return new ProtocolVersion(b6, b7, 0);
    }
}
