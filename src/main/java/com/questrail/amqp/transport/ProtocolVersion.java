package com.questrail.amqp.transport;

/**
 * AMQP protocol version announced in the protocol header.
 *
 * <p>Each component must fit in one unsigned byte.</p>
 */
public record ProtocolVersion(int major, int minor, int revision) {

    /** AMQP 0-9-1, the version spoken by RabbitMQ. */
    public static final ProtocolVersion AMQP_0_9_1 = new ProtocolVersion(0, 9, 1);

    public ProtocolVersion {
        requireOctet(major, "major");
        requireOctet(minor, "minor");
        requireOctet(revision, "revision");
    }

    private static void requireOctet(int value, String name) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " must be 0-255, got " + value);
        }
    }

    @Override
    public String toString() {
        return major + "-" + minor + "-" + revision;
    }
}
