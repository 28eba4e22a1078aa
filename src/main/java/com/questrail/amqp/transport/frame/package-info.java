/**
 * Frame Wire Format
 * =============================================================================
 *
 * <pre>
 *   +---------+----------------+------+-------------+------+
 *   | channel | payload length | type | payload     | 0xCE |
 *   | u16 BE  | u32 BE         | u8   | length bytes|      |
 *   +---------+----------------+------+-------------+------+
 * </pre>
 *
 * <p>The reader validates the declared length against the endpoint's maximum
 * message size before allocating or reading the payload. A broker that
 * rejects the protocol header answers with its own 8-byte header instead of a
 * frame; the reader recognizes it and raises
 * {@link com.questrail.amqp.transport.frame.ProtocolVersionMismatchException}.</p>
 *
 * <p>No method or content semantics live here.</p>
 */
package com.questrail.amqp.transport.frame;
