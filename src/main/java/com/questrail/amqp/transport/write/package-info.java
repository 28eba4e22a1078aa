/**
 * Outbound Write Path
 * =============================================================================
 *
 * Many producer threads enqueue encoded frames; one writer thread drains the
 * queue onto the socket stream, flushing once per batch of immediately
 * available frames.
 *
 * <h2>Buffer ownership</h2>
 * A {@link io.netty.buffer.ByteBuf} handed to
 * {@link com.questrail.amqp.transport.write.OutboundWritePipeline#enqueue}
 * belongs to the pipeline from that moment. It is released after it is
 * written, or immediately if the pipeline no longer accepts frames. Callers
 * must not touch it again.
 *
 * <h2>Write deadline</h2>
 * Blocking socket writes cannot time out on their own.
 * {@link com.questrail.amqp.transport.write.WriteDeadlineWatchdog} arms a
 * deadline around each write and flush and closes the socket when it
 * expires, which aborts the blocked write.
 */
package com.questrail.amqp.transport.write;
