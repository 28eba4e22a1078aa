/**
 * Connection Establishment
 * =============================================================================
 *
 * Resolves a broker host name and opens a TCP connection to it, preferring
 * IPv6 and falling back to IPv4.
 *
 * <h2>Ports</h2>
 * <ul>
 *   <li>{@link com.questrail.amqp.transport.connect.HostResolver}: name to addresses</li>
 *   <li>{@link com.questrail.amqp.transport.connect.TransportSocketFactory} and
 *       {@link com.questrail.amqp.transport.connect.TransportSocket}: the raw
 *       socket, replaceable by a test double</li>
 * </ul>
 *
 * <h2>Failure contract</h2>
 * Every way a connect can fail (resolution, address family mismatch, refusal,
 * unsupported operation, deadline) surfaces as a single
 * {@link com.questrail.amqp.transport.connect.ConnectFailureException} whose
 * cause carries the detail. A socket that did not connect is always closed
 * before the exception leaves this package.
 *
 * <p>Attempts are sequential. The IPv4 attempt starts only after the IPv6
 * attempt has failed or timed out.</p>
 */
package com.questrail.amqp.transport.connect;
