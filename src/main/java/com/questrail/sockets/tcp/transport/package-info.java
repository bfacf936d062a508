/**
 * Stream Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty, a simulator, or a test
 * double) and the socket server core.</p>
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>Inbound bytes through {@link com.questrail.sockets.tcp.transport.ReceivedBytes}</li>
 *   <li>Outbound bytes as {@code byte[]} ranges</li>
 *   <li>Addresses as standard {@link java.net.SocketAddress}</li>
 *   <li>Completion as {@link java.util.concurrent.CompletableFuture}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations perform transport I/O only. They do not know about
 * sessions, session keys, framing, or dispatchers.
 */
package com.questrail.sockets.tcp.transport;
