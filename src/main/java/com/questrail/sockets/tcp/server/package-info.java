/**
 * TCP Socket Server
 * =============================================================================
 *
 * <p>Connection-oriented server core: lifecycle, accept loop, session
 * ownership and routing.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   StreamTransport / StreamListener        (tcp.transport, Netty behind it)
 *        → TcpSocketServer                  (accept loop, one unit of work per connection)
 *            → SessionRegistry              (key → live session, exactly-once add/remove)
 *            → TcpSocketSession             (receive loop, send, close)
 *                → TcpSocketServerMessageDispatcher   (application callbacks)
 * </pre>
 *
 * <h2>Failure Classification</h2>
 * <p>{@link com.questrail.sockets.tcp.server.ShutdownNoise} decides which
 * failures are harmless consequences of teardown. Those are absorbed. Lifecycle
 * misuse is raised to the caller. Everything else is reported to the
 * observability sink and contained to the session it happened in.</p>
 *
 * <p>No class in this package imports Netty.</p>
 */
package com.questrail.sockets.tcp.server;
