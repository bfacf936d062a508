package com.questrail.sockets.tcp.transport;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Factory for listening endpoints and owner of whatever I/O threads they run on.
 *
 * <p>A transport is owned by exactly one server. The server binds through
 * {@link #listen(InetSocketAddress, ListenerOptions)} while starting and calls
 * {@link #shutdown()} once, after every connection it accepted has been closed.</p>
 */
public interface StreamTransport
{
    /**
     * Bind a listening endpoint.
     *
     * <p>Binding is synchronous: when this method returns the endpoint is
     * accepting connections into its pending queue.</p>
     *
     * @throws IOException if the address cannot be bound
     */
    StreamListener listen(InetSocketAddress endPoint, ListenerOptions options) throws IOException;

    /**
     * Release all transport resources. Idempotent.
     */
    void shutdown();
}
