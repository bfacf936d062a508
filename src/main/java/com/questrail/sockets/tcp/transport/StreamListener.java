package com.questrail.sockets.tcp.transport;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * StreamListener
 * -----------------------------------------------------------------------------
 * A bound listening endpoint that hands out accepted stream connections.
 *
 * <p>Connections accepted by the underlying socket are queued until claimed
 * through {@link #accept()}. Nothing is read from a connection until its
 * claimer calls {@link StreamConnection#startReading(StreamConnectionListener)}.</p>
 */
public interface StreamListener
{
    /**
     * Claim the next accepted connection.
     *
     * <p>The returned future completes as soon as a connection is available. It
     * fails with {@link java.nio.channels.ClosedChannelException} if the
     * listener is (or becomes) closed before that happens.</p>
     */
    CompletableFuture<StreamConnection> accept();

    /**
     * Whether an accepted connection is waiting to be claimed.
     */
    boolean pending();

    /**
     * Address the listener is actually bound to (ephemeral port resolved).
     */
    InetSocketAddress localAddress();

    /**
     * Stop accepting. Unclaimed connections are closed and outstanding
     * {@link #accept()} futures fail. Idempotent.
     */
    void close();
}
