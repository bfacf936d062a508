package com.questrail.sockets.tcp.transport;

import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PendingConnectionQueue
 * -----------------------------------------------------------------------------
 * Hand-off point between the thread that accepts sockets and whoever claims
 * them through {@link StreamListener#accept()}.
 *
 * <p>A connection is either waiting in the queue or handed straight to the
 * oldest outstanding claim. Once closed, the queue closes every connection
 * offered to it and fails every claim.</p>
 *
 * @param <C> connection type
 */
public final class PendingConnectionQueue<C extends StreamConnection>
{
    private final Object lock = new Object();
    private final Deque<C> accepted = new ArrayDeque<>();
    private final Deque<CompletableFuture<StreamConnection>> claims = new ArrayDeque<>();
    private boolean closed;

    /**
     * Offer a freshly accepted connection.
     */
    public void offer(C connection)
    {
        Objects.requireNonNull(connection, "connection");

        CompletableFuture<StreamConnection> claim;
        synchronized (lock) {
            if (closed) {
                claim = null;
            } else {
                claim = claims.poll();
                if (claim == null) {
                    accepted.add(connection);
                    return;
                }
            }
        }

        if (claim == null) {
            connection.close();
        } else {
            claim.complete(connection);
        }
    }

    public CompletableFuture<StreamConnection> claim()
    {
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(new ClosedChannelException());
            }
            C connection = accepted.poll();
            if (connection != null) {
                return CompletableFuture.completedFuture(connection);
            }
            CompletableFuture<StreamConnection> claim = new CompletableFuture<>();
            claims.add(claim);
            return claim;
        }
    }

    public boolean hasPending()
    {
        synchronized (lock) {
            return !accepted.isEmpty();
        }
    }

    public void close()
    {
        List<C> unclaimed;
        List<CompletableFuture<StreamConnection>> outstanding;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            unclaimed = new ArrayList<>(accepted);
            outstanding = new ArrayList<>(claims);
            accepted.clear();
            claims.clear();
        }

        // Completed outside the lock: claim continuations may run inline.
        for (CompletableFuture<StreamConnection> claim : outstanding) {
            claim.completeExceptionally(new ClosedChannelException());
        }
        for (C connection : unclaimed) {
            connection.close();
        }
    }
}
