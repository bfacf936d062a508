package com.questrail.sockets.tcp.server;

import com.questrail.sockets.buffer.BufferManager;
import com.questrail.sockets.tcp.transport.ReceivedBytes;
import com.questrail.sockets.tcp.transport.StreamConnection;
import com.questrail.sockets.tcp.transport.StreamConnectionListener;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TcpSocketSession
 * =============================================================================
 * One accepted connection, owned end-to-end from start to close.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   NEW --start()--> CONNECTED --peer close / I/O error / close()--> CLOSED
 *    \______________________close()_________________________________/
 * </pre>
 * {@link #start()} fires {@code onSessionStarted}, begins reading and returns a
 * future that completes only when the session has ended. Whoever ends the
 * session first (peer, transport, dispatcher failure, or {@link #close()})
 * wins; every later attempt is a no-op, so {@code onSessionClosed} fires
 * exactly once.
 *
 * <h2>Outcome of {@link #start()}</h2>
 * <ul>
 *   <li>completes normally on peer close, explicit close, or an I/O failure</li>
 *   <li>fails with {@link java.util.concurrent.TimeoutException} when the receive
 *       timeout expired</li>
 *   <li>fails with the dispatcher's exception when a callback threw</li>
 * </ul>
 *
 * <h2>Receive path</h2>
 * Inbound bytes are copied into buffers borrowed from the server's
 * {@link BufferManager}, handed to the dispatcher, and returned to the pool
 * when the callback returns.
 *
 * <h2>Send path</h2>
 * {@link #send(byte[], int, int)} delegates to the connection, which queues
 * each write whole. Concurrent sends never interleave on the wire.
 */
public final class TcpSocketSession {

    private enum State { NEW, CONNECTED, CLOSED }

    private final String sessionKey = UUID.randomUUID().toString();
    private final StreamConnection connection;
    private final BufferManager bufferManager;
    private final TcpSocketServerMessageDispatcher dispatcher;
    private final TcpSocketServer server;

    private final SocketAddress remoteEndPoint;
    private final SocketAddress localEndPoint;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private final CompletableFuture<Void> closed = terminated.handle((ignored, failure) -> null);

    // Serializes dispatcher callbacks for this session.
    private final Object callbackLock = new Object();

    private volatile Instant startTime;

    TcpSocketSession(StreamConnection connection,
                     BufferManager bufferManager,
                     TcpSocketServerMessageDispatcher dispatcher,
                     TcpSocketServer server) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.bufferManager = Objects.requireNonNull(bufferManager, "bufferManager");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.server = Objects.requireNonNull(server, "server");

        // Captured up front: a closed connection may no longer report its addresses.
        this.remoteEndPoint = connection.remoteAddress();
        this.localEndPoint = connection.localAddress();
    }

    public String sessionKey() {
        return sessionKey;
    }

    public SocketAddress remoteEndPoint() {
        return remoteEndPoint;
    }

    public SocketAddress localEndPoint() {
        return localEndPoint;
    }

    public TcpSocketServer server() {
        return server;
    }

    /**
     * Time {@link #start()} was called; empty before that.
     */
    public Optional<Instant> startTime() {
        return Optional.ofNullable(startTime);
    }

    public boolean isConnected() {
        return state.get() == State.CONNECTED && connection.isOpen();
    }

    /**
     * Start the session.
     *
     * <p>Calling this on a session that was closed before it started returns
     * the already-completed lifecycle future.</p>
     *
     * @return a future that completes when the session has ended
     * @throws IllegalStateException if the session was already started
     */
    public CompletableFuture<Void> start() {
        // Held across the transition and onSessionStarted: closed is never announced before started.
        synchronized (callbackLock) {
            if (!state.compareAndSet(State.NEW, State.CONNECTED)) {
                if (state.get() == State.CLOSED) {
                    return terminated;
                }
                throw new IllegalStateException("Session [" + sessionKey + "] has already been started.");
            }
            startTime = Instant.now();

            try {
                dispatcher.onSessionStarted(this);
            } catch (RuntimeException e) {
                terminate(e);
                return terminated;
            }
        }

        if (state.get() == State.CONNECTED) {
            connection.startReading(new ConnectionListener());
        }
        return terminated;
    }

    public CompletableFuture<Void> send(byte[] data) {
        Objects.requireNonNull(data, "data");
        return send(data, 0, data.length);
    }

    /**
     * Write {@code count} bytes of {@code data} starting at {@code offset}.
     *
     * <p>The future fails with a {@link ClosedChannelException} once the
     * session has closed.</p>
     *
     * @throws IndexOutOfBoundsException if the range does not fit {@code data}
     */
    public CompletableFuture<Void> send(byte[] data, int offset, int count) {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, count, data.length);

        if (state.get() == State.CLOSED) {
            return CompletableFuture.failedFuture(new ClosedChannelException());
        }
        return connection.write(data, offset, count);
    }

    /**
     * Close the session. Idempotent and safe from any thread.
     *
     * @return a future that completes once the connection is closed and
     *         {@code onSessionClosed} has run; it never fails
     */
    public CompletableFuture<Void> close() {
        terminate(null);
        return closed;
    }

    private void terminate(Throwable cause) {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }

        CompletableFuture<Void> closing;
        try {
            closing = connection.close();
        } catch (RuntimeException e) {
            closing = CompletableFuture.failedFuture(e);
        }
        closing.whenComplete((ignored, closeFailure) -> finish(previous, cause, closeFailure));
    }

    private void finish(State previous, Throwable cause, Throwable closeFailure) {
        Throwable outcome = cause;
        if (closeFailure != null && !ShutdownNoise.isExpected(closeFailure)) {
            outcome = merge(outcome, ShutdownNoise.unwrap(closeFailure));
        }

        try {
            // A session that never started never announced itself.
            if (previous == State.CONNECTED) {
                synchronized (callbackLock) {
                    dispatcher.onSessionClosed(this);
                }
            }
        } catch (RuntimeException e) {
            outcome = merge(outcome, e);
        } finally {
            if (outcome == null || outcome instanceof IOException) {
                terminated.complete(null);
            } else {
                terminated.completeExceptionally(outcome);
            }
        }
    }

    private static Throwable merge(Throwable first, Throwable next) {
        if (first == null) {
            return next;
        }
        if (first != next) {
            first.addSuppressed(next);
        }
        return first;
    }

    @Override
    public String toString() {
        return "TcpSocketSession[key=" + sessionKey + ", remote=" + remoteEndPoint + ']';
    }

    /**
     * ConnectionListener
     * -------------------------------------------------------------------------
     * Receives transport callbacks and turns them into dispatcher callbacks.
     */
    private final class ConnectionListener implements StreamConnectionListener {

        @Override
        public void onReceived(ReceivedBytes bytes) {
            while (bytes.readableBytes() > 0 && state.get() == State.CONNECTED) {
                byte[] buffer = bufferManager.borrowBuffer();
                try {
                    int count = Math.min(buffer.length, bytes.readableBytes());
                    bytes.readBytes(buffer, 0, count);
                    synchronized (callbackLock) {
                        dispatcher.onSessionDataReceived(TcpSocketSession.this, buffer, 0, count);
                    }
                } catch (RuntimeException e) {
                    terminate(e);
                    return;
                } finally {
                    bufferManager.returnBuffer(buffer);
                }
            }
        }

        @Override
        public void onClosed(Throwable cause) {
            terminate(cause);
        }
    }
}
