package com.questrail.sockets.tcp.server;

import com.questrail.sockets.buffer.BufferManager;
import com.questrail.sockets.buffer.GrowingByteBufferManager;
import com.questrail.sockets.observability.RoutingMissEvent;
import com.questrail.sockets.observability.ServerStateTransitionEvent;
import com.questrail.sockets.observability.SessionEvent;
import com.questrail.sockets.observability.Slf4jSocketServerObservabilitySink;
import com.questrail.sockets.observability.SocketServerErrorEvent;
import com.questrail.sockets.observability.SocketServerObservabilitySink;
import com.questrail.sockets.tcp.transport.StreamConnection;
import com.questrail.sockets.tcp.transport.StreamListener;
import com.questrail.sockets.tcp.transport.StreamTransport;
import com.questrail.sockets.tcp.transport.netty.NettyStreamTransport;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TcpSocketServer
 * =============================================================================
 * Accepts stream connections and runs each one as an independent session.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   IDLE --start()--> LISTENING --stop()--> DISPOSED
 * </pre>
 * Transitions are compare-and-set on a single state field; no lock is held
 * across start or stop. A disposed server is never restarted.
 *
 * <h2>Accept loop</h2>
 * While {@code LISTENING}, the loop claims one connection at a time from the
 * listener, wraps it in a {@link TcpSocketSession}, and hands the session to its
 * own unit of work on the server executor. The loop re-arms itself after every
 * connection and ends silently when the listener is closed.
 *
 * <h2>Per-session unit of work</h2>
 * <ol>
 *   <li>register the session; a key collision drops the connection</li>
 *   <li>start the session and wait (asynchronously) for it to end</li>
 *   <li>report a communication timeout or an unexpected failure; neither
 *       escapes the unit</li>
 *   <li>deregister the session, exactly once, whatever happened above</li>
 * </ol>
 *
 * <h2>Sending</h2>
 * {@link #sendTo(String, byte[], int, int)} resolves the key through the registry
 * on every call; an unknown key is reported as a routing miss and never raised.
 * {@link #broadcast(byte[], int, int)} sends to a snapshot of live sessions one
 * after the other, in registry order. A recipient that stalls delays every
 * recipient after it; a recipient that fails is reported and skipped.
 *
 * <h2>Threading</h2>
 * {@link #stop()} blocks until every session has closed. It must not be called
 * from a dispatcher callback, which runs on a session or transport I/O thread.
 */
public final class TcpSocketServer {

    private final InetSocketAddress configuredEndPoint;
    private final TcpSocketServerMessageDispatcher dispatcher;
    private final TcpSocketServerConfiguration configuration;
    private final SocketServerObservabilitySink observability;
    private final StreamTransport transport;
    private final BufferManager bufferManager;
    private final ExecutorService executor;

    private final SessionRegistry sessions = new SessionRegistry();
    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.IDLE);

    private volatile StreamListener listener;
    private volatile InetSocketAddress boundEndPoint;

    private TcpSocketServer(Builder builder) {
        this.configuredEndPoint = builder.listenedEndPoint;
        this.dispatcher = builder.dispatcher;
        this.configuration = builder.configuration;
        this.observability = builder.observabilitySink;
        this.transport = (builder.transport != null)
                ? builder.transport
                : new NettyStreamTransport(configuration.connectionOptions());
        this.bufferManager = new GrowingByteBufferManager(
                configuration.initialBufferAllocationCount(),
                configuration.receiveBufferSize());
        this.executor = Executors.newCachedThreadPool(new SessionThreadFactory());
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Properties
    // -------------------------------------------------------------------------

    /**
     * The bound address once listening (ephemeral port resolved), the configured
     * address before that.
     */
    public InetSocketAddress listenedEndPoint() {
        InetSocketAddress bound = boundEndPoint;
        return (bound != null) ? bound : configuredEndPoint;
    }

    public boolean isActive() {
        return state.get() == ServerState.LISTENING;
    }

    public ServerState state() {
        return state.get();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public TcpSocketServerConfiguration configuration() {
        return configuration;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Bind the listener and launch the accept loop. Returns without waiting for
     * any connection.
     *
     * <p>A bind failure classified as {@link ShutdownNoise} is reported and
     * leaves the server {@code DISPOSED}; any other failure does the same and is
     * then rethrown.</p>
     *
     * @throws TcpSocketServerDisposedException if the server has been stopped
     * @throws IllegalStateException            if the server has already started
     */
    public void start() {
        ServerState origin = state.compareAndExchange(ServerState.IDLE, ServerState.LISTENING);
        if (origin == ServerState.DISPOSED) {
            throw new TcpSocketServerDisposedException("This tcp server has been disposed.");
        }
        else if (origin != ServerState.IDLE) {
            throw new IllegalStateException("This tcp server has already started.");
        }

        try {
            StreamListener bound = transport.listen(configuredEndPoint, configuration.listenerOptions());
            listener = bound;
            boundEndPoint = bound.localAddress();

            if (state.get() != ServerState.LISTENING) {
                // stop() ran while binding and may not have seen the listener.
                bound.close();
                return;
            }

            transition(ServerState.IDLE, ServerState.LISTENING);
            executor.execute(this::acceptNext);
        } catch (Exception e) {
            abortStart(e);
        }
    }

    /**
     * Stop accepting, close every session one after the other, and release the
     * transport. Idempotent; only the first call does any work.
     *
     * <p>Each session's own unit of work removes it from the registry; this
     * method waits for that removal before moving to the next session. Failures
     * classified as {@link ShutdownNoise} are absorbed. Any other failure does
     * not interrupt shutdown and is rethrown once shutdown is complete.</p>
     */
    public void stop() {
        ServerState previous = state.getAndSet(ServerState.DISPOSED);
        if (previous == ServerState.DISPOSED) {
            return;
        }
        transition(previous, ServerState.DISPOSED);

        Throwable failure = null;

        StreamListener l = listener;
        listener = null;
        if (l != null) {
            try {
                l.close();
            } catch (RuntimeException e) {
                failure = collect(failure, e);
            }
        }

        failure = closeSessions(failure);

        executor.shutdown();
        try {
            long timeoutMillis = configuration.shutdownTimeout().toMillis();
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        // Units that were already queued may have registered after the first sweep.
        failure = closeSessions(failure);

        try {
            transport.shutdown();
        } catch (RuntimeException e) {
            failure = collect(failure, e);
        }

        if (failure != null) {
            throw unchecked("Failure while stopping tcp server", failure);
        }
    }

    /**
     * Whether an accepted connection is waiting to be picked up by the accept loop.
     *
     * @throws IllegalStateException if the server is not listening
     */
    public boolean pending() {
        StreamListener l = listener;
        if (!isActive() || l == null) {
            throw new IllegalStateException("The tcp server is not active.");
        }
        return l.pending();
    }

    // -------------------------------------------------------------------------
    // Accept loop
    // -------------------------------------------------------------------------

    private void acceptNext() {
        StreamListener l = listener;
        if (!isActive() || l == null) {
            return;
        }

        try {
            l.accept().whenCompleteAsync(this::onAccepted, executor);
        } catch (RuntimeException e) {
            onAcceptFailure(e);
        }
    }

    private void onAccepted(StreamConnection connection, Throwable failure) {
        if (failure != null) {
            onAcceptFailure(failure);
            return;
        }

        if (!isActive()) {
            connection.close();
            return;
        }

        try {
            TcpSocketSession session = new TcpSocketSession(connection, bufferManager, dispatcher, this);
            executor.execute(() -> process(session));
        } catch (RuntimeException e) {
            connection.close();
            onAcceptFailure(e);
            return;
        }

        acceptNext();
    }

    private void onAcceptFailure(Throwable failure) {
        if (!ShutdownNoise.isExpected(failure)) {
            report("Accept loop terminated by an unexpected failure", ShutdownNoise.unwrap(failure));
        }
    }

    private void process(TcpSocketSession session) {
        if (!sessions.tryAdd(session)) {
            // Keys are random UUIDs; a collision leaves the connection unowned.
            session.close();
            return;
        }

        CompletableFuture<Void> lifecycle;
        try {
            observability.onSessionOpened(sessionEvent(session));
            if (!isActive()) {
                // Registered after stop() swept the registry.
                session.close();
            }
            lifecycle = session.start();
        } catch (RuntimeException e) {
            lifecycle = CompletableFuture.failedFuture(e);
        }

        lifecycle.whenComplete((ignored, failure) -> {
            try {
                if (failure != null) {
                    reportSessionFailure(session, ShutdownNoise.unwrap(failure));
                }
            } finally {
                deregister(session);
            }
        });
    }

    private void deregister(TcpSocketSession session) {
        sessions.remove(session).ifPresent(registration -> {
            try {
                observability.onSessionClosed(sessionEvent(session));
            } finally {
                registration.deregistered().complete(null);
            }
        });
    }

    private void reportSessionFailure(TcpSocketSession session, Throwable cause) {
        if (cause instanceof TimeoutException) {
            report("Session [" + session.sessionKey() + "] communication timed out", cause);
        }
        else {
            report("Session [" + session.sessionKey() + "] terminated by an unexpected failure", cause);
        }
    }

    // -------------------------------------------------------------------------
    // Send
    // -------------------------------------------------------------------------

    public CompletableFuture<Void> sendTo(String sessionKey, byte[] data) {
        Objects.requireNonNull(data, "data");
        return sendTo(sessionKey, data, 0, data.length);
    }

    public CompletableFuture<Void> sendTo(String sessionKey, byte[] data, int offset, int count) {
        Objects.requireNonNull(sessionKey, "sessionKey");

        Optional<TcpSocketSession> found = sessions.find(sessionKey);
        if (found.isEmpty()) {
            observability.onRoutingMiss(new RoutingMissEvent(Instant.now(), sessionKey));
            return CompletableFuture.completedFuture(null);
        }
        return found.get().send(data, offset, count);
    }

    public CompletableFuture<Void> sendTo(TcpSocketSession session, byte[] data) {
        Objects.requireNonNull(data, "data");
        return sendTo(session, data, 0, data.length);
    }

    /**
     * Send to the session registered under {@code session}'s key.
     *
     * <p>The registry is consulted rather than the given object, so a session
     * that has already been deregistered is a routing miss.</p>
     */
    public CompletableFuture<Void> sendTo(TcpSocketSession session, byte[] data, int offset, int count) {
        Objects.requireNonNull(session, "session");
        return sendTo(session.sessionKey(), data, offset, count);
    }

    public CompletableFuture<Void> broadcast(byte[] data) {
        Objects.requireNonNull(data, "data");
        return broadcast(data, 0, data.length);
    }

    /**
     * Send to every session live at call time, sequentially.
     *
     * <p>The returned future completes after every recipient was attempted. It
     * does not fail because of an individual recipient.</p>
     */
    public CompletableFuture<Void> broadcast(byte[] data, int offset, int count) {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, count, data.length);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (TcpSocketSession session : sessions.sessions()) {
            chain = chain.thenCompose(ignored -> sendQuietly(session, data, offset, count));
        }
        return chain;
    }

    private CompletableFuture<Void> sendQuietly(TcpSocketSession session, byte[] data, int offset, int count) {
        CompletableFuture<Void> sent;
        try {
            sent = session.send(data, offset, count);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.handle((ignored, failure) -> {
            if (failure != null) {
                report("Broadcast to session [" + session.sessionKey() + "] failed", ShutdownNoise.unwrap(failure));
            }
            return null;
        });
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void abortStart(Exception e) {
        ServerState previous = state.getAndSet(ServerState.DISPOSED);
        if (previous == ServerState.DISPOSED && ShutdownNoise.isExpected(e)) {
            // stop() won the race and has already released everything.
            return;
        }
        report("Failed to listen on " + configuredEndPoint, e);
        if (previous != ServerState.DISPOSED) {
            transition(previous, ServerState.DISPOSED);
        }

        StreamListener l = listener;
        listener = null;
        if (l != null) {
            l.close();
        }
        executor.shutdown();
        transport.shutdown();

        if (!ShutdownNoise.isExpected(e)) {
            throw unchecked("Failed to start tcp server", e);
        }
    }

    private Throwable closeSessions(Throwable failure) {
        for (SessionRegistry.Registration registration : sessions.registrations()) {
            try {
                registration.session().close().join();
                registration.deregistered().join();
            } catch (RuntimeException e) {
                failure = collect(failure, e);
            }
        }
        return failure;
    }

    private static Throwable collect(Throwable first, Throwable next) {
        if (ShutdownNoise.isExpected(next)) {
            return first;
        }
        Throwable cause = ShutdownNoise.unwrap(next);
        if (first == null) {
            return cause;
        }
        first.addSuppressed(cause);
        return first;
    }

    private static RuntimeException unchecked(String message, Throwable failure) {
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return new TcpSocketServerException(message, failure);
    }

    private void transition(ServerState from, ServerState to) {
        observability.onStateTransition(new ServerStateTransitionEvent(Instant.now(), from, to, listenedEndPoint()));
    }

    private void report(String message, Throwable cause) {
        observability.onError(new SocketServerErrorEvent(Instant.now(), message, cause));
    }

    private static SessionEvent sessionEvent(TcpSocketSession session) {
        return new SessionEvent(Instant.now(), session.sessionKey(), session.remoteEndPoint());
    }

    @Override
    public String toString() {
        return "TcpSocketServer[" + listenedEndPoint() + ", " + state.get() + ", sessions=" + sessions.size() + ']';
    }

    private static final class SessionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "sockets-session-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {
        private InetSocketAddress listenedEndPoint;
        private TcpSocketServerMessageDispatcher dispatcher;
        private TcpSocketServerConfiguration configuration = TcpSocketServerConfiguration.defaults();
        private SocketServerObservabilitySink observabilitySink = new Slf4jSocketServerObservabilitySink();
        private StreamTransport transport;

        public Builder withListenedEndPoint(InetSocketAddress endPoint) {
            this.listenedEndPoint = endPoint;
            return this;
        }

        /**
         * Listen on {@code port} on every local address.
         */
        public Builder withListenedPort(int port) {
            this.listenedEndPoint = new InetSocketAddress(port);
            return this;
        }

        public Builder withDispatcher(TcpSocketServerMessageDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder withConfiguration(TcpSocketServerConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder withObservabilitySink(SocketServerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the default Netty transport. The server takes ownership and
         * shuts it down on stop.
         */
        public Builder withTransport(StreamTransport transport) {
            this.transport = transport;
            return this;
        }

        public TcpSocketServer build() {
            Objects.requireNonNull(listenedEndPoint, "listenedEndPoint");
            Objects.requireNonNull(dispatcher, "dispatcher");
            Objects.requireNonNull(configuration, "configuration");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new TcpSocketServer(this);
        }
    }
}
