package com.questrail.sockets.tcp.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * FakeStreamTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamTransport} implementation.
 *
 * <p>Binds nothing. An unspecified port is replaced by a fixed one so that
 * tests can observe the bound address.</p>
 */
public final class FakeStreamTransport implements StreamTransport {

    public static final int BOUND_PORT = 18080;

    private volatile FakeStreamListener listener;
    private volatile Exception listenFailure;
    private volatile ListenerOptions lastOptions;
    private volatile int shutdownCalls;

    @Override
    public StreamListener listen(InetSocketAddress endPoint, ListenerOptions options) throws IOException {
        Objects.requireNonNull(endPoint, "endPoint");
        this.lastOptions = Objects.requireNonNull(options, "options");

        Exception failure = listenFailure;
        if (failure instanceof IOException) {
            throw (IOException) failure;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }

        int port = (endPoint.getPort() == 0) ? BOUND_PORT : endPoint.getPort();
        FakeStreamListener l = new FakeStreamListener(new InetSocketAddress(endPoint.getAddress(), port));
        this.listener = l;
        return l;
    }

    @Override
    public synchronized void shutdown() {
        shutdownCalls++;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failListenWith(Exception failure) {
        this.listenFailure = failure;
    }

    public FakeStreamListener listener() {
        FakeStreamListener l = listener;
        if (l == null) {
            throw new IllegalStateException("Not listening");
        }
        return l;
    }

    public ListenerOptions lastOptions() {
        return lastOptions;
    }

    public int shutdownCalls() {
        return shutdownCalls;
    }
}
