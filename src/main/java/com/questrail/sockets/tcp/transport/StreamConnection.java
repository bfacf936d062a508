package com.questrail.sockets.tcp.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * StreamConnection
 * -----------------------------------------------------------------------------
 * One accepted, bidirectional byte stream.
 *
 * <h2>Write ordering</h2>
 * Every {@link #write(byte[], int, int)} is queued as a whole. Writes issued
 * concurrently from different threads are put on the wire one after the other
 * and never interleave.
 *
 * <h2>Closure</h2>
 * The connection reports closure exactly once through
 * {@link StreamConnectionListener#onClosed(Throwable)}, whichever side closed it.
 */
public interface StreamConnection
{
    /**
     * Install the listener and begin reading. Must be called at most once.
     *
     * <p>If the connection is already closed the listener is told so
     * immediately.</p>
     *
     * @throws IllegalStateException if reading was already started
     */
    void startReading(StreamConnectionListener listener);

    /**
     * Queue {@code count} bytes of {@code data} starting at {@code offset}.
     *
     * <p>The bytes are copied before this method returns, so the caller may
     * reuse the array immediately. The future fails with an
     * {@link java.io.IOException} if the connection is closed.</p>
     */
    CompletableFuture<Void> write(byte[] data, int offset, int count);

    /**
     * Close the connection. Idempotent; the future completes once the
     * underlying socket is closed.
     */
    CompletableFuture<Void> close();

    boolean isOpen();

    SocketAddress remoteAddress();

    SocketAddress localAddress();
}
