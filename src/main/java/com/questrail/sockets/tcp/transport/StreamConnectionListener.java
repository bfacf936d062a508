package com.questrail.sockets.tcp.transport;

/**
 * StreamConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for one {@link StreamConnection}.
 *
 * <p>Callbacks for a single connection are serialized. They run on the
 * transport's I/O thread and must not block.</p>
 */
public interface StreamConnectionListener
{
    /**
     * Called once per chunk read from the connection.
     *
     * <p>{@code bytes} is only valid for the duration of the call.</p>
     */
    void onReceived(ReceivedBytes bytes);

    /**
     * Called exactly once when the connection has closed.
     *
     * @param cause {@code null} for an orderly close,
     *              {@link java.util.concurrent.TimeoutException} when the
     *              receive timeout expired, otherwise the I/O failure that
     *              brought the connection down
     */
    void onClosed(Throwable cause);
}
