package com.questrail.sockets.tcp.server;

/**
 * TcpSocketServerMessageDispatcher
 * -----------------------------------------------------------------------------
 * Application callbacks for session lifecycle and inbound data.
 *
 * <p>Only {@link #onSessionDataReceived} is mandatory, so a lambda is enough
 * for servers that do not care about session start and close.</p>
 *
 * <h2>Threading</h2>
 * Callbacks for one session are serialized. {@link #onSessionStarted} runs on
 * a server session thread; {@link #onSessionDataReceived} and
 * {@link #onSessionClosed} normally run on the session's I/O thread, or on
 * whichever thread closed the session. They must not block. In particular, a
 * callback must not wait on a send future or call {@link TcpSocketServer#stop()}.
 *
 * <h2>Failures</h2>
 * A callback that throws closes its session. The exception ends the session's
 * lifecycle and is reported by the server; other sessions are unaffected.
 */
@FunctionalInterface
public interface TcpSocketServerMessageDispatcher {

    /**
     * Called once, after the session is registered and before its first byte
     * is delivered.
     */
    default void onSessionStarted(TcpSocketSession session) {
    }

    /**
     * Called once per received chunk.
     *
     * <p>{@code data} belongs to the server's buffer pool and is reused as soon
     * as this method returns. Copy anything that must outlive the call.</p>
     */
    void onSessionDataReceived(TcpSocketSession session, byte[] data, int offset, int count);

    /**
     * Called exactly once when a started session ends, whatever the cause.
     */
    default void onSessionClosed(TcpSocketSession session) {
    }
}
