package com.questrail.sockets.tcp.server;

/**
 * Lifecycle state of a {@link TcpSocketServer}.
 *
 * <p>Transitions only ever go forward: {@code IDLE -> LISTENING -> DISPOSED},
 * or {@code IDLE -> DISPOSED} when a server is stopped before it started.</p>
 */
public enum ServerState {
    /** Constructed, not yet started. */
    IDLE,
    /** Bound and accepting connections. */
    LISTENING,
    /** Stopped. Terminal. */
    DISPOSED
}
