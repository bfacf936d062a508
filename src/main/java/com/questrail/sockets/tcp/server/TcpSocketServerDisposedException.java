package com.questrail.sockets.tcp.server;

/**
 * Indicates an operation on a server that has already been stopped.
 *
 * <p>A stopped server is never restarted; build a new one instead.</p>
 */
public final class TcpSocketServerDisposedException extends IllegalStateException {
    public TcpSocketServerDisposedException(String message) {
        super(message);
    }
}
