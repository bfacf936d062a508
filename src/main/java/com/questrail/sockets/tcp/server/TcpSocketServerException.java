package com.questrail.sockets.tcp.server;

/**
 * Raised by {@link TcpSocketServer} when an unexpected checked failure has to
 * be surfaced from a lifecycle operation.
 */
public class TcpSocketServerException extends RuntimeException {
    public TcpSocketServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
