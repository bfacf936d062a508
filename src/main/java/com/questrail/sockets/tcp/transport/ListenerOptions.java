package com.questrail.sockets.tcp.transport;

/**
 * Options applied when a listening endpoint is bound.
 *
 * @param backlog           maximum length of the pending connection queue
 * @param allowNatTraversal whether the endpoint may be reached through NAT
 *                          traversal mechanisms, where the platform offers any
 */
public record ListenerOptions(int backlog, boolean allowNatTraversal) {
    public ListenerOptions {
        if (backlog <= 0) {
            throw new IllegalArgumentException("backlog must be > 0");
        }
    }
}
