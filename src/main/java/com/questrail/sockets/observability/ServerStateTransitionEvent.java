package com.questrail.sockets.observability;

import com.questrail.sockets.tcp.server.ServerState;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a lifecycle transition of a socket server.
 */
public record ServerStateTransitionEvent(
    Instant timestamp,
    ServerState oldState,
    ServerState newState,
    InetSocketAddress listenedEndPoint
) {
}
