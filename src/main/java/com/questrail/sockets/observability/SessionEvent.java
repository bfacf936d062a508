package com.questrail.sockets.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a session entering or leaving the session registry.
 */
public record SessionEvent(
    Instant timestamp,
    String sessionKey,
    SocketAddress remoteEndPoint
) {
}
