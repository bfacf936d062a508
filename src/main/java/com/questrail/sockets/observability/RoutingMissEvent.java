package com.questrail.sockets.observability;

import java.time.Instant;

/**
 * Record representing a send addressed to a session that is not registered.
 */
public record RoutingMissEvent(
    Instant timestamp,
    String sessionKey
) {
}
