package com.questrail.sockets.observability;

import java.time.Instant;

/**
 * Record representing a failure that was reported rather than raised.
 */
public record SocketServerErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
