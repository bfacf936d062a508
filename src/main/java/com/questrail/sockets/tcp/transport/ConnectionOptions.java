package com.questrail.sockets.tcp.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Options applied to every accepted connection.
 *
 * @param noDelay           disable Nagle's algorithm
 * @param keepAlive         enable TCP keep-alive probes
 * @param receiveBufferSize maximum number of bytes delivered per read
 * @param receiveTimeout    idle receive timeout; {@link Duration#ZERO} disables it
 */
public record ConnectionOptions(
    boolean noDelay,
    boolean keepAlive,
    int receiveBufferSize,
    Duration receiveTimeout
) {
    public ConnectionOptions {
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be > 0");
        }
        Objects.requireNonNull(receiveTimeout, "receiveTimeout");
        if (receiveTimeout.isNegative()) {
            throw new IllegalArgumentException("receiveTimeout must not be negative");
        }
    }
}
