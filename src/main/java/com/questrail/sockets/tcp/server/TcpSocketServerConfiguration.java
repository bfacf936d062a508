package com.questrail.sockets.tcp.server;

import com.questrail.sockets.tcp.transport.ConnectionOptions;
import com.questrail.sockets.tcp.transport.ListenerOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a {@link TcpSocketServer}.
 *
 * <p>Every option affects a collaborator (buffer pool, listener bind, accepted
 * connections) or the shutdown wait; none changes the server's control flow.</p>
 */
public record TcpSocketServerConfiguration(
    int pendingConnectionBacklog,
    boolean allowNatTraversal,
    int initialBufferAllocationCount,
    int receiveBufferSize,
    boolean noDelay,
    boolean keepAlive,
    Duration receiveTimeout,
    Duration shutdownTimeout
) {
    public TcpSocketServerConfiguration {
        if (pendingConnectionBacklog <= 0) {
            throw new IllegalArgumentException("pendingConnectionBacklog must be > 0");
        }
        if (initialBufferAllocationCount < 0) {
            throw new IllegalArgumentException("initialBufferAllocationCount must be >= 0");
        }
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be > 0");
        }
        Objects.requireNonNull(receiveTimeout, "receiveTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (receiveTimeout.isNegative()) {
            throw new IllegalArgumentException("receiveTimeout must not be negative");
        }
        if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            throw new IllegalArgumentException("shutdownTimeout must be positive");
        }
    }

    public static TcpSocketServerConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ListenerOptions listenerOptions() {
        return new ListenerOptions(pendingConnectionBacklog, allowNatTraversal);
    }

    public ConnectionOptions connectionOptions() {
        return new ConnectionOptions(noDelay, keepAlive, receiveBufferSize, receiveTimeout);
    }

    public static final class Builder {
        private int pendingConnectionBacklog = 200;
        private boolean allowNatTraversal = true;
        private int initialBufferAllocationCount = 4;
        private int receiveBufferSize = 8192;
        private boolean noDelay = true;
        private boolean keepAlive = false;
        private Duration receiveTimeout = Duration.ZERO;
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder withPendingConnectionBacklog(int backlog) {
            this.pendingConnectionBacklog = backlog;
            return this;
        }

        public Builder withAllowNatTraversal(boolean allow) {
            this.allowNatTraversal = allow;
            return this;
        }

        public Builder withInitialBufferAllocationCount(int count) {
            this.initialBufferAllocationCount = count;
            return this;
        }

        public Builder withReceiveBufferSize(int size) {
            this.receiveBufferSize = size;
            return this;
        }

        public Builder withNoDelay(boolean noDelay) {
            this.noDelay = noDelay;
            return this;
        }

        public Builder withKeepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder withReceiveTimeout(Duration timeout) {
            this.receiveTimeout = timeout;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public TcpSocketServerConfiguration build() {
            return new TcpSocketServerConfiguration(
                pendingConnectionBacklog,
                allowNatTraversal,
                initialBufferAllocationCount,
                receiveBufferSize,
                noDelay,
                keepAlive,
                receiveTimeout,
                shutdownTimeout);
        }
    }
}
