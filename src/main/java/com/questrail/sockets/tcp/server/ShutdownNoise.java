package com.questrail.sockets.tcp.server;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * ShutdownNoise
 * -----------------------------------------------------------------------------
 * The single classification of failures that are a harmless consequence of a
 * concurrent or prior teardown.
 *
 * <p>Expected noise is:</p>
 * <ul>
 *   <li>any {@link IOException}: socket errors, closed channels, failed binds</li>
 *   <li>{@link IllegalStateException}: an operation on something already torn down</li>
 *   <li>{@link RejectedExecutionException}: work submitted to an executor that has shut down</li>
 * </ul>
 *
 * <p>Everything else is unexpected and must be surfaced.</p>
 */
public final class ShutdownNoise {

    private ShutdownNoise() {}

    /**
     * Returns true if {@code failure}, once unwrapped, is expected teardown noise.
     */
    public static boolean isExpected(Throwable failure) {
        Throwable cause = unwrap(failure);
        return cause instanceof IOException
                || cause instanceof IllegalStateException
                || cause instanceof RejectedExecutionException;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
