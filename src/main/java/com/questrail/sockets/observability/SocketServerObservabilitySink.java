package com.questrail.sockets.observability;

/**
 * Main interface for receiving socket server observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from accept, I/O and caller threads concurrently.
 * Implementations must be thread-safe and must not throw.</p>
 */
public interface SocketServerObservabilitySink {
    /**
     * Called when the server lifecycle state changes.
     * @param event the transition details
     */
    void onStateTransition(ServerStateTransitionEvent event);

    /**
     * Called after a session has been registered.
     * @param event the session details
     */
    void onSessionOpened(SessionEvent event);

    /**
     * Called after a session has been removed from the registry.
     * @param event the session details
     */
    void onSessionClosed(SessionEvent event);

    /**
     * Called when a send names a session that is not registered.
     * @param event the missed key
     */
    void onRoutingMiss(RoutingMissEvent event);

    /**
     * Called when a failure is absorbed instead of being raised to a caller.
     * @param event the error event
     */
    void onError(SocketServerErrorEvent event);
}
