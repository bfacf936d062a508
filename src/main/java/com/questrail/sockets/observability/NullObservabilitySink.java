package com.questrail.sockets.observability;

/**
 * No-op implementation of SocketServerObservabilitySink.
 */
public final class NullObservabilitySink implements SocketServerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ServerStateTransitionEvent event) {}

    @Override
    public void onSessionOpened(SessionEvent event) {}

    @Override
    public void onSessionClosed(SessionEvent event) {}

    @Override
    public void onRoutingMiss(RoutingMissEvent event) {}

    @Override
    public void onError(SocketServerErrorEvent event) {}
}
