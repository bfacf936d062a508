package com.questrail.sockets.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of SocketServerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSocketServerObservabilitySink implements SocketServerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSocketServerObservabilitySink.class);

    @Override
    public void onStateTransition(ServerStateTransitionEvent event) {
        log.info("Socket server [{}]: {} -> {}",
            event.listenedEndPoint(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onSessionOpened(SessionEvent event) {
        log.debug("New session [{}] from {}.", event.sessionKey(), event.remoteEndPoint());
    }

    @Override
    public void onSessionClosed(SessionEvent event) {
        log.debug("Close session [{}] from {}.", event.sessionKey(), event.remoteEndPoint());
    }

    @Override
    public void onRoutingMiss(RoutingMissEvent event) {
        log.warn("Cannot find session [{}].", event.sessionKey());
    }

    @Override
    public void onError(SocketServerErrorEvent event) {
        log.error("Socket server error: {}", event.message(), event.cause());
    }
}
