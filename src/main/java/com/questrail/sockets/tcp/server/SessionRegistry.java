package com.questrail.sockets.tcp.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SessionRegistry
 * -----------------------------------------------------------------------------
 * Concurrent map from session key to live session.
 *
 * <p>Each registration carries a future that completes when that exact
 * registration is removed, so shutdown can wait for a session's own unit of
 * work to deregister it.</p>
 *
 * <p>{@link #tryAdd} succeeds at most once per key while the key is live, and
 * {@link #remove} succeeds at most once per registration. A removed key may be
 * registered again by an unrelated session.</p>
 */
final class SessionRegistry {

    record Registration(TcpSocketSession session, CompletableFuture<Void> deregistered) {
    }

    private final ConcurrentMap<String, Registration> sessions = new ConcurrentHashMap<>();

    /**
     * Register {@code session} under its key.
     *
     * @return false if the key is already taken
     */
    boolean tryAdd(TcpSocketSession session) {
        Objects.requireNonNull(session, "session");
        return sessions.putIfAbsent(session.sessionKey(),
                new Registration(session, new CompletableFuture<>())) == null;
    }

    /**
     * Remove {@code session}, provided it is the one registered under its key.
     *
     * <p>Only the single call that actually removed the session gets the
     * registration back; the caller completes its {@code deregistered} future
     * once it is done reacting to the removal.</p>
     */
    Optional<Registration> remove(TcpSocketSession session) {
        Objects.requireNonNull(session, "session");
        Registration registration = sessions.get(session.sessionKey());
        if (registration == null || registration.session() != session) {
            return Optional.empty();
        }
        if (!sessions.remove(session.sessionKey(), registration)) {
            return Optional.empty();
        }
        return Optional.of(registration);
    }

    Optional<TcpSocketSession> find(String sessionKey) {
        Registration registration = sessions.get(sessionKey);
        return (registration == null) ? Optional.empty() : Optional.of(registration.session());
    }

    /**
     * Point-in-time copy of the live sessions.
     */
    List<TcpSocketSession> sessions() {
        List<TcpSocketSession> snapshot = new ArrayList<>();
        for (Registration registration : sessions.values()) {
            snapshot.add(registration.session());
        }
        return snapshot;
    }

    /**
     * Point-in-time copy of the live registrations.
     */
    List<Registration> registrations() {
        return new ArrayList<>(sessions.values());
    }

    int size() {
        return sessions.size();
    }
}
