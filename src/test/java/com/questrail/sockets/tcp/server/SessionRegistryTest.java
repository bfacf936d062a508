package com.questrail.sockets.tcp.server;

import com.questrail.sockets.buffer.GrowingByteBufferManager;
import com.questrail.sockets.observability.NullObservabilitySink;
import com.questrail.sockets.tcp.transport.FakeStreamConnection;
import com.questrail.sockets.tcp.transport.FakeStreamTransport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class SessionRegistryTest {

    private final TcpSocketServer server = TcpSocketServer.builder()
        .withListenedPort(0)
        .withDispatcher((session, data, offset, count) -> {})
        .withObservabilitySink(NullObservabilitySink.INSTANCE)
        .withTransport(new FakeStreamTransport())
        .build();

    private final SessionRegistry registry = new SessionRegistry();

    private TcpSocketSession newSession() {
        return new TcpSocketSession(new FakeStreamConnection(), new GrowingByteBufferManager(0, 16),
            (session, data, offset, count) -> {}, server);
    }

    @Test
    void addFindRemove() {
        TcpSocketSession session = newSession();

        assertTrue(registry.tryAdd(session));
        assertEquals(1, registry.size());
        assertSame(session, registry.find(session.sessionKey()).orElseThrow());

        assertTrue(registry.remove(session).isPresent());
        assertEquals(0, registry.size());
        assertTrue(registry.find(session.sessionKey()).isEmpty());
    }

    @Test
    void secondAddAndSecondRemoveAreRefused() {
        TcpSocketSession session = newSession();

        assertTrue(registry.tryAdd(session));
        assertFalse(registry.tryAdd(session));
        assertEquals(1, registry.size());

        assertTrue(registry.remove(session).isPresent());
        assertTrue(registry.remove(session).isEmpty());
    }

    @Test
    void removeOfUnregisteredSessionIsRefused() {
        assertTrue(registry.remove(newSession()).isEmpty());
    }

    @Test
    void snapshotIsDetachedFromLaterChanges() {
        TcpSocketSession a = newSession();
        TcpSocketSession b = newSession();
        registry.tryAdd(a);
        registry.tryAdd(b);

        List<TcpSocketSession> snapshot = registry.sessions();
        registry.remove(a);

        assertEquals(2, snapshot.size());
        assertEquals(1, registry.sessions().size());
    }

    @Test
    void concurrentRemovesSucceedExactlyOncePerSession() throws Exception {
        List<TcpSocketSession> sessions = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            TcpSocketSession session = newSession();
            assertTrue(registry.tryAdd(session));
            sessions.add(session);
        }

        AtomicInteger removed = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService racers = Executors.newFixedThreadPool(4);
        try {
            for (int t = 0; t < 4; t++) {
                racers.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (TcpSocketSession session : sessions) {
                        if (registry.remove(session).isPresent()) {
                            removed.incrementAndGet();
                        }
                    }
                });
            }
            go.countDown();
        } finally {
            racers.shutdown();
            assertTrue(racers.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(200, removed.get());
        assertEquals(0, registry.size());
    }
}
