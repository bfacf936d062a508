package com.questrail.sockets.tcp.server;

import com.questrail.sockets.buffer.GrowingByteBufferManager;
import com.questrail.sockets.observability.NullObservabilitySink;
import com.questrail.sockets.tcp.transport.FakeStreamConnection;
import com.questrail.sockets.tcp.transport.FakeStreamTransport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

final class TcpSocketSessionTest {

    private final TcpSocketServer server = TcpSocketServer.builder()
        .withListenedPort(0)
        .withDispatcher((session, data, offset, count) -> {})
        .withObservabilitySink(NullObservabilitySink.INSTANCE)
        .withTransport(new FakeStreamTransport())
        .build();

    private final GrowingByteBufferManager pool = new GrowingByteBufferManager(1, 4);
    private final FakeStreamConnection connection = new FakeStreamConnection();
    private final RecordingDispatcher dispatcher = new RecordingDispatcher();
    private final TcpSocketSession session = new TcpSocketSession(connection, pool, dispatcher, server);

    @Test
    void startAnnouncesSessionThenReads() {
        CompletableFuture<Void> lifecycle = session.start();

        assertFalse(lifecycle.isDone());
        assertTrue(connection.isReading());
        assertTrue(session.isConnected());
        assertTrue(session.startTime().isPresent());
        assertEquals(List.of("started:" + session.sessionKey()), dispatcher.calls());
    }

    @Test
    void receivedBytesAreDeliveredInBufferSizedChunks() {
        session.start();

        connection.inject(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 });

        assertEquals(3, dispatcher.count("data:"));
        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 }, dispatcher.received());
        assertEquals(pool.totalBuffers(), pool.availableBuffers());
    }

    @Test
    void peerCloseEndsSessionNormally() {
        CompletableFuture<Void> lifecycle = session.start();

        connection.closeWith(null);

        assertTrue(lifecycle.isDone());
        assertFalse(lifecycle.isCompletedExceptionally());
        assertFalse(session.isConnected());
        assertEquals(1, dispatcher.count("closed:"));
    }

    @Test
    void ioFailureEndsSessionNormally() {
        CompletableFuture<Void> lifecycle = session.start();

        connection.closeWith(new IOException("connection reset"));

        assertTrue(lifecycle.isDone());
        assertFalse(lifecycle.isCompletedExceptionally());
    }

    @Test
    void receiveTimeoutFailsTheLifecycle() {
        CompletableFuture<Void> lifecycle = session.start();

        connection.closeWith(new TimeoutException("idle"));

        CompletionException failure = assertThrows(CompletionException.class, lifecycle::join);
        assertInstanceOf(TimeoutException.class, failure.getCause());
        assertEquals(1, dispatcher.count("closed:"));
    }

    @Test
    void dispatcherFailureClosesSessionAndFailsLifecycle() {
        IllegalArgumentException boom = new IllegalArgumentException("bad payload");
        dispatcher.onData((s, data, offset, count) -> {
            throw boom;
        });
        CompletableFuture<Void> lifecycle = session.start();

        connection.inject(new byte[] { 1, 2, 3, 4, 5, 6 });

        CompletionException failure = assertThrows(CompletionException.class, lifecycle::join);
        assertSame(boom, failure.getCause());
        assertFalse(connection.isOpen());
        assertEquals(1, dispatcher.count("data:"));
        assertEquals(1, dispatcher.count("closed:"));
        assertEquals(pool.totalBuffers(), pool.availableBuffers());
    }

    @Test
    void startedFailureClosesSessionWithoutReading() {
        dispatcher.onStarted(s -> {
            throw new IllegalArgumentException("rejected");
        });

        CompletableFuture<Void> lifecycle = session.start();

        assertTrue(lifecycle.isCompletedExceptionally());
        assertFalse(connection.isReading());
        assertEquals(1, dispatcher.count("closed:"));
    }

    @Test
    void closeIsIdempotent() {
        CompletableFuture<Void> lifecycle = session.start();

        CompletableFuture<Void> first = session.close();
        CompletableFuture<Void> second = session.close();

        assertSame(first, second);
        assertTrue(first.isDone());
        assertTrue(lifecycle.isDone());
        assertEquals(1, connection.closeCalls());
        assertEquals(1, dispatcher.count("closed:"));
    }

    @Test
    void closeNeverFailsEvenWhenLifecycleDoes() {
        CompletableFuture<Void> lifecycle = session.start();
        connection.closeWith(new TimeoutException("idle"));

        assertTrue(lifecycle.isCompletedExceptionally());
        assertDoesNotThrow(() -> session.close().join());
    }

    @Test
    void closeRacingPeerCloseAnnouncesOnce() throws Exception {
        for (int round = 0; round < 50; round++) {
            FakeStreamConnection c = new FakeStreamConnection();
            RecordingDispatcher d = new RecordingDispatcher();
            TcpSocketSession s = new TcpSocketSession(c, pool, d, server);
            s.start();

            CountDownLatch go = new CountDownLatch(1);
            Thread peer = new Thread(() -> {
                awaitQuietly(go);
                c.closeWith(null);
            });
            Thread local = new Thread(() -> {
                awaitQuietly(go);
                s.close();
            });
            peer.start();
            local.start();
            go.countDown();
            peer.join();
            local.join();

            assertEquals(1, d.count("closed:"));
        }
    }

    @Test
    void closeRacingStartNeverAnnouncesClosedFirst() throws Exception {
        for (int round = 0; round < 2000; round++) {
            FakeStreamConnection c = new FakeStreamConnection();
            RecordingDispatcher d = new RecordingDispatcher();
            TcpSocketSession s = new TcpSocketSession(c, pool, d, server);

            CyclicBarrier barrier = new CyclicBarrier(2);
            Thread closer = new Thread(() -> {
                awaitQuietly(barrier);
                s.close();
            });
            closer.start();
            awaitQuietly(barrier);
            s.start();
            closer.join();

            List<String> calls = d.calls();
            if (calls.isEmpty()) {
                continue;
            }
            assertEquals(List.of("started:" + s.sessionKey(), "closed:" + s.sessionKey()), calls,
                "round " + round);
        }
    }

    @Test
    void closedBeforeStartNeverAnnounces() {
        session.close();

        CompletableFuture<Void> lifecycle = session.start();

        assertTrue(lifecycle.isDone());
        assertTrue(dispatcher.calls().isEmpty());
        assertFalse(connection.isReading());
    }

    @Test
    void secondStartIsRejected() {
        session.start();
        assertThrows(IllegalStateException.class, session::start);
    }

    @Test
    void sendWritesRange() {
        session.start();

        session.send(new byte[] { 9, 8, 7, 6 }, 1, 2).join();

        assertArrayEquals(new byte[] { 8, 7 }, connection.writtenBytes());
    }

    @Test
    void sendAfterCloseFails() {
        session.start();
        session.close();

        CompletionException failure = assertThrows(CompletionException.class,
            () -> session.send(new byte[] { 1 }).join());
        assertInstanceOf(ClosedChannelException.class, failure.getCause());
    }

    @Test
    void sendRejectsBadRange() {
        assertThrows(IndexOutOfBoundsException.class, () -> session.send(new byte[2], 1, 2));
        assertThrows(NullPointerException.class, () -> session.send(null));
    }

    @Test
    void endpointsAndOwnerAreExposed() {
        assertEquals(connection.remoteAddress(), session.remoteEndPoint());
        assertEquals(connection.localAddress(), session.localEndPoint());
        assertSame(server, session.server());
        assertTrue(session.startTime().isEmpty());
        assertNotEquals(session.sessionKey(),
            new TcpSocketSession(new FakeStreamConnection(), pool, dispatcher, server).sessionKey());
    }

    private static void awaitQuietly(CyclicBarrier barrier) {
        try {
            barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (BrokenBarrierException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
