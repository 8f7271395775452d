package org.fibercable.server;

import org.fibercable.CableHarness;
import org.fibercable.EventAssert;
import org.fibercable.RecordingTransport;
import org.fibercable.connection.Connection;
import org.fibercable.connection.ConnectionStatistics;
import org.junit.After;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.fibercable.CableHarness.flush;
import static org.fibercable.CableHarness.subscribe;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CableServerTest {

    private final CableHarness harness = new CableHarness();

    @After
    public void close() {
        harness.dispose();
    }

    @Test
    public void broadcastPublishesJson() {
        EventAssert<String> received = EventAssert.expect(1);
        harness.pubsub.subscribe("room_1", received.createCallback());

        harness.server().broadcast("room_1", Collections.singletonMap("content", "hi"));

        received.assertEvent();
        assertEquals("{\"content\":\"hi\"}", received.received.get(0));
    }

    @Test
    public void disconnectPublishesToInternalTopic() {
        EventAssert<String> received = EventAssert.expect(1);
        harness.pubsub.subscribe("cable/internal/7", received.createCallback());

        harness.server().disconnect(Collections.singletonMap("current_user", 7));

        received.assertEvent();
        assertEquals("{\"type\":\"disconnect\"}", received.received.get(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void disconnectNeedsIdentity() {
        harness.server().disconnect(Collections.emptyMap());
    }

    @Test
    public void internalTopicUsesConfiguredPrefix() {
        harness.config.setInternalTopicPrefix("ops:");
        assertEquals("ops:ann", harness.server().internalTopicFor("ann"));
    }

    @Test
    public void findsConnectionsByIdentity() {
        Connection ann = harness.connect(new RecordingTransport(), Collections.singletonMap("current_user", "ann"));
        Connection bob = harness.connect(new RecordingTransport(), Collections.singletonMap("current_user", "bob"));

        assertEquals(2, harness.server().connections().size());
        assertEquals(Collections.singletonList(ann), harness.server().connectionsFor("current_user", "ann"));
        assertEquals(Collections.singletonList(bob), harness.server().connectionsFor("current_user", "bob"));
        assertTrue(harness.server().connectionsFor("current_user", "cid").isEmpty());

        List<ConnectionStatistics> stats = harness.server().statistics();
        assertEquals(2, stats.size());
    }

    @Test
    public void disposeClosesEveryConnection() {
        EventAssert<Void> disconnected = EventAssert.expect(2);
        harness.callbacks.afterDisconnect(disconnected.asConnectionCallback());
        RecordingTransport first = new RecordingTransport();
        RecordingTransport second = new RecordingTransport();
        harness.connect(first);
        harness.connect(second);

        harness.server().dispose();

        disconnected.assertEvent();
        assertFalse(first.isAlive());
        assertFalse(second.isAlive());
        assertTrue(harness.server().connections().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void poolNeedsAWorker() {
        new CableConfig().setWorkerPoolSize(0);
    }

    @Test
    public void disposeTearsDownWhenTheCloseEventArrivesLater() throws InterruptedException {
        EventAssert<Void> disconnected = EventAssert.expect(1);
        harness.callbacks.afterDisconnect(disconnected.asConnectionCallback());
        CableServer server = new CableServer(harness.config, harness.pubsub, harness.channels,
                new WorkerPool(1), harness.callbacks);
        LateClosingTransport transport = new LateClosingTransport();
        Connection connection = server.createConnection(transport, Collections.singletonMap("current_user", "ann"));
        assertTrue(connection.process().isAccepted());
        transport.fireOpen();
        transport.fireMessage(subscribe("chat", "{\"channel\":\"ChatChannel\",\"room\":\"5\"}"));
        flush(connection);
        assertEquals(1, harness.pubsub.subscriberCount("room_5"));

        server.dispose();

        disconnected.assertEvent();
        assertEquals(Connection.State.CLOSED, connection.getState());
        assertEquals(0, harness.pubsub.subscriberCount("room_5"));
        assertEquals(0, harness.pubsub.subscriberCount("cable/internal/ann"));
        assertTrue(server.connections().isEmpty());

        assertTrue(transport.closeEventDelivered.await(10, TimeUnit.SECONDS));
        assertNull(transport.closeEventFailure.get());
        assertEquals(1, disconnected.receiveCount.get());
    }

    /**
     * Raises its close event from another thread after close() has returned, like a websocket server's IO thread.
     */
    private static class LateClosingTransport extends RecordingTransport {
        final CountDownLatch closeEventDelivered = new CountDownLatch(1);
        final AtomicReference<Throwable> closeEventFailure = new AtomicReference<>();

        @Override
        public void close() {
            Thread io = new Thread(() -> {
                try {
                    Thread.sleep(200);
                    super.close();
                } catch (Throwable failed) {
                    closeEventFailure.set(failed);
                } finally {
                    closeEventDelivered.countDown();
                }
            }, "late-close");
            io.setDaemon(true);
            io.start();
        }
    }
}
