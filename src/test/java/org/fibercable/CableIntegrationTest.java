package org.fibercable;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fibercable.channel.ChannelRegistry;
import org.fibercable.connection.Connection;
import org.fibercable.connection.ConnectionCallbacks;
import org.fibercable.example.chat.ChatChannel;
import org.fibercable.server.CableConfig;
import org.fibercable.server.CableServer;
import org.fibercable.server.WorkerPool;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.fibercable.CableHarness.flush;
import static org.fibercable.CableHarness.message;
import static org.fibercable.CableHarness.subscribe;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Whole server on a small worker pool: several clients, shared bus, real fibers.
 */
public class CableIntegrationTest {

    private final CountingPubSub pubsub = new CountingPubSub();
    private final ConnectionCallbacks callbacks = new ConnectionCallbacks();
    private CableServer server;

    @Before
    public void start() {
        CableConfig config = new CableConfig();
        config.setHeartbeatIntervalInMs(0);
        config.setWorkerPoolSize(2);
        ChannelRegistry channels = new ChannelRegistry().register("ChatChannel", ChatChannel::new);
        server = new CableServer(config, pubsub, channels, new WorkerPool(config.getWorkerPoolSize()), callbacks);
    }

    @After
    public void stop() {
        server.dispose();
    }

    private Connection open(RecordingTransport transport, Map<String, ?> identity) {
        Connection connection = server.createConnection(transport, identity);
        assertTrue(connection.process().isAccepted());
        transport.fireOpen();
        flush(connection);
        return connection;
    }

    @Test
    public void subscribeThenSpeak() {
        RecordingTransport transport = new RecordingTransport();
        Connection connection = open(transport, Collections.singletonMap("current_user", "ann"));

        transport.fireMessage(subscribe("chat_1", "{\"channel\":\"ChatChannel\"}"));
        transport.fireMessage(message("chat_1", "{\"action\":\"speak\",\"content\":\"hi\"}"));
        flush(connection);

        assertEquals("{\"identifier\":\"chat_1\",\"message\":\"subscribed\"}", transport.takeSent());
        ChatChannel channel = (ChatChannel) connection.getSubscriptions().get("chat_1");
        assertEquals(1, channel.spoken.size());
        assertEquals("{\"content\":\"hi\"}", channel.spoken.get(0).toString());
    }

    @Test
    public void roomBroadcastReachesEveryMemberOnce() {
        RecordingTransport annSocket = new RecordingTransport();
        RecordingTransport bobSocket = new RecordingTransport();
        Connection ann = open(annSocket, Collections.singletonMap("current_user", "ann"));
        Connection bob = open(bobSocket, Collections.singletonMap("current_user", "bob"));
        annSocket.fireMessage(subscribe("room_a", "{\"channel\":\"ChatChannel\",\"room\":\"5\"}"));
        bobSocket.fireMessage(subscribe("room_b", "{\"channel\":\"ChatChannel\",\"room\":\"5\"}"));
        flush(ann);
        flush(bob);
        annSocket.takeSent();
        bobSocket.takeSent();

        annSocket.fireMessage(message("room_a", "{\"action\":\"speak\",\"content\":\"hello\"}"));

        assertEquals("{\"identifier\":\"room_a\",\"message\":{\"content\":\"hello\",\"from\":\"ann\"}}", annSocket.takeSent());
        assertEquals("{\"identifier\":\"room_b\",\"message\":{\"content\":\"hello\",\"from\":\"ann\"}}", bobSocket.takeSent());
        flush(ann);
        flush(bob);
        assertTrue(annSocket.drainSent().isEmpty());
        assertTrue(bobSocket.drainSent().isEmpty());
    }

    @Test
    public void broadcastOnlyReachesStreamingConnections() {
        RecordingTransport listening = new RecordingTransport();
        RecordingTransport elsewhere = new RecordingTransport();
        Connection first = open(listening, Collections.emptyMap());
        Connection second = open(elsewhere, Collections.emptyMap());
        listening.fireMessage(subscribe("chat", "{\"channel\":\"ChatChannel\",\"room\":\"1\"}"));
        elsewhere.fireMessage(subscribe("chat", "{\"channel\":\"ChatChannel\",\"room\":\"2\"}"));
        flush(first);
        flush(second);
        listening.takeSent();
        elsewhere.takeSent();

        server.broadcast("room_1", Collections.singletonMap("content", "only you"));

        assertEquals("{\"identifier\":\"chat\",\"message\":{\"content\":\"only you\"}}", listening.takeSent());
        flush(second);
        assertTrue(elsewhere.drainSent().isEmpty());
    }

    @Test
    public void closingReleasesEveryStream() {
        EventAssert<Void> disconnected = EventAssert.expect(1);
        callbacks.afterDisconnect(disconnected.asConnectionCallback());
        RecordingTransport transport = new RecordingTransport();
        Connection connection = open(transport, Collections.emptyMap());
        transport.fireMessage(subscribe("chat", "{\"channel\":\"ChatChannel\",\"room\":\"9\"}"));
        transport.fireMessage(message("chat", "{\"action\":\"follow\",\"recording_id\":\"3\"}"));
        flush(connection);
        assertEquals(1, pubsub.subscriberCount("room_9"));
        assertEquals(1, pubsub.subscriberCount("comments_for_3"));

        transport.fireClose();
        disconnected.assertEvent();

        assertEquals(2, pubsub.totalUnsubscribes());
        assertEquals(0, pubsub.subscriberCount("room_9"));
        assertEquals(0, pubsub.subscriberCount("comments_for_3"));
        assertTrue(server.connections().isEmpty());
    }

    @Test
    public void manyConnectionsKeepTheirOwnOrder() {
        int clients = 6;
        int messages = 50;
        RecordingTransport[] sockets = new RecordingTransport[clients];
        Connection[] connections = new Connection[clients];
        for (int i = 0; i < clients; i++) {
            sockets[i] = new RecordingTransport();
            connections[i] = open(sockets[i], Collections.singletonMap("current_user", "u" + i));
            sockets[i].fireMessage(subscribe("chat", "{\"channel\":\"ChatChannel\"}"));
        }
        for (int n = 0; n < messages; n++) {
            for (int i = 0; i < clients; i++) {
                sockets[i].fireMessage(message("chat", "{\"action\":\"speak\",\"content\":\"" + n + "\"}"));
            }
        }
        for (int i = 0; i < clients; i++) {
            flush(connections[i]);
            List<ObjectNode> spoken = ((ChatChannel) connections[i].getSubscriptions().get("chat")).spoken;
            assertEquals(messages, spoken.size());
            for (int n = 0; n < messages; n++) {
                assertEquals(String.valueOf(n), spoken.get(n).get("content").asText());
            }
        }
    }
}
