package org.fibercable.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fibercable.channel.ChannelRegistry;
import org.fibercable.connection.Connection;
import org.fibercable.connection.ConnectionCallbacks;
import org.fibercable.connection.ConnectionStatistics;
import org.fibercable.connection.Identification;
import org.fibercable.core.Json;
import org.fibercable.pubsub.PubSub;
import org.fibercable.transport.CableTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Entry point shared by all connections: the bus, the worker pool, the registered channels and the
 * connect hooks. Transport code calls {@link #createConnection} for every upgraded socket and then
 * {@link Connection#process()}.
 */
public class CableServer implements ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(CableServer.class);

    private final CableConfig config;
    private final PubSub pubsub;
    private final ChannelRegistry channels;
    private final WorkerPool workerPool;
    private final ConnectionCallbacks callbacks;
    private final Set<Connection> connections = ConcurrentHashMap.newKeySet();

    public CableServer(CableConfig config, PubSub pubsub, ChannelRegistry channels) {
        this(config, pubsub, channels, new WorkerPool(config.getWorkerPoolSize()), new ConnectionCallbacks());
    }

    public CableServer(CableConfig config, PubSub pubsub, ChannelRegistry channels, WorkerPool workerPool, ConnectionCallbacks callbacks) {
        this.config = config;
        this.pubsub = pubsub;
        this.channels = channels;
        this.workerPool = workerPool;
        this.callbacks = callbacks;
    }

    /**
     * @param identity already authenticated identity of the client, may be empty.
     */
    public Connection createConnection(CableTransport transport, Map<String, ?> identity) {
        return new Connection(this, transport, new Identification(identity));
    }

    @Override
    public void addConnection(Connection connection) {
        connections.add(connection);
    }

    @Override
    public void removeConnection(Connection connection) {
        connections.remove(connection);
    }

    /**
     * Publishes a message to every channel streaming the topic, in this process or any other sharing the bus.
     */
    public void broadcast(String topic, Object message) {
        String payload = Json.encode(message);
        log.info("Broadcasting to {}: {}", topic, payload);
        pubsub.publish(topic, payload);
    }

    /**
     * Asks every connection with this identity to close, wherever it is connected.
     */
    public void disconnect(Map<String, ?> identity) {
        String connectionIdentifier = Identification.connectionIdentifier(identity);
        if (connectionIdentifier.isEmpty()) {
            throw new IllegalArgumentException("Identity is required to disconnect: " + identity);
        }
        ObjectNode msg = Json.object();
        msg.put("type", "disconnect");
        pubsub.publish(internalTopicFor(connectionIdentifier), Json.encode(msg));
    }

    public String internalTopicFor(String connectionIdentifier) {
        return config.getInternalTopicPrefix() + connectionIdentifier;
    }

    public List<Connection> connections() {
        return new ArrayList<>(connections);
    }

    public List<Connection> connectionsFor(String key, Object value) {
        List<Connection> result = new ArrayList<>();
        for (Connection connection : connections) {
            if (connection.getIdentification().matches(key, value)) {
                result.add(connection);
            }
        }
        return result;
    }

    public List<ConnectionStatistics> statistics() {
        List<ConnectionStatistics> stats = new ArrayList<>();
        for (Connection connection : connections) {
            stats.add(connection.statistics());
        }
        return stats;
    }

    /**
     * Tears down every open connection on its own fiber, waiting for each, then stops the workers.
     */
    public void dispose() {
        long timeout = config.getShutdownTimeoutInMs();
        try {
            for (Connection connection : connections()) {
                if (!connection.shutdown(timeout, TimeUnit.MILLISECONDS)) {
                    log.warn("Teardown of {} did not finish within {} ms", connection, timeout);
                }
            }
        } catch (InterruptedException interrupted) {
            log.warn("Interrupted while closing connections", interrupted);
            Thread.currentThread().interrupt();
        } finally {
            workerPool.dispose();
        }
    }

    public CableConfig getConfig() {
        return config;
    }

    public PubSub getPubSub() {
        return pubsub;
    }

    public ChannelRegistry getChannels() {
        return channels;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public ConnectionCallbacks getCallbacks() {
        return callbacks;
    }
}
