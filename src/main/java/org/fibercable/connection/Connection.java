package org.fibercable.connection;

import com.fasterxml.jackson.databind.JsonNode;
import org.fibercable.core.Envelope;
import org.fibercable.core.Json;
import org.fibercable.core.ProtocolException;
import org.fibercable.core.UnauthorizedException;
import org.fibercable.pubsub.PubSub;
import org.fibercable.server.CableServer;
import org.fibercable.transport.CableTransport;
import org.fibercable.transport.HandshakeResponse;
import org.fibercable.transport.SendResult;
import org.fibercable.transport.TransportListener;
import org.jetlang.core.Callback;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client socket and the channels multiplexed over it.
 * <p>
 * Every transport event is handed to the connection's fiber, so commands, stream deliveries, heartbeats
 * and teardown for one connection never run concurrently. Messages that arrive before the connection has
 * finished opening are buffered and replayed in order once it is {@link State#OPEN}.
 */
public class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    public static final String MDC_KEY = "cable.connection";

    public enum State {
        CONNECTING, OPEN, CLOSED
    }

    private final String id = UUID.randomUUID().toString();
    private final CableServer server;
    private final CableTransport transport;
    private final Identification identification;
    private final Fiber fiber;
    private final Heartbeat heartbeat;
    private final Subscriptions subscriptions;
    private final MessageBuffer messageBuffer;
    private final Instant startedAt = Instant.now();
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);
    private final Callback<String> internalChannel = (message) -> dispatchAsync(this::onInternalMessage, message);
    private volatile String internalTopic;

    public Connection(CableServer server, CableTransport transport, Identification identification) {
        this.server = server;
        this.transport = transport;
        this.identification = identification;
        this.fiber = server.getWorkerPool().newFiber();
        this.heartbeat = new Heartbeat(fiber, server.getConfig().getHeartbeatIntervalInMs(), TimeUnit.MILLISECONDS,
                () -> runTagged(this::beat));
        this.subscriptions = new Subscriptions(this, server.getChannels());
        this.messageBuffer = new MessageBuffer(this::handle);
    }

    /**
     * Binds the transport events. Called once by the transport after the connection is created.
     *
     * @return the response for the upgrade request.
     */
    public HandshakeResponse process() {
        log.info("Started connection {} [WebSocket] for {} at {}", id, transport.getRemoteAddress(), startedAt);
        if (transport.isPossible()) {
            transport.setListener(new Listener());
            return HandshakeResponse.accepted();
        }
        state.set(State.CLOSED);
        fiber.dispose();
        return respondToInvalidRequest();
    }

    /**
     * Routes a raw inbound frame to the message buffer. Dropped if the transport is gone.
     */
    public void receive(String message) {
        if (transport.isAlive()) {
            messageBuffer.append(message);
        } else {
            log.error("Received data without a live transport ({})", message);
        }
    }

    /**
     * Writes raw data to the client. Use {@link org.fibercable.channel.Channel#transmit(Object)} to address a
     * subscriber. Does nothing once the connection or transport is closed.
     */
    public SendResult transmit(String data) {
        if (state.get() == State.CLOSED || !transport.isAlive()) {
            log.debug("Not transmitting on closed connection: {}", data);
            return SendResult.Closed;
        }
        try {
            SendResult result = transport.send(data);
            if (result instanceof SendResult.FailedWithError) {
                log.error("Transmission failed on {}", this, ((SendResult.FailedWithError) result).getFailed());
            }
            return result;
        } catch (RuntimeException failed) {
            log.error("Transmission failed on {}", this, failed);
            return new SendResult.FailedWithError(failed);
        }
    }

    /**
     * Closes the transport. Teardown follows from the transport's close event.
     */
    public void close() {
        if (!transport.isAlive()) {
            log.debug("Transport already closed for {}", this);
            return;
        }
        log.info("Closing connection {}", this);
        transport.close();
    }

    /**
     * Closes the transport and tears the connection down on its own fiber, without waiting for the
     * transport's close event.
     *
     * @return false if teardown did not finish within the timeout.
     */
    public boolean shutdown(long timeout, TimeUnit unit) throws InterruptedException {
        if (state.get() == State.CLOSED) {
            return true;
        }
        CountDownLatch done = new CountDownLatch(1);
        dispatchAsync(() -> {
            try {
                close();
                onClose();
            } finally {
                done.countDown();
            }
        });
        return done.await(timeout, unit);
    }

    /**
     * Runs the task on this connection's fiber, after everything already queued for it.
     */
    public void dispatchAsync(Runnable task) {
        try {
            fiber.execute(() -> runTagged(task));
        } catch (RejectedExecutionException rejected) {
            log.warn("Dropping task for {}, workers are stopped", this, rejected);
        }
    }

    public <T> void dispatchAsync(Callback<T> method, T argument) {
        dispatchAsync(() -> method.onMessage(argument));
    }

    /**
     * Schedules a repeating task on this connection's fiber.
     */
    public Disposable scheduleAtFixedRate(Runnable task, long interval, TimeUnit unit) {
        return fiber.scheduleAtFixedRate(() -> runTagged(task), interval, interval, unit);
    }

    public ConnectionStatistics statistics() {
        return new ConnectionStatistics(identification.connectionIdentifier(), startedAt, subscriptions.identifiers());
    }

    private void onOpen() {
        if (state.get() != State.CONNECTING) {
            log.debug("Ignoring open event for {} in state {}", this, state.get());
            return;
        }
        try {
            server.addConnection(this);
            server.getCallbacks().runConnect(this);
            subscribeToInternalChannel();
            heartbeat.start();
        } catch (UnauthorizedException unauthorized) {
            log.info("Rejecting unauthorized connection {}: {}", this, unauthorized.getMessage());
            transport.reject(respondToInvalidRequest());
            onClose();
            return;
        } catch (RuntimeException failed) {
            log.error("Failed to open {}", this, failed);
            transport.close();
            onClose();
            return;
        }
        if (state.compareAndSet(State.CONNECTING, State.OPEN)) {
            messageBuffer.processAll();
        }
    }

    private void onClose() {
        if (state.getAndSet(State.CLOSED) == State.CLOSED) {
            return;
        }
        log.info("Finished connection {} [WebSocket] for {}", id, transport.getRemoteAddress());
        try {
            server.removeConnection(this);
            subscriptions.unsubscribeFromAll();
            unsubscribeFromInternalChannel();
        } finally {
            heartbeat.stop();
            try {
                server.getCallbacks().runDisconnect(this);
            } finally {
                fiber.dispose();
            }
        }
    }

    private void handle(String message) {
        Envelope envelope;
        try {
            envelope = Envelope.parse(message);
        } catch (ProtocolException malformed) {
            log.error("Dropping malformed message on {}: {}", this, malformed.getMessage());
            return;
        }
        subscriptions.executeCommand(envelope);
    }

    private void beat() {
        transmit(Json.envelope(Heartbeat.PING_IDENTIFIER, Instant.now().getEpochSecond()));
    }

    private void subscribeToInternalChannel() {
        String connectionIdentifier = identification.connectionIdentifier();
        if (!connectionIdentifier.isEmpty()) {
            internalTopic = server.internalTopicFor(connectionIdentifier);
            server.getPubSub().subscribe(internalTopic, internalChannel);
            log.info("Registered connection ({})", connectionIdentifier);
        }
    }

    private void unsubscribeFromInternalChannel() {
        String topic = internalTopic;
        if (topic != null) {
            internalTopic = null;
            server.getPubSub().unsubscribe(topic, internalChannel);
        }
    }

    private void onInternalMessage(String message) {
        JsonNode msg = Json.decode(message);
        String type = msg.path("type").asText();
        if ("disconnect".equals(type)) {
            log.info("Removing connection ({})", identification.connectionIdentifier());
            close();
        } else {
            log.error("Received unrecognized internal message: {}", message);
        }
    }

    private HandshakeResponse respondToInvalidRequest() {
        log.info("Finished connection {} [WebSocket] for {} (rejected)", id, transport.getRemoteAddress());
        return HandshakeResponse.notFound();
    }

    private void runTagged(Runnable task) {
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, logTag());
        try {
            task.run();
        } catch (RuntimeException failed) {
            log.error("Unhandled failure on {}", this, failed);
        } finally {
            if (previous == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previous);
            }
        }
    }

    private String logTag() {
        String connectionIdentifier = identification.connectionIdentifier();
        return connectionIdentifier.isEmpty() ? id : connectionIdentifier;
    }

    public String getId() {
        return id;
    }

    public State getState() {
        return state.get();
    }

    public Identification getIdentification() {
        return identification;
    }

    public PubSub getPubSub() {
        return server.getPubSub();
    }

    public CableServer getServer() {
        return server;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Subscriptions getSubscriptions() {
        return subscriptions;
    }

    public boolean isHeartbeatRunning() {
        return heartbeat.isRunning();
    }

    /**
     * Rejects the connection from a connect callback.
     */
    public void rejectUnauthorizedConnection() {
        throw new UnauthorizedException("Unauthorized connection " + id);
    }

    @Override
    public String toString() {
        return "Connection{" + logTag() + '}';
    }

    private class Listener implements TransportListener {

        @Override
        public void onOpen() {
            dispatchAsync(Connection.this::onOpen);
        }

        @Override
        public void onMessage(String msg) {
            dispatchAsync(Connection.this::receive, msg);
        }

        @Override
        public void onClose() {
            closeOnFiber();
        }

        @Override
        public void onError(String msg) {
            log.error("Transport error on {}: {}", Connection.this, msg);
            closeOnFiber();
        }

        @Override
        public void onException(Exception failed) {
            log.error("Transport failure on {}", Connection.this, failed);
            closeOnFiber();
        }

        // already torn down, possibly by shutdown(), and the fiber may be gone
        private void closeOnFiber() {
            if (state.get() == State.CLOSED) {
                log.debug("Ignoring close event for {}", Connection.this);
                return;
            }
            dispatchAsync(Connection.this::onClose);
        }
    }
}
