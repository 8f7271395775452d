package org.fibercable.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fibercable.connection.Connection;
import org.fibercable.core.Json;
import org.fibercable.core.UnauthorizedException;
import org.jetlang.core.Callback;
import org.jetlang.core.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Unit of behavior bound to one subscription of a connection. An instance lives from the client's
 * subscribe until its unsubscribe or the connection closing, so fields can hold state between actions.
 *
 * <pre>
 * public class ChatChannel extends Channel {
 *     private static final Actions&lt;ChatChannel&gt; ACTIONS = Actions.builder(ChatChannel.class)
 *             .action("speak", ChatChannel::speak)
 *             .build();
 *
 *     protected void subscribed() {
 *         streamFrom("room_" + getParams().path("room").asText());
 *     }
 *
 *     protected Actions&lt;ChatChannel&gt; actions() {
 *         return ACTIONS;
 *     }
 *
 *     private void speak(ObjectNode data) {
 *         ...
 *     }
 * }
 * </pre>
 *
 * Actions, lifecycle hooks, stream deliveries and timers all run on the connection's dispatch queue,
 * one at a time.
 */
public abstract class Channel {

    private static final Logger log = LoggerFactory.getLogger(Channel.class);

    private Connection connection;
    private String identifier;
    private ObjectNode params;
    private Streams streams;
    private final List<Disposable> timers = new ArrayList<>();
    private volatile boolean released;

    /**
     * Binds the instance to its subscription, runs {@link #subscribed()} and then the type's subscribe hooks.
     * A hook that throws stops the sequence.
     */
    public final void subscribeToChannel(Connection connection, String identifier, ObjectNode params) {
        this.connection = connection;
        this.identifier = identifier;
        this.params = params == null ? Json.object() : params;
        this.streams = new Streams(this, connection.getPubSub(), connection::dispatchAsync);
        log.info("{} subscribing", name());
        subscribed();
        for (Consumer<Channel> hook : actions().subscribeHooks()) {
            hook.accept(this);
        }
    }

    /**
     * Runs {@link #unsubscribed()} and the type's unsubscribe hooks, then releases every stream and timer.
     * A failing hook is logged and the rest still run. Safe when {@link #subscribed()} never completed.
     */
    public final void unsubscribeFromChannel() {
        try {
            runUnsubscribeHook(this::unsubscribed);
            for (Consumer<Channel> hook : actions().unsubscribeHooks()) {
                runUnsubscribeHook(() -> hook.accept(this));
            }
        } finally {
            releaseResources();
            log.info("{} unsubscribed", name());
        }
    }

    private void runUnsubscribeHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException failed) {
            log.error("{} unsubscribe hook failed", name(), failed);
        }
    }

    /**
     * Stops timers and streams without running {@link #unsubscribed()}. Used for rejected subscriptions.
     */
    public final void releaseResources() {
        released = true;
        try {
            stopPeriodicTimers();
        } finally {
            if (streams != null) {
                streams.stopAllStreams();
            }
        }
    }

    public final void performAction(ObjectNode data) {
        String action = extractAction(data);
        ObjectNode arguments = data.deepCopy();
        arguments.remove("action");
        Actions<? extends Channel> table = actions();
        if (table.contains(action)) {
            log.info(actionSignature(action, arguments));
            table.invoke(this, action, arguments);
        } else {
            actionMissing(action, arguments);
        }
    }

    /**
     * Called once the client has become a subscriber. Usually sets up streams.
     */
    protected void subscribed() {
    }

    /**
     * Called when the subscription ends, before the unsubscribe hooks. Streams and timers are released afterwards.
     */
    protected void unsubscribed() {
    }

    protected Actions<? extends Channel> actions() {
        return Actions.none();
    }

    protected void actionMissing(String action, ObjectNode data) {
        log.error("Unable to process {}", actionSignature(action, data));
    }

    /**
     * Refuses the subscription from {@link #subscribed()}; the client receives a rejection.
     */
    protected void rejectSubscription() {
        throw new UnauthorizedException(name() + " rejected subscription " + identifier);
    }

    public void transmit(Object data) {
        transmit(data, null);
    }

    /**
     * Sends data to this subscriber wrapped as {"identifier":..., "message": data}.
     */
    public void transmit(Object data, String via) {
        if (via == null) {
            log.info("{} transmitting {}", name(), data);
        } else {
            log.info("{} transmitting {} (via {})", name(), data, via);
        }
        connection.transmit(Json.envelope(identifier, data));
    }

    protected void streamFrom(String topic) {
        streams.streamFrom(topic);
    }

    protected void streamFrom(String topic, Callback<String> callback) {
        streams.streamFrom(topic, callback);
    }

    protected void stopStreamFrom(String topic) {
        streams.stopStreamFrom(topic);
    }

    protected void stopAllStreams() {
        streams.stopAllStreams();
    }

    /**
     * Runs the task on the connection's dispatch queue every interval until unsubscribed.
     */
    protected Disposable periodically(Runnable task, long interval, TimeUnit unit) {
        Disposable timer = connection.scheduleAtFixedRate(() -> {
            if (!released) {
                task.run();
            }
        }, interval, unit);
        synchronized (timers) {
            timers.add(timer);
        }
        return timer;
    }

    private void stopPeriodicTimers() {
        List<Disposable> toStop;
        synchronized (timers) {
            toStop = new ArrayList<>(timers);
            timers.clear();
        }
        for (Disposable timer : toStop) {
            timer.dispose();
        }
    }

    public Streams getStreams() {
        return streams;
    }

    public Connection getConnection() {
        return connection;
    }

    public String getIdentifier() {
        return identifier;
    }

    public ObjectNode getParams() {
        return params;
    }

    /**
     * @return the connection's identity value for key, e.g. the current user.
     */
    protected Object identity(String key) {
        return connection.getIdentification().get(key);
    }

    public String name() {
        return getClass().getSimpleName();
    }

    private static String extractAction(ObjectNode data) {
        JsonNode action = data.get("action");
        if (action == null || action.isNull() || action.asText().isEmpty()) {
            return Actions.DEFAULT_ACTION;
        }
        return action.asText();
    }

    private String actionSignature(String action, ObjectNode arguments) {
        String signature = name() + "#" + action;
        if (arguments.size() > 0) {
            signature += "(" + arguments + ")";
        }
        return signature;
    }

    @Override
    public String toString() {
        return name() + "{identifier='" + identifier + "'}";
    }
}
