package org.fibercable.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fibercable.channel.Channel;
import org.fibercable.channel.ChannelRegistry;
import org.fibercable.core.Envelope;
import org.fibercable.core.Json;
import org.fibercable.core.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live channels of one connection keyed by the client's identifier. Commands arrive one at a time on
 * the connection's dispatch queue; {@link #identifiers()} may be read from any thread.
 */
public class Subscriptions {

    private static final Logger log = LoggerFactory.getLogger(Subscriptions.class);

    public static final String SUBSCRIBED = "subscribed";
    public static final String REJECTED = "rejected";

    private final Connection connection;
    private final ChannelRegistry channels;
    private final Map<String, Channel> subscriptions = Collections.synchronizedMap(new LinkedHashMap<>());

    public Subscriptions(Connection connection, ChannelRegistry channels) {
        this.connection = connection;
        this.channels = channels;
    }

    /**
     * Failures are logged and never reach the transport.
     */
    public void executeCommand(Envelope envelope) {
        try {
            String command = envelope.getCommand();
            if (Envelope.SUBSCRIBE.equals(command)) {
                add(envelope);
            } else if (Envelope.UNSUBSCRIBE.equals(command)) {
                remove(envelope);
            } else if (Envelope.MESSAGE.equals(command)) {
                perform(envelope);
            } else {
                log.error("Received unrecognized command in {}", envelope);
            }
        } catch (RuntimeException failed) {
            log.error("Could not execute command from {}", envelope, failed);
        }
    }

    public void add(Envelope envelope) {
        String identifier = envelope.getIdentifier();
        if (subscriptions.containsKey(identifier)) {
            log.error("Already subscribed to {}", identifier);
            return;
        }
        ObjectNode params = envelope.getData();
        String channelName = textOrNull(params.get("channel"));
        Channel channel = channels.create(channelName);
        if (channel == null) {
            log.error("Subscription class not found ({}) for {}, known channels: {}", channelName, identifier, channels.names());
            reject(identifier);
            return;
        }
        try {
            channel.subscribeToChannel(connection, identifier, params);
        } catch (UnauthorizedException unauthorized) {
            log.info("{} rejected subscription to {}", channel.name(), identifier);
            discard(channel);
            reject(identifier);
            return;
        } catch (RuntimeException failed) {
            log.error("{} failed to subscribe {}", channel.name(), identifier, failed);
            discard(channel);
            reject(identifier);
            return;
        }
        subscriptions.put(identifier, channel);
        connection.transmit(Json.envelope(identifier, SUBSCRIBED));
    }

    public void remove(Envelope envelope) {
        String identifier = envelope.getIdentifier();
        Channel channel = subscriptions.get(identifier);
        if (channel == null) {
            log.error("Unable to find subscription with identifier: {}", identifier);
            return;
        }
        try {
            channel.unsubscribeFromChannel();
        } finally {
            subscriptions.remove(identifier);
        }
    }

    public void perform(Envelope envelope) {
        String identifier = envelope.getIdentifier();
        Channel channel = subscriptions.get(identifier);
        if (channel == null) {
            log.error("Unable to find subscription with identifier: {}", identifier);
            return;
        }
        channel.performAction(envelope.getData());
    }

    /**
     * Ends every subscription. A failing channel does not stop the others from being released.
     */
    public void unsubscribeFromAll() {
        List<Channel> all;
        synchronized (subscriptions) {
            all = new ArrayList<>(subscriptions.values());
            subscriptions.clear();
        }
        for (Channel channel : all) {
            try {
                channel.unsubscribeFromChannel();
            } catch (RuntimeException failed) {
                log.error("{} failed to unsubscribe", channel, failed);
            }
        }
    }

    public List<String> identifiers() {
        synchronized (subscriptions) {
            return new ArrayList<>(subscriptions.keySet());
        }
    }

    public Channel get(String identifier) {
        return subscriptions.get(identifier);
    }

    public int size() {
        return subscriptions.size();
    }

    private void discard(Channel channel) {
        try {
            channel.releaseResources();
        } catch (RuntimeException failed) {
            log.error("{} failed to release resources after rejection", channel, failed);
        }
    }

    private void reject(String identifier) {
        connection.transmit(Json.envelope(identifier, REJECTED));
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
