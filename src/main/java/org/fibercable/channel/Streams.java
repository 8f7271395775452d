package org.fibercable.channel;

import org.fibercable.core.Json;
import org.fibercable.pubsub.PubSub;
import org.jetlang.core.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Bus topics relayed to one channel's subscriber. Deliveries are moved onto the connection's
 * dispatch queue so they never run concurrently with the channel's actions.
 */
public class Streams {

    private static final Logger log = LoggerFactory.getLogger(Streams.class);

    private final Channel channel;
    private final PubSub pubsub;
    private final Executor dispatch;
    private final List<Binding> bindings = new ArrayList<>();

    public Streams(Channel channel, PubSub pubsub, Executor dispatch) {
        this.channel = channel;
        this.pubsub = pubsub;
        this.dispatch = dispatch;
    }

    /**
     * Relays every payload published on the topic to the subscriber unmodified.
     */
    public void streamFrom(String topic) {
        streamFrom(topic, defaultCallback(topic));
    }

    public void streamFrom(String topic, Callback<String> callback) {
        Binding binding = new Binding(topic, callback);
        synchronized (bindings) {
            bindings.add(binding);
        }
        pubsub.subscribe(topic, binding);
        log.info("{} is streaming from {}", channel.name(), topic);
    }

    public void stopStreamFrom(String topic) {
        List<Binding> removed = new ArrayList<>();
        synchronized (bindings) {
            Iterator<Binding> it = bindings.iterator();
            while (it.hasNext()) {
                Binding binding = it.next();
                if (binding.topic.equals(topic)) {
                    it.remove();
                    removed.add(binding);
                }
            }
        }
        stop(removed);
    }

    public void stopAllStreams() {
        List<Binding> removed;
        synchronized (bindings) {
            removed = new ArrayList<>(bindings);
            bindings.clear();
        }
        stop(removed);
    }

    private void stop(List<Binding> removed) {
        RuntimeException firstFailure = null;
        for (Binding binding : removed) {
            binding.stopped = true;
            try {
                pubsub.unsubscribe(binding.topic, binding);
                log.info("{} stopped streaming from {}", channel.name(), binding.topic);
            } catch (RuntimeException failed) {
                log.error("{} failed to stop streaming from {}", channel.name(), binding.topic, failed);
                if (firstFailure == null) {
                    firstFailure = failed;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    public Set<String> topics() {
        Set<String> topics = new LinkedHashSet<>();
        synchronized (bindings) {
            for (Binding binding : bindings) {
                topics.add(binding.topic);
            }
        }
        return topics;
    }

    public int size() {
        synchronized (bindings) {
            return bindings.size();
        }
    }

    private Callback<String> defaultCallback(String topic) {
        String via = "streamed from " + topic;
        return (message) -> channel.transmit(Json.decode(message), via);
    }

    private class Binding implements Callback<String> {
        private final String topic;
        private final Callback<String> callback;
        private volatile boolean stopped;

        Binding(String topic, Callback<String> callback) {
            this.topic = topic;
            this.callback = callback;
        }

        @Override
        public void onMessage(String message) {
            if (stopped) {
                return;
            }
            dispatch.execute(() -> {
                if (!stopped) {
                    callback.onMessage(message);
                }
            });
        }

        @Override
        public String toString() {
            return "Streams.Binding{" + channel.name() + " <- " + topic + '}';
        }
    }
}
