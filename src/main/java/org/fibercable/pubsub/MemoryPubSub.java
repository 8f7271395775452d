package org.fibercable.pubsub;

import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.core.Callback;
import org.jetlang.core.Disposable;
import org.jetlang.core.DisposingExecutor;
import org.jetlang.core.SynchronousDisposingExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * In process bus with one {@link MemoryChannel} per topic.
 */
public class MemoryPubSub implements PubSub {

    private static final Logger log = LoggerFactory.getLogger(MemoryPubSub.class);

    private final Object lock = new Object();
    private final Map<String, Topic> topics = new HashMap<>();
    private final DisposingExecutor deliveryExecutor;

    /**
     * Callbacks run on the publishing thread.
     */
    public MemoryPubSub() {
        this(new SynchronousDisposingExecutor());
    }

    public MemoryPubSub(DisposingExecutor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public void publish(String topic, String payload) {
        Channel<String> channel;
        synchronized (lock) {
            Topic t = topics.get(topic);
            if (t == null) {
                log.debug("No subscribers for {}", topic);
                return;
            }
            channel = t.channel;
        }
        channel.publish(payload);
    }

    @Override
    public void subscribe(String topic, Callback<String> callback) {
        synchronized (lock) {
            Topic t = topics.computeIfAbsent(topic, Topic::new);
            Disposable sub = t.channel.subscribe(deliveryExecutor, callback);
            t.subscriptions.computeIfAbsent(callback, (c) -> new ArrayList<>()).add(sub);
        }
    }

    @Override
    public void unsubscribe(String topic, Callback<String> callback) {
        Disposable toDispose = null;
        synchronized (lock) {
            Topic t = topics.get(topic);
            if (t != null) {
                List<Disposable> subs = t.subscriptions.get(callback);
                if (subs != null) {
                    toDispose = subs.remove(subs.size() - 1);
                    if (subs.isEmpty()) {
                        t.subscriptions.remove(callback);
                    }
                }
                if (t.subscriptions.isEmpty()) {
                    topics.remove(topic);
                }
            }
        }
        if (toDispose != null) {
            toDispose.dispose();
        } else {
            log.debug("Ignoring unsubscribe of unknown callback from {}", topic);
        }
    }

    public int subscriberCount(String topic) {
        synchronized (lock) {
            Topic t = topics.get(topic);
            if (t == null) {
                return 0;
            }
            int count = 0;
            for (List<Disposable> subs : t.subscriptions.values()) {
                count += subs.size();
            }
            return count;
        }
    }

    private static class Topic {
        private final String name;
        private final MemoryChannel<String> channel = new MemoryChannel<>();
        private final Map<Callback<String>, List<Disposable>> subscriptions = new IdentityHashMap<>();

        Topic(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return "Topic{" + name + '}';
        }
    }
}
