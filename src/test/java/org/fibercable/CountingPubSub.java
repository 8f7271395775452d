package org.fibercable;

import org.fibercable.pubsub.MemoryPubSub;
import org.fibercable.pubsub.PubSub;
import org.jetlang.core.Callback;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Memory bus that counts calls per topic.
 */
public class CountingPubSub implements PubSub {

    private final MemoryPubSub target = new MemoryPubSub();
    private final Map<String, AtomicInteger> subscribes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> unsubscribes = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, String payload) {
        target.publish(topic, payload);
    }

    @Override
    public void subscribe(String topic, Callback<String> callback) {
        subscribes.computeIfAbsent(topic, (t) -> new AtomicInteger()).incrementAndGet();
        target.subscribe(topic, callback);
    }

    @Override
    public void unsubscribe(String topic, Callback<String> callback) {
        unsubscribes.computeIfAbsent(topic, (t) -> new AtomicInteger()).incrementAndGet();
        target.unsubscribe(topic, callback);
    }

    public int subscribeCount(String topic) {
        AtomicInteger count = subscribes.get(topic);
        return count == null ? 0 : count.get();
    }

    public int unsubscribeCount(String topic) {
        AtomicInteger count = unsubscribes.get(topic);
        return count == null ? 0 : count.get();
    }

    public int totalUnsubscribes() {
        int total = 0;
        for (AtomicInteger count : unsubscribes.values()) {
            total += count.get();
        }
        return total;
    }

    public int subscriberCount(String topic) {
        return target.subscriberCount(topic);
    }
}
