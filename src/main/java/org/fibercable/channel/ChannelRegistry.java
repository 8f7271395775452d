package org.fibercable.channel;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Channel types a client may subscribe to, by the name sent in {@code data.channel}.
 */
public class ChannelRegistry {

    private final Map<String, Supplier<? extends Channel>> factories = new ConcurrentHashMap<>();

    public ChannelRegistry register(String name, Supplier<? extends Channel> factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Channel already registered: " + name);
        }
        return this;
    }

    /**
     * @return a new instance or null if no channel has that name.
     */
    public Channel create(String name) {
        if (name == null) {
            return null;
        }
        Supplier<? extends Channel> factory = factories.get(name);
        return factory == null ? null : factory.get();
    }

    public Set<String> names() {
        return factories.keySet();
    }
}
