package org.fibercable.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Actions a client may invoke on a channel type, keyed by name, plus the type's ordered subscribe and
 * unsubscribe hooks. Build once per channel class and return it from {@link Channel#actions()}:
 *
 * <pre>
 * private static final Actions&lt;ChatChannel&gt; ACTIONS = Actions.builder(ChatChannel.class)
 *         .action("speak", ChatChannel::speak)
 *         .trigger("away", ChatChannel::away)
 *         .onSubscribe(ChatChannel::announce)
 *         .build();
 * </pre>
 */
public final class Actions<C extends Channel> {

    public static final String DEFAULT_ACTION = "receive";

    private static final Set<String> RESERVED =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("subscribed", "unsubscribed")));
    private static final Actions<Channel> NONE =
            new Actions<>(Collections.emptyMap(), Collections.emptyList(), Collections.emptyList());

    private final Map<String, BiConsumer<Channel, ObjectNode>> handlers;
    private final List<Consumer<Channel>> subscribeHooks;
    private final List<Consumer<Channel>> unsubscribeHooks;

    private Actions(Map<String, BiConsumer<Channel, ObjectNode>> handlers,
                    List<Consumer<Channel>> subscribeHooks,
                    List<Consumer<Channel>> unsubscribeHooks) {
        this.handlers = handlers;
        this.subscribeHooks = subscribeHooks;
        this.unsubscribeHooks = unsubscribeHooks;
    }

    public static <C extends Channel> Builder<C> builder(Class<C> channelType) {
        return new Builder<>(channelType);
    }

    public static Actions<Channel> none() {
        return NONE;
    }

    public boolean contains(String action) {
        return handlers.containsKey(action);
    }

    public Set<String> names() {
        return handlers.keySet();
    }

    void invoke(Channel channel, String action, ObjectNode data) {
        BiConsumer<Channel, ObjectNode> handler = handlers.get(action);
        if (handler == null) {
            throw new IllegalArgumentException("Unknown action " + action);
        }
        handler.accept(channel, data);
    }

    List<Consumer<Channel>> subscribeHooks() {
        return subscribeHooks;
    }

    List<Consumer<Channel>> unsubscribeHooks() {
        return unsubscribeHooks;
    }

    public static class Builder<C extends Channel> {
        private final Class<C> channelType;
        private final Map<String, BiConsumer<Channel, ObjectNode>> handlers = new LinkedHashMap<>();
        private final List<Consumer<Channel>> subscribeHooks = new ArrayList<>();
        private final List<Consumer<Channel>> unsubscribeHooks = new ArrayList<>();

        Builder(Class<C> channelType) {
            this.channelType = channelType;
        }

        /**
         * Registers an action that receives the client's data, without the action name.
         */
        public Builder<C> action(String name, BiConsumer<C, ObjectNode> handler) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Action name is required");
            }
            if (RESERVED.contains(name)) {
                throw new IllegalArgumentException(name + " is a lifecycle hook and can't be an action");
            }
            if (handlers.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate action " + name);
            }
            handlers.put(name, (channel, data) -> handler.accept(channelType.cast(channel), data));
            return this;
        }

        /**
         * Registers an action that takes no data.
         */
        public Builder<C> trigger(String name, Consumer<C> handler) {
            return action(name, (channel, data) -> handler.accept(channel));
        }

        /**
         * Runs after {@link Channel#subscribed()}, in declaration order. A hook may reject the subscription.
         */
        public Builder<C> onSubscribe(Consumer<C> hook) {
            subscribeHooks.add((channel) -> hook.accept(channelType.cast(channel)));
            return this;
        }

        /**
         * Runs after {@link Channel#unsubscribed()}, in declaration order, before streams and timers are released.
         */
        public Builder<C> onUnsubscribe(Consumer<C> hook) {
            unsubscribeHooks.add((channel) -> hook.accept(channelType.cast(channel)));
            return this;
        }

        public Actions<C> build() {
            return new Actions<>(Collections.unmodifiableMap(new LinkedHashMap<>(handlers)),
                    Collections.unmodifiableList(new ArrayList<>(subscribeHooks)),
                    Collections.unmodifiableList(new ArrayList<>(unsubscribeHooks)));
        }
    }
}
