package org.fibercable.pubsub;

import org.jetlang.core.Callback;

/**
 * Topic bus shared by every connection. Delivery is best effort and unordered across topics.
 * Implementations must be safe to call from any thread.
 */
public interface PubSub {

    void publish(String topic, String payload);

    void subscribe(String topic, Callback<String> callback);

    /**
     * Removes the registration made with the same topic and callback instance. Unknown pairs are ignored.
     */
    void unsubscribe(String topic, Callback<String> callback);
}
