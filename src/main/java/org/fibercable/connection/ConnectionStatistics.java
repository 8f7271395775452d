package org.fibercable.connection;

import java.time.Instant;
import java.util.List;

public class ConnectionStatistics {

    private final String identifier;
    private final Instant startedAt;
    private final List<String> subscriptions;

    public ConnectionStatistics(String identifier, Instant startedAt, List<String> subscriptions) {
        this.identifier = identifier;
        this.startedAt = startedAt;
        this.subscriptions = subscriptions;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public List<String> getSubscriptions() {
        return subscriptions;
    }

    @Override
    public String toString() {
        return "ConnectionStatistics{" +
                "identifier='" + identifier + '\'' +
                ", startedAt=" + startedAt +
                ", subscriptions=" + subscriptions +
                '}';
    }
}
