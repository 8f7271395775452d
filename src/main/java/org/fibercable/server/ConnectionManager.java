package org.fibercable.server;

import org.fibercable.connection.Connection;

/**
 * Tracks open connections across threads. Connections register when they open and deregister on teardown.
 */
public interface ConnectionManager {

    void addConnection(Connection connection);

    void removeConnection(Connection connection);
}
