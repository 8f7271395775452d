package org.fibercable.connection;

import org.fibercable.core.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered connect and disconnect hooks shared by every connection of a server.
 */
public class ConnectionCallbacks {

    private static final Logger log = LoggerFactory.getLogger(ConnectionCallbacks.class);

    private final List<ConnectionCallback> afterConnect = new CopyOnWriteArrayList<>();
    private final List<ConnectionCallback> afterDisconnect = new CopyOnWriteArrayList<>();

    public ConnectionCallbacks afterConnect(ConnectionCallback callback) {
        afterConnect.add(callback);
        return this;
    }

    public ConnectionCallbacks afterDisconnect(ConnectionCallback callback) {
        afterDisconnect.add(callback);
        return this;
    }

    /**
     * Stops at the first {@link UnauthorizedException} and rethrows it. Other failures are logged.
     */
    void runConnect(Connection connection) {
        for (ConnectionCallback callback : afterConnect) {
            try {
                callback.onConnection(connection);
            } catch (UnauthorizedException unauthorized) {
                throw unauthorized;
            } catch (RuntimeException failed) {
                log.error("Connect callback failed for {}", connection, failed);
            }
        }
    }

    void runDisconnect(Connection connection) {
        for (ConnectionCallback callback : afterDisconnect) {
            try {
                callback.onConnection(connection);
            } catch (RuntimeException failed) {
                log.error("Disconnect callback failed for {}", connection, failed);
            }
        }
    }
}
