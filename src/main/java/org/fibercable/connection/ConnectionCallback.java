package org.fibercable.connection;

public interface ConnectionCallback {

    /**
     * @throws org.fibercable.core.UnauthorizedException from a connect callback to refuse the client.
     */
    void onConnection(Connection connection);
}
