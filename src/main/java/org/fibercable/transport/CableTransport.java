package org.fibercable.transport;

import java.net.SocketAddress;

/**
 * A single upgraded socket as seen by a connection. The handshake and framing are owned by the
 * transport implementation.
 */
public interface CableTransport {

    /**
     * @return true if the request that created this transport can be upgraded.
     */
    boolean isPossible();

    /**
     * @return true while frames can still be written.
     */
    boolean isAlive();

    /**
     * @return the remote address or null if it can't be resolved.
     */
    default SocketAddress getRemoteAddress() {
        return null;
    }

    /**
     * Binds the receiver of open, message, close and error events. Called once.
     */
    void setListener(TransportListener listener);

    /**
     * Non-Blocking send of a text message.
     */
    SendResult send(String msg);

    /**
     * Attempts to close the underlying socket. Must raise {@link TransportListener#onClose()} once.
     */
    void close();

    /**
     * Answers the client with a failed handshake, or the closest equivalent if the socket is
     * already upgraded, then closes.
     */
    void reject(HandshakeResponse response);
}
