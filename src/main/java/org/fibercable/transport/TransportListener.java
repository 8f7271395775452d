package org.fibercable.transport;

/**
 * Events raised by a {@link CableTransport}. Implementations must return quickly; the transport
 * may call these from its own read loop.
 */
public interface TransportListener {

    void onOpen();

    void onMessage(String msg);

    void onClose();

    void onError(String msg);

    void onException(Exception failed);
}
