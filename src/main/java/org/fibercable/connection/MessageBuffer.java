package org.fibercable.connection;

import org.jetlang.core.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Holds inbound messages until the connection has finished opening, then hands them over in arrival
 * order. Confined to the connection fiber.
 */
public class MessageBuffer {

    private static final Logger log = LoggerFactory.getLogger(MessageBuffer.class);

    private final Callback<String> receiver;
    private final Queue<String> buffer = new ArrayDeque<>();
    private boolean processing;

    public MessageBuffer(Callback<String> receiver) {
        this.receiver = receiver;
    }

    public void append(String message) {
        if (message == null) {
            log.error("Couldn't handle non-string message: null");
            return;
        }
        if (processing) {
            receiver.onMessage(message);
        } else {
            buffer.add(message);
        }
    }

    public void processAll() {
        String message;
        while ((message = buffer.poll()) != null) {
            receiver.onMessage(message);
        }
        processing = true;
    }

    public boolean isProcessing() {
        return processing;
    }

    public int size() {
        return buffer.size();
    }
}
