package org.fibercable;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects what a class logs while a test runs. Close it in a finally block.
 */
public class LogCapture implements AutoCloseable {

    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    public LogCapture(Class<?> type) {
        this.logger = (Logger) LoggerFactory.getLogger(type);
        appender.start();
        logger.addAppender(appender);
    }

    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        for (ILoggingEvent event : new ArrayList<>(appender.list)) {
            messages.add(event.getFormattedMessage());
        }
        return messages;
    }

    public boolean contains(String fragment) {
        for (String message : messages()) {
            if (message.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        logger.detachAppender(appender);
        appender.stop();
    }
}
