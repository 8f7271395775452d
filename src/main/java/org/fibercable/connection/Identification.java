package org.fibercable.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Identity of the client behind a connection, e.g. {@code current_user -> 42}. Seeded from the
 * already authenticated request and extended by connect callbacks.
 */
public class Identification {

    private final Map<String, Object> identifiers = Collections.synchronizedMap(new LinkedHashMap<>());

    public Identification() {
    }

    public Identification(Map<String, ?> initial) {
        if (initial != null) {
            identifiers.putAll(initial);
        }
    }

    public void identify(String key, Object value) {
        identifiers.put(key, value);
    }

    public Object get(String key) {
        return identifiers.get(key);
    }

    public boolean matches(String key, Object value) {
        Object current = identifiers.get(key);
        return current != null && current.equals(value);
    }

    public Map<String, Object> asMap() {
        synchronized (identifiers) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
        }
    }

    /**
     * @return identifier values joined by ':' in declaration order, empty if unidentified.
     */
    public String connectionIdentifier() {
        return connectionIdentifier(asMap());
    }

    public static String connectionIdentifier(Map<String, ?> identity) {
        StringJoiner joiner = new StringJoiner(":");
        for (Object value : identity.values()) {
            if (value != null) {
                joiner.add(value.toString());
            }
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return "Identification" + asMap();
    }
}
