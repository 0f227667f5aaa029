package org.mongomigrations.shell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders values as mongosh source literals. Every literal is JSON, which is valid JavaScript,
 * so quotes and control characters in a value can never terminate the literal early.
 */
public final class ShellLiterals {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ShellLiterals() {
        throw new IllegalStateException("Utility class");
    }

    public static String string(String value) {
        return json(value);
    }

    public static String json(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be rendered as a shell literal: " + value, e);
        }
    }
}
