package org.mongomigrations.schema.io;

import java.io.IOException;

/**
 * Raised when a persisted schema or input file is malformed: not JSON, missing required
 * members, wrong value types, or violating a structural invariant.
 */
public class DeserializationException extends IOException {

    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
