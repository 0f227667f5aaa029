package org.mongomigrations.apply;

import java.io.IOException;

/**
 * The apply script finished without printing a well-formed summary block.
 */
public class ScriptOutputException extends IOException {

    public ScriptOutputException(String message) {
        super(message);
    }

    public ScriptOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
