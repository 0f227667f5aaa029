package org.mongomigrations;

/** The list of supported commands for the schema migration tool */
public enum MigrationCommands {
    /** Captures the structure of a source into a schema file */
    EXTRACT,

    /** Recreates the structure of a schema file on a destination */
    APPLY;

    public static MigrationCommands fromString(String s) {
        for (var command : values()) {
            if (command.name().equalsIgnoreCase(s)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unable to find matching command for text:" + s);
    }
}
