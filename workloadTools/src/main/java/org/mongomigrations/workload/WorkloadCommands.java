package org.mongomigrations.workload;

/** The list of supported commands for the workload tools */
public enum WorkloadCommands {
    /** Creates the indexes of a flat list */
    CREATE_INDEXES("create-indexes"),

    /** Benchmarks queries into the timing table */
    RUN_QUERIES("run-queries"),

    /** Captures explain output for queries */
    EXPLAIN("explain");

    private final String commandName;

    WorkloadCommands(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    public static WorkloadCommands fromString(String s) {
        for (var command : values()) {
            if (command.commandName.equalsIgnoreCase(s)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unable to find matching command for text:" + s);
    }
}
