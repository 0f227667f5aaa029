package org.mongomigrations.shell;

import java.util.List;

/**
 * One or more names contain characters that must not be interpolated into a shell script.
 */
public class UnsafeIdentifierException extends IllegalArgumentException {

    private final List<String> problems;

    public UnsafeIdentifierException(List<String> problems) {
        super("Refusing to generate a script for unsafe identifiers: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
