package org.mongomigrations.shell;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rejects names carrying quote, delimiter or control characters before they are placed into
 * generated script text.
 */
public final class IdentifierValidator {

    static final String SHELL_DELIMITERS = "'\"`\\;";
    static final String DATABASE_FORBIDDEN = "/. $*<>:|?";
    static final int MAX_DATABASE_NAME_LENGTH = 63;
    private static final char LINE_SEPARATOR = (char) 0x2028;
    private static final char PARAGRAPH_SEPARATOR = (char) 0x2029;

    private IdentifierValidator() {
        throw new IllegalStateException("Utility class");
    }

    public static Optional<String> checkDatabaseName(String name) {
        var problem = checkCommon("database", name);
        if (problem.isPresent()) {
            return problem;
        }
        if (name.length() > MAX_DATABASE_NAME_LENGTH) {
            return Optional.of("database '" + name + "' is longer than " + MAX_DATABASE_NAME_LENGTH + " characters");
        }
        return findForbidden("database", name, DATABASE_FORBIDDEN);
    }

    public static Optional<String> checkCollectionName(String database, String name) {
        return checkCommon("collection", database + "." + name, name)
            .or(() -> findForbidden("collection", name, "$"));
    }

    public static Optional<String> checkIndexName(String namespace, String name) {
        return checkCommon("index", namespace + "." + name, name);
    }

    public static Optional<String> checkFieldPath(String owner, String path) {
        return checkCommon("key field", owner + " " + path, path);
    }

    public static void requireSafe(List<Optional<String>> checks) {
        var problems = new ArrayList<String>();
        checks.forEach(check -> check.ifPresent(problems::add));
        if (!problems.isEmpty()) {
            throw new UnsafeIdentifierException(problems);
        }
    }

    private static Optional<String> checkCommon(String kind, String name) {
        return checkCommon(kind, name, name);
    }

    private static Optional<String> checkCommon(String kind, String label, String name) {
        if (name == null || name.isEmpty()) {
            return Optional.of(kind + " name is empty (" + label + ")");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isISOControl(c) || c == LINE_SEPARATOR || c == PARAGRAPH_SEPARATOR) {
                return Optional.of(kind + " '" + label + "' contains a control character at position " + i);
            }
        }
        return findForbidden(kind, label, name, SHELL_DELIMITERS);
    }

    private static Optional<String> findForbidden(String kind, String name, String forbidden) {
        return findForbidden(kind, name, name, forbidden);
    }

    private static Optional<String> findForbidden(String kind, String label, String name, String forbidden) {
        for (int i = 0; i < name.length(); i++) {
            if (forbidden.indexOf(name.charAt(i)) >= 0) {
                return Optional.of(kind + " '" + label + "' contains forbidden character '" + name.charAt(i) + "'");
            }
        }
        return Optional.empty();
    }
}
