package org.mongomigrations.arguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Conversions from raw flag values to checked settings.
 */
public final class ArgValidation {

    private ArgValidation() {
        throw new IllegalStateException("Utility class");
    }

    public static String requireValue(String value, String flag) {
        if (value == null || value.isBlank()) {
            throw ConfigurationException.missingParameter(flag);
        }
        return value;
    }

    public static Path requireFile(String path, String description, String flag) {
        var file = Path.of(requireValue(path, flag));
        if (!Files.isRegularFile(file)) {
            throw ConfigurationException.missingFile(description, path, flag);
        }
        return file;
    }

    public static Duration toTimeout(int seconds, String flag) {
        if (seconds <= 0) {
            throw new ConfigurationException(flag + " must be positive, was " + seconds,
                List.of("Pass a positive number of seconds to " + flag));
        }
        return Duration.ofSeconds(seconds);
    }
}
