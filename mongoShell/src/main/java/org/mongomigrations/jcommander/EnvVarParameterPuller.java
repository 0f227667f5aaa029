package org.mongomigrations.jcommander;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills JCommander parameter objects from environment variables before the command line is parsed,
 * so explicit flags still win. A flag such as {@code --dest-mongodb-connection-string} is looked up as
 * {@code <prefix>DEST_MONGODB_CONNECTION_STRING}.
 */
@Slf4j
public class EnvVarParameterPuller {

    /**
     * Interface for retrieving environment variables.
     * Allows for dependency injection and testing.
     */
    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    public static <T> T injectFromEnv(T params) {
        return injectFromEnv(params, System::getenv, "");
    }

    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix) {
        List<String> addedEnvParams = new ArrayList<>();
        injectFromEnvRecursive(params, envVarGetter, addedEnvParams, prefix);

        if (!addedEnvParams.isEmpty()) {
            log.info("Adding parameters from the following environment variables: {}", addedEnvParams);
        }
        return params;
    }

    private static void injectFromEnvRecursive(Object params,
                                               EnvVarGetter envVarGetter,
                                               List<String> addedEnvParams,
                                               String prefix)
    {
        Class<?> clazz = params.getClass();

        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        field.setAccessible(true);
                        var delegatedObject = field.get(params);
                        if (delegatedObject != null) {
                            injectFromEnvRecursive(delegatedObject, envVarGetter, addedEnvParams, prefix);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        field.setAccessible(true);
                        processParameterField(params, field, envVarGetter, addedEnvParams, prefix);
                    }
                } catch (IllegalAccessException e) {
                    log.warn("Could not access field: {}", field.getName(), e);
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static void processParameterField(Object params,
                                              Field field,
                                              EnvVarGetter envVarGetter,
                                              List<String> addedEnvParams,
                                              String prefix)
        throws IllegalAccessException
    {
        for (String name : field.getAnnotation(Parameter.class).names()) {
            if (!name.startsWith("--")) {
                continue;
            }
            var envName = toEnvVarName(name, prefix);
            var envValue = envVarGetter.getEnv(envName);
            if (envValue != null && !envValue.isEmpty()) {
                if (setFieldValue(params, field, envName, envValue)) {
                    addedEnvParams.add(envName);
                }
                return;
            }
        }
    }

    /**
     * Converts a flag name to its environment variable name.
     * Examples:
     *   --timeout-seconds -> TIMEOUT_SECONDS
     *   --mongoshPath -> MONGOSH_PATH
     */
    public static String toEnvVarName(String argName, String prefix) {
        String normalized = argName
            .replaceAll("^-+", "")
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replace("-", "_");
        return prefix + normalized.toUpperCase(Locale.ROOT);
    }

    private static boolean setFieldValue(Object params, Field field, String envName, String value)
        throws IllegalAccessException
    {
        Class<?> type = field.getType();

        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value.trim()));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value.trim()));
            } else if (type == boolean.class || type == Boolean.class) {
                field.set(params, Boolean.parseBoolean(value.trim()));
            } else {
                log.warn("Unsupported field type for environment variable injection: {} (field: {})",
                    type.getName(), field.getName());
                return false;
            }
            return true;
        } catch (NumberFormatException e) {
            log.atError().setCause(e)
                .setMessage("Ignoring environment variable {}: '{}' is not a valid {}")
                .addArgument(envName)
                .addArgument(value)
                .addArgument(type.getSimpleName())
                .log();
            return false;
        }
    }
}
