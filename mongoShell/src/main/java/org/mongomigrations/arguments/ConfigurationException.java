package org.mongomigrations.arguments;

import java.util.List;
import java.util.Locale;

import com.beust.jcommander.ParameterException;

/**
 * Required configuration is missing or unusable. Carries the steps that fix it.
 */
public class ConfigurationException extends ParameterException {

    private final List<String> remediation;

    public ConfigurationException(String message, List<String> remediation) {
        super(message);
        this.remediation = List.copyOf(remediation);
    }

    public static ConfigurationException missingParameter(String flag) {
        var envName = flag.replaceAll("^-+", "").replace('-', '_').toUpperCase(Locale.ROOT);
        return new ConfigurationException(
            envName + " is not set",
            List.of(
                "Export " + envName + " in the environment, or",
                "pass " + flag + " on the command line"));
    }

    public static ConfigurationException missingFile(String description, String path, String flag) {
        return new ConfigurationException(
            description + " " + path + " not found",
            List.of("Create " + path + ", or point " + flag + " at an existing file"));
    }

    public List<String> getRemediation() {
        return remediation;
    }
}
