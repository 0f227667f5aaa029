package org.mongomigrations.shell;

import java.io.IOException;

/**
 * The client could not talk to the server. Fatal for extraction and apply.
 */
public class ConnectivityException extends IOException {

    public enum Kind {
        DNS_FAILURE("Host name could not be resolved",
            "Check the host name in the connection string and that DNS resolves it from this machine"),
        CONNECTION_REFUSED("Connection was refused or could not be established",
            "Check that the server is running, the port is correct and firewalls/security groups allow this client"),
        AUTHENTICATION_FAILED("Authentication failed",
            "Verify the username and password, and set authSource if the user is defined outside the target database"),
        PROTOCOL_MISMATCH("Client and server wire protocol versions are incompatible",
            "Use a mongosh release that supports the server version, or upgrade the server"),
        UNKNOWN("The client exited with an error",
            "Run mongosh manually with the same connection string to inspect the failure");

        private final String description;
        private final String remediation;

        Kind(String description, String remediation) {
            this.description = description;
            this.remediation = remediation;
        }

        public String getDescription() {
            return description;
        }

        public String getRemediation() {
            return remediation;
        }
    }

    private final Kind kind;

    public ConnectivityException(Kind kind, ConnectionString target, String detail) {
        super(kind.getDescription() + " for " + target + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRemediation() {
        return kind.getRemediation();
    }
}
