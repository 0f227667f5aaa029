package org.mongomigrations.shell;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps client error output to a {@link ConnectivityException.Kind}.
 */
public final class ConnectivityDiagnostics {

    private static final int MAX_DETAIL_LENGTH = 400;

    // Checked in order; the first kind with a matching marker wins
    private static final List<Map.Entry<ConnectivityException.Kind, List<String>>> MARKERS = List.of(
        Map.entry(ConnectivityException.Kind.AUTHENTICATION_FAILED,
            List.of("authentication failed", "authenticationfailed", "bad auth", "auth failed", "unauthorized")),
        Map.entry(ConnectivityException.Kind.DNS_FAILURE,
            List.of("enotfound", "getaddrinfo", "querysrv", "eai_again", "could not resolve")),
        Map.entry(ConnectivityException.Kind.CONNECTION_REFUSED,
            List.of("econnrefused", "connection refused", "ehostunreach", "etimedout", "server selection timed out")),
        Map.entry(ConnectivityException.Kind.PROTOCOL_MISMATCH,
            List.of("wire version", "wireversion", "incompatible server", "unsupported op_query"))
    );

    private ConnectivityDiagnostics() {
        throw new IllegalStateException("Utility class");
    }

    public static ConnectivityException.Kind classify(String clientOutput) {
        if (clientOutput == null) {
            return ConnectivityException.Kind.UNKNOWN;
        }
        var lower = clientOutput.toLowerCase(Locale.ROOT);
        for (var entry : MARKERS) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return ConnectivityException.Kind.UNKNOWN;
    }

    /**
     * Build the exception describing a failed invocation. The client output is redacted and
     * truncated before it becomes part of the message.
     */
    public static ConnectivityException diagnose(ConnectionString target, ExecutionResult result) {
        var output = result.stderr().isBlank() ? result.stdout() : result.stderr();
        var kind = classify(output);
        return new ConnectivityException(kind, target, abbreviate(target.redact(output.strip())));
    }

    private static String abbreviate(String text) {
        if (text.length() <= MAX_DETAIL_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
