package org.mongomigrations.shell;

import java.io.IOException;
import java.time.Duration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pings a server before a run so that unreachable targets fail fast with a specific diagnosis.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectivityCheck {

    static final String PING_COMMAND = "db.adminCommand({ ping: 1 })";

    private final CommandExecutor executor;

    public void verify(ConnectionString target, Duration timeout) throws IOException {
        log.info("Checking connectivity to {}", target);
        var result = executor.executeCommand(target, PING_COMMAND, timeout);
        if (!result.isSuccess()) {
            throw ConnectivityDiagnostics.diagnose(target, result);
        }
        log.debug("Ping to {} answered in {} ms", target, result.elapsed().toMillis());
    }
}
