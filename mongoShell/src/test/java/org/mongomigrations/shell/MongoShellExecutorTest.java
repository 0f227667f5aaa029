package org.mongomigrations.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Uses a small POSIX shell script in place of mongosh. The stub receives the same arguments
 * mongosh would: connection string, --quiet, --file, script path.
 */
@DisabledOnOs(OS.WINDOWS)
class MongoShellExecutorTest {

    private static final ConnectionString TARGET = new ConnectionString("mongodb://localhost:27017");

    @TempDir
    Path tempDir;

    private Path stub(String name, String body) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        return script;
    }

    /** Runs the stub through /bin/sh so the temp directory does not need to allow execution. */
    private static MongoShellExecutor executorFor(Path stub) {
        return new MongoShellExecutor(stub.toString()) {
            @Override
            protected List<String> buildCommand(ConnectionString target, Path scriptFile) {
                var command = new ArrayList<>(List.of("/bin/sh"));
                command.addAll(super.buildCommand(target, scriptFile));
                return command;
            }
        };
    }

    @Test
    void capturesOutputAndRemovesScriptFile() throws IOException {
        var shell = stub("echo-shell", "echo \"$4\"\ncat \"$4\"\necho 'warning' 1>&2\nexit 0");
        var executor = executorFor(shell);

        var result = executor.execute(TARGET, "print('hello');", Duration.ofSeconds(10));

        assertTrue(result.isSuccess());
        var lines = result.stdout().split("\n");
        Path scriptFile = Path.of(lines[0]);
        assertEquals("print('hello');", lines[1]);
        assertEquals("warning", result.stderr().strip());
        assertFalse(Files.exists(scriptFile), "script file should be deleted");
    }

    @Test
    void reportsNonZeroExitWithoutThrowing() throws IOException {
        var shell = stub("failing-shell", "echo \"$4\"\necho 'MongoServerError: boom' 1>&2\nexit 3");
        var executor = executorFor(shell);

        var result = executor.execute(TARGET, "throw new Error('boom');", Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertTrue(result.stderr().contains("boom"));
        assertFalse(Files.exists(Path.of(result.stdout().strip())));
    }

    @Test
    void passesConnectionStringAndQuietFlag() throws IOException {
        var shell = stub("args-shell", "echo \"$1|$2|$3\"");
        var executor = executorFor(shell);

        var result = executor.execute(TARGET, "1", Duration.ofSeconds(10));

        assertEquals("mongodb://localhost:27017|--quiet|--file", result.stdout().strip());
    }

    @Test
    void timesOutAndStillRemovesScriptFile() throws IOException {
        Path marker = tempDir.resolve("script-path.txt");
        var shell = stub("slow-shell", "echo \"$4\" > " + marker + "\nsleep 5");
        var executor = executorFor(shell);

        var e = assertThrows(ExecutionTimeoutException.class,
            () -> executor.execute(TARGET, "sleep(60000);", Duration.ofMillis(500)));

        assertEquals(Duration.ofMillis(500), e.getTimeout());
        if (Files.exists(marker)) {
            Path scriptFile = Path.of(Files.readString(marker).strip());
            assertFalse(Files.exists(scriptFile), "script file should be deleted after a timeout");
        }
    }

    @Test
    void missingClientIsReported() {
        var executor = new MongoShellExecutor(tempDir.resolve("no-such-mongosh").toString());

        assertThrows(ClientNotFoundException.class,
            () -> executor.execute(TARGET, "1", Duration.ofSeconds(5)));
    }

    @Test
    void executeCommandPrintsResultAsJson() throws IOException {
        var shell = stub("cat-shell", "cat \"$4\"");
        var executor = executorFor(shell);

        var result = executor.executeCommand(TARGET, "db.adminCommand({ ping: 1 })", Duration.ofSeconds(10));

        assertEquals("print(JSON.stringify(db.adminCommand({ ping: 1 })));", result.stdout().strip());
    }
}
