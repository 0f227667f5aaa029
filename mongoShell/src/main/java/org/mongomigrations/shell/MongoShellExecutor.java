package org.mongomigrations.shell;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link CommandExecutor} that spawns one {@code mongosh} process per call.
 *
 * The script and the captured output streams live in transient files that are removed on every
 * exit path. Output is redirected to files rather than pipes so the caller's thread is the only
 * thread involved.
 */
@Slf4j
public class MongoShellExecutor implements CommandExecutor {

    public static final String DEFAULT_SHELL = "mongosh";
    private static final Duration TERMINATION_GRACE = Duration.ofSeconds(5);

    private final String shellBinary;

    public MongoShellExecutor() {
        this(DEFAULT_SHELL);
    }

    public MongoShellExecutor(String shellBinary) {
        this.shellBinary = shellBinary;
    }

    @Override
    public ExecutionResult execute(ConnectionString target, String script, Duration timeout) throws IOException {
        Path scriptFile = null;
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            scriptFile = Files.createTempFile("mongo-script-", ".js");
            stdoutFile = Files.createTempFile("mongo-stdout-", ".log");
            stderrFile = Files.createTempFile("mongo-stderr-", ".log");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);

            var processBuilder = new ProcessBuilder(buildCommand(target, scriptFile))
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile());

            log.debug("Running {} against {} (timeout {}s)", shellBinary, target, timeout.toSeconds());
            long start = System.nanoTime();
            Process process;
            try {
                process = processBuilder.start();
            } catch (IOException e) {
                throw new ClientNotFoundException(shellBinary, e);
            }

            if (!waitFor(process, timeout)) {
                log.warn("{} did not finish within {}s, terminating it", shellBinary, timeout.toSeconds());
                terminate(process);
                throw new ExecutionTimeoutException(timeout);
            }
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            var result = new ExecutionResult(
                process.exitValue(),
                Files.readString(stdoutFile, StandardCharsets.UTF_8),
                Files.readString(stderrFile, StandardCharsets.UTF_8),
                elapsed);
            log.debug("{} exited with {} after {} ms", shellBinary, result.exitCode(), elapsed.toMillis());
            return result;
        } finally {
            deleteIfPresent(scriptFile);
            deleteIfPresent(stdoutFile);
            deleteIfPresent(stderrFile);
        }
    }

    protected List<String> buildCommand(ConnectionString target, Path scriptFile) {
        return List.of(shellBinary, target.value(), "--quiet", "--file", scriptFile.toString());
    }

    public String getShellBinary() {
        return shellBinary;
    }

    private boolean waitFor(Process process, Duration timeout) throws IOException {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + shellBinary);
        }
    }

    private void terminate(Process process) throws IOException {
        process.destroyForcibly();
        try {
            if (!process.waitFor(TERMINATION_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} (pid {}) is still running after being killed", shellBinary, process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while terminating " + shellBinary);
        }
    }

    private static void deleteIfPresent(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.atWarn().setCause(e).setMessage("Unable to delete transient file {}").addArgument(file).log();
        }
    }
}
