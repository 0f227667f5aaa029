package org.mongomigrations.extract;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import org.mongomigrations.schema.io.DeserializationException;
import org.mongomigrations.schema.io.SchemaSerializer;
import org.mongomigrations.schema.model.SchemaSnapshot;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.ConnectionString;
import org.mongomigrations.shell.ConnectivityDiagnostics;
import org.mongomigrations.shell.ShellLiterals;

import lombok.extern.slf4j.Slf4j;

/**
 * Extracts a snapshot by running a read-only mongosh script on the source and parsing the
 * JSON document it prints between two marker lines.
 */
@Slf4j
public class MongoShellSchemaExtractor implements SchemaExtractor {

    public static final List<String> SYSTEM_DATABASES = List.of("admin", "local", "config");

    static final String SCRIPT_RESOURCE = "/scripts/extract-schema.js";
    static final String BEGIN_MARKER = "__SCHEMA_BEGIN__";
    static final String END_MARKER = "__SCHEMA_END__";

    private final CommandExecutor executor;
    private final SchemaSerializer serializer;
    private final boolean strictShardDetection;

    public MongoShellSchemaExtractor(CommandExecutor executor, SchemaSerializer serializer, boolean strictShardDetection) {
        this.executor = executor;
        this.serializer = serializer;
        this.strictShardDetection = strictShardDetection;
    }

    @Override
    public SchemaSnapshot extract(ConnectionString source, Duration timeout) throws IOException {
        log.info("Extracting schema (databases, collections, indexes, shard keys) from {}", source);
        var result = executor.execute(source, buildScript(), timeout);
        if (!result.isSuccess()) {
            throw ConnectivityDiagnostics.diagnose(source, result);
        }
        result.stderr().lines()
            .filter(line -> !line.isBlank())
            .forEach(line -> log.warn("{}", source.redact(line)));

        var snapshot = serializer.fromJson(extractDocument(result.stdout()));
        if (strictShardDetection && snapshot.getUnknownShardStatusCount() > 0) {
            log.warn("Shard status could not be determined for {} collection(s); they will be treated as unsharded",
                snapshot.getUnknownShardStatusCount());
        }
        log.debug("Extraction finished in {} ms", result.elapsed().toMillis());
        return snapshot;
    }

    String buildScript() throws IOException {
        return loadTemplate()
            .replace("__EXCLUDED_DATABASES__", ShellLiterals.json(SYSTEM_DATABASES))
            .replace("__STRICT_SHARD_DETECTION__", Boolean.toString(strictShardDetection));
    }

    static String extractDocument(String stdout) throws DeserializationException {
        int begin = stdout.indexOf(BEGIN_MARKER);
        int end = stdout.lastIndexOf(END_MARKER);
        if (begin < 0 || end < begin) {
            throw new DeserializationException(
                "Extraction output did not contain a schema document; the client printed: " + abbreviate(stdout));
        }
        return stdout.substring(begin + BEGIN_MARKER.length(), end).strip();
    }

    private static String loadTemplate() throws IOException {
        try (InputStream in = MongoShellSchemaExtractor.class.getResourceAsStream(SCRIPT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + SCRIPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String abbreviate(String text) {
        var stripped = text.strip();
        return stripped.length() <= 200 ? stripped : stripped.substring(0, 200) + "...";
    }
}
