package org.mongomigrations.commands;

import org.mongomigrations.apply.SchemaApplier;
import org.mongomigrations.extract.SchemaSummary;
import org.mongomigrations.schema.io.SchemaSerializer;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Apply extends CommandBase {

    private final ApplyArgs arguments;
    private final SchemaSerializer serializer = new SchemaSerializer();

    public Apply(ApplyArgs arguments) {
        this.arguments = arguments;
    }

    public ApplyRunResult execute() {
        var result = ApplyRunResult.builder();
        try {
            var config = arguments.toConfig();
            var snapshot = serializer.read(config.schemaFile());
            log.info("Loaded schema from {} (extracted at {})", config.schemaFile(), snapshot.extractedAt());
            log.info("{}", SchemaSummary.describe(snapshot));
            log.info("Destination: {}", config.destination());
            if (!config.databasePrefix().isEmpty()) {
                log.info("Database prefix: {}", config.databasePrefix());
            }

            var executor = createExecutor(config.mongoshPath());
            checkConnectivity(executor, config.destination(), config.timeout());

            var report = new SchemaApplier(executor)
                .apply(snapshot, config.databasePrefix(), config.destination(), config.timeout());
            // Per-object failures are reported but do not fail the run
            result.report(report)
                .exitCode(SUCCESS_CODE);
        } catch (Exception e) {
            result.exitCode(FAILURE_CODE)
                .errorMessage(describeFailure(e));
        }
        return result.build();
    }
}
