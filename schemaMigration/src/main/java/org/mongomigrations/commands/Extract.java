package org.mongomigrations.commands;

import org.mongomigrations.extract.MongoShellSchemaExtractor;
import org.mongomigrations.schema.io.SchemaSerializer;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Extract extends CommandBase {

    private final ExtractArgs arguments;
    private final SchemaSerializer serializer = new SchemaSerializer();

    public Extract(ExtractArgs arguments) {
        this.arguments = arguments;
    }

    public ExtractRunResult execute() {
        var result = ExtractRunResult.builder();
        try {
            var config = arguments.toConfig();
            log.info("Source: {}", config.source());
            var executor = createExecutor(config.mongoshPath());
            checkConnectivity(executor, config.source(), config.timeout());

            var extractor = new MongoShellSchemaExtractor(executor, serializer, config.strictShardDetection());
            var snapshot = extractor.extract(config.source(), config.timeout());
            serializer.write(snapshot, config.outputFile());
            log.info("Schema written to {}", config.outputFile());

            result.snapshot(snapshot)
                .outputFile(config.outputFile())
                .exitCode(SUCCESS_CODE);
        } catch (Exception e) {
            result.exitCode(FAILURE_CODE)
                .errorMessage(describeFailure(e));
        }
        return result.build();
    }
}
