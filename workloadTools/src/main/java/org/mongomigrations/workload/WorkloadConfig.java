package org.mongomigrations.workload;

import java.nio.file.Path;
import java.time.Duration;

import org.mongomigrations.shell.ConnectionString;

import lombok.Builder;

/**
 * Effective settings of one workload tool run. File settings a command does not use are null.
 */
@Builder
public record WorkloadConfig(
    ConnectionString connection,
    String database,
    String collection,
    Duration timeout,
    Duration explainTimeout,
    Path indexesFile,
    Path queriesFile,
    Path timingFile,
    Path outputDir,
    String mongoshPath
) {}
