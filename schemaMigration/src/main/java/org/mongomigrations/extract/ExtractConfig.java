package org.mongomigrations.extract;

import java.nio.file.Path;
import java.time.Duration;

import org.mongomigrations.shell.ConnectionString;

import lombok.Builder;

/**
 * Effective settings of one extraction run.
 */
@Builder
public record ExtractConfig(
    ConnectionString source,
    Path outputFile,
    Duration timeout,
    boolean strictShardDetection,
    String mongoshPath
) {}
