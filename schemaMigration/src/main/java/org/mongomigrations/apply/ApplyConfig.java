package org.mongomigrations.apply;

import java.nio.file.Path;
import java.time.Duration;

import org.mongomigrations.shell.ConnectionString;

import lombok.Builder;

/**
 * Effective settings of one apply run.
 */
@Builder
public record ApplyConfig(
    ConnectionString destination,
    Path schemaFile,
    String databasePrefix,
    Duration timeout,
    String mongoshPath
) {}
