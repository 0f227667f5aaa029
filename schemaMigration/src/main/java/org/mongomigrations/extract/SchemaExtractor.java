package org.mongomigrations.extract;

import java.io.IOException;
import java.time.Duration;

import org.mongomigrations.schema.model.SchemaSnapshot;
import org.mongomigrations.shell.ConnectionString;

/**
 * Captures the structure of a source deployment.
 */
public interface SchemaExtractor {

    /**
     * Build a snapshot of every user database on the source.
     *
     * Unavailable statistics, indexes or shard metadata of a single collection never abort the
     * snapshot; they are replaced by neutral values.
     *
     * @param source the server to read from
     * @param timeout wall-clock budget for the whole extraction
     * @return the captured snapshot
     * @throws org.mongomigrations.shell.ConnectivityException if the source cannot be reached or authenticated against
     * @throws org.mongomigrations.shell.ExecutionTimeoutException if extraction exceeds the timeout
     * @throws IOException for any other failure, including unparsable client output
     */
    SchemaSnapshot extract(ConnectionString source, Duration timeout) throws IOException;
}
