package org.mongomigrations.workload.input;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.mongomigrations.schema.io.SchemaSerializer;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the index and query input files.
 */
@Slf4j
public class WorkloadInputs {

    private static final TypeReference<List<IndexDefinition>> INDEX_LIST = new TypeReference<>() {};
    private static final TypeReference<List<QueryDefinition>> QUERY_LIST = new TypeReference<>() {};

    private final SchemaSerializer serializer;

    public WorkloadInputs() {
        this(new SchemaSerializer());
    }

    public WorkloadInputs(SchemaSerializer serializer) {
        this.serializer = serializer;
    }

    public List<IndexDefinition> loadIndexes(Path file) throws IOException {
        log.info("Reading indexes from {}", file);
        var indexes = serializer.readList(file, INDEX_LIST);
        log.info("Found {} indexes to create", indexes.size());
        return List.copyOf(indexes);
    }

    /**
     * Reads the queries and substitutes the collection placeholder in each of them.
     */
    public List<QueryDefinition> loadQueries(Path file, String collection) throws IOException {
        log.info("Reading queries from {}", file);
        var queries = serializer.readList(file, QUERY_LIST).stream()
            .map(q -> q.forCollection(collection))
            .toList();
        log.info("Found {} queries", queries.size());
        return queries;
    }
}
