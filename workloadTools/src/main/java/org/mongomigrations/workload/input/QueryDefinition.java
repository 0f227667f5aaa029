package org.mongomigrations.workload.input;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the query input file. The query is a mongosh expression over {@code targetDb}
 * that may reference the configured collection through the {@code {{collection}}} placeholder.
 */
public record QueryDefinition(
    @JsonProperty(value = "description", required = true) String description,
    @JsonProperty(value = "query", required = true) String query
) {

    public static final String COLLECTION_PLACEHOLDER = "{{collection}}";

    public QueryDefinition {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Query entry has no description");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query '" + description + "' is empty");
        }
    }

    public QueryDefinition forCollection(String collection) {
        return new QueryDefinition(description, query.replace(COLLECTION_PLACEHOLDER, collection));
    }
}
