package org.mongomigrations.workload.input;

import org.mongomigrations.schema.model.KeySpec;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the index input file, e.g. {@code {"name": "idx_email", "keys": {"email": 1}}}.
 */
public record IndexDefinition(
    @JsonProperty(value = "name", required = true) String name,
    @JsonProperty(value = "keys", required = true) KeySpec keys
) {

    public IndexDefinition {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Index entry has no name");
        }
        if (keys == null) {
            throw new IllegalArgumentException("Index '" + name + "' has no keys");
        }
    }
}
