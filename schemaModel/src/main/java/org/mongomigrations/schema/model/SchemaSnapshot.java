package org.mongomigrations.schema.model;

import java.util.HashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Immutable structural description of a source deployment at one point in time.
 */
@Builder
public record SchemaSnapshot(
    @JsonProperty("extracted_at") String extractedAt,
    @JsonProperty(value = "databases", required = true) List<DatabaseSchema> databases
) {

    public SchemaSnapshot {
        databases = databases == null ? List.of() : List.copyOf(databases);
        var databaseNames = new HashSet<String>();
        for (var database : databases) {
            if (!databaseNames.add(database.name())) {
                throw new IllegalArgumentException("Duplicate database '" + database.name() + "'");
            }
        }
    }

    @JsonIgnore
    public int getCollectionCount() {
        return databases.stream().mapToInt(db -> db.collections().size()).sum();
    }

    @JsonIgnore
    public int getIndexCount() {
        return databases.stream().mapToInt(DatabaseSchema::getIndexCount).sum();
    }

    @JsonIgnore
    public int getShardedCollectionCount() {
        return (int) databases.stream()
            .flatMap(db -> db.collections().stream())
            .filter(CollectionSchema::sharded)
            .count();
    }

    @JsonIgnore
    public int getUnknownShardStatusCount() {
        return (int) databases.stream()
            .flatMap(db -> db.collections().stream())
            .filter(CollectionSchema::isShardStatusUnknown)
            .count();
    }
}
