package org.mongomigrations.schema.model;

import java.util.HashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Database definition: its size estimate and collections, in extraction order.
 */
@Builder
public record DatabaseSchema(
    @JsonProperty(value = "database", required = true) String name,
    @JsonProperty("size_gb") double sizeGb,
    @JsonProperty("collections") List<CollectionSchema> collections
) {

    public DatabaseSchema {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Database name must not be empty");
        }
        collections = collections == null ? List.of() : List.copyOf(collections);
        var collectionNames = new HashSet<String>();
        for (var collection : collections) {
            if (!collectionNames.add(collection.name())) {
                throw new IllegalArgumentException(
                    "Duplicate collection '" + collection.name() + "' in database '" + name + "'");
            }
        }
    }

    @JsonIgnore
    public boolean hasShardedCollections() {
        return collections.stream().anyMatch(CollectionSchema::sharded);
    }

    @JsonIgnore
    public int getIndexCount() {
        return collections.stream().mapToInt(c -> c.indexes().size()).sum();
    }
}
