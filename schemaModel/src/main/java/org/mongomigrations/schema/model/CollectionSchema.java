package org.mongomigrations.schema.model;

import java.util.HashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Collection definition with its approximate statistics, indexes and sharding state.
 * A shard key is present if and only if the collection is sharded.
 */
@Builder
public record CollectionSchema(
    @JsonProperty(value = "name", required = true) String name,
    @JsonProperty("doc_count") long docCount,
    @JsonProperty("size_gb") double sizeGb,
    @JsonProperty("avg_doc_size") double avgDocSize,
    @JsonProperty("indexes") List<IndexSchema> indexes,
    @JsonProperty("is_sharded") boolean sharded,
    @JsonProperty("shard_key") ShardKey shardKey,
    @JsonProperty("shard_status") ShardStatus shardStatus
) {

    public CollectionSchema {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Collection name must not be empty");
        }
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
        var indexNames = new HashSet<String>();
        for (var index : indexes) {
            if (!indexNames.add(index.name())) {
                throw new IllegalArgumentException(
                    "Duplicate index '" + index.name() + "' in collection '" + name + "'");
            }
        }
        if (sharded && shardKey == null) {
            throw new IllegalArgumentException("Sharded collection '" + name + "' has no shard_key");
        }
        if (!sharded && shardKey != null) {
            throw new IllegalArgumentException("Collection '" + name + "' has a shard_key but is_sharded is false");
        }
        if (shardStatus == null) {
            shardStatus = sharded ? ShardStatus.SHARDED : ShardStatus.UNSHARDED;
        } else if ((shardStatus == ShardStatus.SHARDED) != sharded) {
            throw new IllegalArgumentException(
                "Collection '" + name + "' has shard_status " + shardStatus + " but is_sharded is " + sharded);
        }
    }

    /** Indexes that must be recreated on a destination, i.e. everything but the identity index. */
    @JsonIgnore
    public List<IndexSchema> getReplayableIndexes() {
        return indexes.stream()
            .filter(index -> !index.isIdentityIndex())
            .toList();
    }

    @JsonIgnore
    public boolean isShardStatusUnknown() {
        return shardStatus == ShardStatus.UNKNOWN;
    }
}
