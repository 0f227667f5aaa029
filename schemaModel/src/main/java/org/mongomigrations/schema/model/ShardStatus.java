package org.mongomigrations.schema.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of probing the cluster metadata for a collection's sharding state.
 * {@link #UNKNOWN} only appears when strict shard detection is enabled.
 */
public enum ShardStatus {
    @JsonProperty("sharded")
    SHARDED,
    @JsonProperty("unsharded")
    UNSHARDED,
    @JsonProperty("unknown")
    UNKNOWN
}
