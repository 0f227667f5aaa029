package org.mongomigrations.schema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shard key of a sharded collection. Persisted as the bare key object.
 */
public record ShardKey(KeySpec keys) {

    public ShardKey {
        if (keys == null) {
            throw new IllegalArgumentException("Shard key must have a key specification");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ShardKey of(KeySpec keys) {
        return new ShardKey(keys);
    }

    @JsonValue
    public KeySpec keys() {
        return keys;
    }

    public boolean isHashed() {
        return keys.containsType("hashed");
    }
}
