package org.mongomigrations.schema.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Index definition captured from a source collection.
 */
@Builder
public record IndexSchema(
    @JsonProperty(value = "name", required = true) String name,
    @JsonProperty(value = "keys", required = true) KeySpec keys,
    @JsonProperty("unique") boolean unique,
    @JsonProperty("sparse") boolean sparse,
    @JsonProperty("background") boolean background,
    @JsonProperty("expireAfterSeconds") Long expireAfterSeconds
) {

    /** Name of the implicit index every collection carries; never replayed. */
    public static final String IDENTITY_INDEX_NAME = "_id_";

    public IndexSchema {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Index name must not be empty");
        }
        if (keys == null) {
            throw new IllegalArgumentException("Index '" + name + "' has no keys");
        }
        if (expireAfterSeconds != null && expireAfterSeconds < 0) {
            throw new IllegalArgumentException("Index '" + name + "' has a negative expireAfterSeconds");
        }
    }

    @JsonIgnore
    public boolean isIdentityIndex() {
        return IDENTITY_INDEX_NAME.equals(name);
    }

    @JsonIgnore
    public boolean hasExpiry() {
        return expireAfterSeconds != null;
    }
}
