package org.mongomigrations.apply;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One error record of the apply script summary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplyError(
    @JsonProperty("db") String database,
    @JsonProperty("collection") String collection,
    @JsonProperty("index") String index,
    @JsonProperty("operation") String operation,
    @JsonProperty("error") String error
) {

    public Optional<ApplyTarget> toTarget() {
        return ScriptOperation.fromScriptName(operation)
            .map(op -> new ApplyTarget(op.getTargetType(), database, collection, index));
    }

    public String describe() {
        var sb = new StringBuilder();
        sb.append(database);
        if (collection != null) {
            sb.append('.').append(collection);
        }
        if (index != null) {
            sb.append(" index ").append(index);
        }
        if (operation != null) {
            sb.append(" (").append(operation).append(')');
        }
        return sb.append(": ").append(error).toString();
    }
}
