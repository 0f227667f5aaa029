package org.mongomigrations.apply;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operations whose failures the apply script records, with the name used in error records.
 */
public enum ScriptOperation {
    CREATE_COLLECTION("createCollection", ApplyTarget.Type.COLLECTION),
    SHARD_COLLECTION("shardCollection", ApplyTarget.Type.SHARD_COLLECTION),
    CREATE_INDEX("createIndex", ApplyTarget.Type.INDEX);

    private final String scriptName;
    private final ApplyTarget.Type targetType;

    ScriptOperation(String scriptName, ApplyTarget.Type targetType) {
        this.scriptName = scriptName;
        this.targetType = targetType;
    }

    public String getScriptName() {
        return scriptName;
    }

    public ApplyTarget.Type getTargetType() {
        return targetType;
    }

    public static Optional<ScriptOperation> fromScriptName(String name) {
        return Arrays.stream(values()).filter(op -> op.scriptName.equals(name)).findFirst();
    }
}
