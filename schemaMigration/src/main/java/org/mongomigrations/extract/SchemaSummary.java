package org.mongomigrations.extract;

import java.util.Locale;

import org.mongomigrations.schema.model.CollectionSchema;
import org.mongomigrations.schema.model.SchemaSnapshot;
import org.mongomigrations.shell.ShellLiterals;

/**
 * Human readable inventory of a snapshot, printed after extraction and before apply.
 */
public final class SchemaSummary {

    private SchemaSummary() {
        throw new IllegalStateException("Utility class");
    }

    public static String describe(SchemaSnapshot snapshot) {
        var sb = new StringBuilder();
        sb.append("Schema Summary:").append(System.lineSeparator());
        sb.append("   Databases: ").append(snapshot.databases().size()).append(System.lineSeparator());
        sb.append("   Collections: ").append(snapshot.getCollectionCount()).append(System.lineSeparator());
        sb.append("   Indexes: ").append(snapshot.getIndexCount()).append(System.lineSeparator());
        sb.append("   Sharded Collections: ").append(snapshot.getShardedCollectionCount()).append(System.lineSeparator());

        for (var database : snapshot.databases()) {
            sb.append(System.lineSeparator())
                .append("   ").append(database.name())
                .append(String.format(Locale.ROOT, " (%.3f GB)", database.sizeGb()))
                .append(System.lineSeparator());
            sb.append("      Collections: ").append(database.collections().size()).append(System.lineSeparator());
            for (var collection : database.collections()) {
                sb.append("         - ").append(describe(collection)).append(System.lineSeparator());
            }
        }
        return sb.toString();
    }

    private static String describe(CollectionSchema collection) {
        var line = String.format(Locale.ROOT, "%s (%,d docs, %d indexes)",
            collection.name(), collection.docCount(), collection.indexes().size());
        if (collection.sharded()) {
            line += " [SHARDED: " + ShellLiterals.json(collection.shardKey()) + "]";
        } else if (collection.isShardStatusUnknown()) {
            line += " [SHARD STATUS UNKNOWN]";
        }
        return line;
    }
}
