package org.mongomigrations.apply;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.mongomigrations.schema.model.CollectionSchema;
import org.mongomigrations.schema.model.DatabaseSchema;
import org.mongomigrations.schema.model.IndexSchema;
import org.mongomigrations.schema.model.SchemaSnapshot;
import org.mongomigrations.shell.IdentifierValidator;

import lombok.extern.slf4j.Slf4j;

import static org.mongomigrations.shell.ShellLiterals.json;
import static org.mongomigrations.shell.ShellLiterals.string;

/**
 * Compiles a snapshot into a mongosh script that recreates its structure on a destination.
 *
 * Every statement runs in its own try block: a failure is printed with its full
 * database/collection/index identity and appended to {@code results.errors}, and the script moves
 * on. The summary block printed at the end is parsed by {@link ApplySummaryParser}.
 */
@Slf4j
public class ApplyScriptGenerator {

    static final String RULE = "============================================================";
    static final String DATABASES_CREATED = "Databases Created: ";
    static final String COLLECTIONS_CREATED = "Collections Created: ";
    static final String INDEXES_CREATED = "Indexes Created: ";
    static final String ERRORS = "Errors: ";
    static final String ERROR_DETAILS = "Error Details:";
    static final String ERROR_RECORD_PREFIX = "  - ";

    // NamespaceExists: createCollection on an existing collection
    static final int NAMESPACE_EXISTS_CODE = 48;

    public GeneratedScript generate(SchemaSnapshot snapshot, String databasePrefix) {
        var prefix = databasePrefix == null ? "" : databasePrefix;
        validateIdentifiers(snapshot, prefix);

        var script = new ScriptWriter();
        var targets = new ArrayList<ApplyTarget>();
        var skipped = new ArrayList<ApplyTarget>();

        writeHeader(script, snapshot, prefix);
        for (var database : snapshot.databases()) {
            writeDatabase(script, database, prefix + database.name(), targets, skipped);
        }
        writeFooter(script);

        log.debug("Generated apply script with {} targets ({} skipped)", targets.size(), skipped.size());
        return new GeneratedScript(script.toString(), targets, skipped);
    }

    private void validateIdentifiers(SchemaSnapshot snapshot, String prefix) {
        var checks = new ArrayList<Optional<String>>();
        for (var database : snapshot.databases()) {
            var targetDb = prefix + database.name();
            checks.add(IdentifierValidator.checkDatabaseName(targetDb));
            for (var collection : database.collections()) {
                checks.add(IdentifierValidator.checkCollectionName(targetDb, collection.name()));
                var namespace = targetDb + "." + collection.name();
                if (collection.sharded()) {
                    collection.shardKey().keys().fields()
                        .forEach(f -> checks.add(IdentifierValidator.checkFieldPath(namespace + " shard key", f.path())));
                }
                for (var index : collection.getReplayableIndexes()) {
                    checks.add(IdentifierValidator.checkIndexName(namespace, index.name()));
                    index.keys().fields()
                        .forEach(f -> checks.add(IdentifierValidator.checkFieldPath(namespace + "." + index.name(), f.path())));
                }
            }
        }
        IdentifierValidator.requireSafe(checks);
    }

    private void writeHeader(ScriptWriter script, SchemaSnapshot snapshot, String prefix) {
        script.line("// Auto-generated schema creation script");
        script.line("// Source snapshot extracted at " + Optional.ofNullable(snapshot.extractedAt()).orElse("unknown"));
        script.blank();
        script.print(RULE);
        script.print("Applying Schema to Destination MongoDB");
        script.print(RULE);
        script.print("Total Databases: " + snapshot.databases().size());
        script.line("print('Database Prefix: ' + " + string(prefix.isEmpty() ? "None" : prefix) + ");");
        script.print(RULE);
        script.print("");
        script.blank();
        script.line("var results = { databases: 0, collections: 0, indexes: 0, errors: [] };");
        script.line("var adminDb = db.getSiblingDB('admin');");
        script.blank();
    }

    private void writeDatabase(ScriptWriter script,
                               DatabaseSchema database,
                               String targetDbName,
                               List<ApplyTarget> targets,
                               List<ApplyTarget> skipped)
    {
        var dbLiteral = string(targetDbName);
        targets.add(ApplyTarget.database(targetDbName));

        script.line("// Database: " + targetDbName);
        script.line("print('');");
        script.line("print('Database: ' + " + dbLiteral + ");");
        script.line("var targetDb = db.getSiblingDB(" + dbLiteral + ");");
        script.blank();

        if (database.hasShardedCollections()) {
            script.line("try {");
            script.line("    adminDb.runCommand({ enableSharding: " + dbLiteral + " });");
            script.line("    print('   [OK] Sharding enabled on database');");
            script.line("} catch (e) {");
            script.line("    // Usually already enabled; a real problem surfaces in shardCollection");
            script.line("    print('   [WARN] Could not enable sharding: ' + e.message);");
            script.line("}");
            script.blank();
        }

        for (var collection : database.collections()) {
            writeCollection(script, targetDbName, collection, targets, skipped);
        }

        script.line("results.databases++;");
        script.blank();
    }

    private void writeCollection(ScriptWriter script,
                                 String targetDbName,
                                 CollectionSchema collection,
                                 List<ApplyTarget> targets,
                                 List<ApplyTarget> skipped)
    {
        var dbLiteral = string(targetDbName);
        var collLiteral = string(collection.name());
        var errorIdentity = "db: " + dbLiteral + ", collection: " + collLiteral;

        script.line("// Collection: " + collection.name());
        script.line("print('   Creating collection: ' + " + collLiteral + ");");
        targets.add(ApplyTarget.collection(targetDbName, collection.name()));
        script.line("try {");
        script.line("    targetDb.createCollection(" + collLiteral + ");");
        script.line("    print('      [OK] Collection created');");
        script.line("    results.collections++;");
        script.line("} catch (e) {");
        script.line("    if (e.code === " + NAMESPACE_EXISTS_CODE + ") {");
        script.line("        print('      [OK] Collection already exists');");
        script.line("        results.collections++;");
        script.line("    } else {");
        script.line("        print('      [ERROR] ' + " + dbLiteral + " + '.' + " + collLiteral + " + ': ' + e.message);");
        script.line("        results.errors.push({ " + errorIdentity + ", operation: '"
            + ScriptOperation.CREATE_COLLECTION.getScriptName() + "', error: e.message });");
        script.line("    }");
        script.line("}");

        if (collection.sharded()) {
            var keyJson = json(collection.shardKey());
            targets.add(ApplyTarget.shardCollection(targetDbName, collection.name()));
            script.line("// Shard key: " + keyJson);
            script.line("try {");
            script.line("    adminDb.runCommand({ shardCollection: " + string(targetDbName + "." + collection.name())
                + ", key: " + keyJson + " });");
            script.line("    print('      [OK] Collection sharded');");
            script.line("} catch (e) {");
            script.line("    print('      [ERROR] Sharding ' + " + dbLiteral + " + '.' + " + collLiteral + " + ': ' + e.message);");
            script.line("    results.errors.push({ " + errorIdentity + ", operation: '"
                + ScriptOperation.SHARD_COLLECTION.getScriptName() + "', error: e.message });");
            script.line("}");
        }

        for (var index : collection.indexes()) {
            if (index.isIdentityIndex()) {
                skipped.add(ApplyTarget.index(targetDbName, collection.name(), index.name()));
                continue;
            }
            targets.add(ApplyTarget.index(targetDbName, collection.name(), index.name()));
            writeIndex(script, errorIdentity, collLiteral, index);
        }
        script.blank();
    }

    private void writeIndex(ScriptWriter script, String errorIdentity, String collLiteral, IndexSchema index) {
        var idxLiteral = string(index.name());
        script.line("try {");
        script.line("    targetDb.getCollection(" + collLiteral + ").createIndex("
            + json(index.keys()) + ", " + json(indexOptions(index)) + ");");
        script.line("    print('      [OK] Index: ' + " + idxLiteral + ");");
        script.line("    results.indexes++;");
        script.line("} catch (e) {");
        script.line("    print('      [ERROR] Index ' + " + idxLiteral + " + ' failed: ' + e.message);");
        script.line("    results.errors.push({ " + errorIdentity + ", index: " + idxLiteral + ", operation: '"
            + ScriptOperation.CREATE_INDEX.getScriptName() + "', error: e.message });");
        script.line("}");
    }

    static Map<String, Object> indexOptions(IndexSchema index) {
        var options = new LinkedHashMap<String, Object>();
        options.put("name", index.name());
        if (index.unique()) {
            options.put("unique", true);
        }
        if (index.sparse()) {
            options.put("sparse", true);
        }
        if (index.background()) {
            options.put("background", true);
        }
        if (index.hasExpiry()) {
            options.put("expireAfterSeconds", index.expireAfterSeconds());
        }
        return options;
    }

    private void writeFooter(ScriptWriter script) {
        script.print("");
        script.print(RULE);
        script.print("Schema Application Complete");
        script.print(RULE);
        script.line("print('" + DATABASES_CREATED + "' + results.databases);");
        script.line("print('" + COLLECTIONS_CREATED + "' + results.collections);");
        script.line("print('" + INDEXES_CREATED + "' + results.indexes);");
        script.line("print('" + ERRORS + "' + results.errors.length);");
        script.line("if (results.errors.length > 0) {");
        script.line("    print('');");
        script.line("    print('" + ERROR_DETAILS + "');");
        script.line("    results.errors.forEach(function(err) {");
        script.line("        print('" + ERROR_RECORD_PREFIX + "' + JSON.stringify(err));");
        script.line("    });");
        script.line("}");
        script.print(RULE);
    }

    /** Accumulates script lines. */
    private static class ScriptWriter {
        private final StringBuilder sb = new StringBuilder();

        void line(String text) {
            sb.append(text).append('\n');
        }

        void blank() {
            sb.append('\n');
        }

        /** Emits a print of a constant message. */
        void print(String message) {
            line("print(" + string(message) + ");");
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}
