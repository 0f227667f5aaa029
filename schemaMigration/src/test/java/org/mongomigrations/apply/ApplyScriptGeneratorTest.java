package org.mongomigrations.apply;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.mongomigrations.schema.model.IndexSchema;
import org.mongomigrations.schema.model.KeyField;
import org.mongomigrations.schema.model.KeySpec;
import org.mongomigrations.shell.UnsafeIdentifierException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mongomigrations.testutils.SnapshotFixtures.collection;
import static org.mongomigrations.testutils.SnapshotFixtures.database;
import static org.mongomigrations.testutils.SnapshotFixtures.index;
import static org.mongomigrations.testutils.SnapshotFixtures.sample;
import static org.mongomigrations.testutils.SnapshotFixtures.snapshot;

class ApplyScriptGeneratorTest {

    private final ApplyScriptGenerator generator = new ApplyScriptGenerator();

    @Test
    void identityIndexIsNeverCreated() {
        var script = generator.generate(sample(), "");

        assertFalse(script.body().contains("\"_id_\""));
        assertEquals(3, script.skipped().size());
        assertTrue(script.skipped().stream().allMatch(t -> "_id_".equals(t.index())));
        assertTrue(script.targets().stream().noneMatch(t -> "_id_".equals(t.index())));
    }

    @Test
    void everyDatabaseNameCarriesThePrefix() {
        var script = generator.generate(sample(), "test_");

        var siblings = Pattern.compile("db\\.getSiblingDB\\(\"([^\"]+)\"\\)").matcher(script.body())
            .results().map(m -> m.group(1)).toList();
        assertEquals(List.of("test_mobile_apps", "test_analytics"), siblings);
        assertTrue(script.targets().stream().allMatch(t -> t.database().startsWith("test_")));
        assertTrue(script.body().contains("shardCollection: \"test_mobile_apps.applications\""));
    }

    @Test
    void emptyPrefixKeepsNames() {
        var script = generator.generate(sample(), "");

        assertTrue(script.body().contains("db.getSiblingDB(\"mobile_apps\")"));
        assertTrue(script.body().contains("print('Database Prefix: ' + \"None\");"));
    }

    @Test
    void enableShardingOncePerDatabaseWithShardedCollections() {
        var script = generator.generate(sample(), "");

        assertEquals(1, countOccurrences(script.body(), "enableSharding"));
        assertTrue(script.body().contains("enableSharding: \"mobile_apps\""));
        assertFalse(script.body().contains("enableSharding: \"analytics\""));
    }

    @Test
    void noShardingCommandsForUnshardedSnapshot() {
        var script = generator.generate(snapshot(database("plain", collection("a"), collection("b"))), "");

        assertFalse(script.body().contains("enableSharding"));
        assertFalse(script.body().contains("shardCollection"));
    }

    @Test
    void shardKeyIsEmbeddedLiterally() {
        var script = generator.generate(sample(), "");

        assertTrue(script.body().contains("key: {\"tenantId\":\"hashed\"}"));
        assertTrue(script.targets().contains(ApplyTarget.shardCollection("mobile_apps", "applications")));
    }

    @Test
    void indexOptionsOnlyIncludeSetFlags() {
        var plain = ApplyScriptGenerator.indexOptions(
            IndexSchema.builder().name("idx_plain").keys(KeySpec.of(KeyField.ascending("a"))).build());
        var ttl = ApplyScriptGenerator.indexOptions(IndexSchema.builder()
            .name("idx_ttl")
            .keys(KeySpec.of(KeyField.ascending("a")))
            .unique(true)
            .background(true)
            .expireAfterSeconds(0L)
            .build());

        assertEquals(List.of("name"), List.copyOf(plain.keySet()));
        assertEquals(List.of("name", "unique", "background", "expireAfterSeconds"), List.copyOf(ttl.keySet()));
        assertEquals(0L, ttl.get("expireAfterSeconds"));
    }

    @Test
    void createIndexStatementsCarryKeysAndOptions() {
        var script = generator.generate(sample(), "");

        assertTrue(script.body().contains(
            "createIndex({\"email\":1}, {\"name\":\"idx_email\",\"unique\":true,\"sparse\":true});"));
        assertTrue(script.body().contains(
            "createIndex({\"lastSeen\":1}, {\"name\":\"idx_session_ttl\",\"expireAfterSeconds\":3600});"));
    }

    @Test
    void existingCollectionIsTolerated() {
        var script = generator.generate(sample(), "");

        assertTrue(script.body().contains("if (e.code === 48)"));
    }

    @Test
    void everyStatementIsIsolatedAndRecordsItsOwnError() {
        var script = generator.generate(sample(), "test_");
        var blocks = tryBlocks(script.body());

        var recorded = new ArrayList<ApplyTarget>();
        int shardingBlocks = 0;
        for (var block : blocks) {
            assertEquals(1, statementCount(block.body()), "one statement per try block: " + block.body());
            if (block.body().get(0).contains("enableSharding: ")) {
                shardingBlocks++;
                assertTrue(block.handler().stream().noneMatch(l -> l.contains("results.errors.push")));
                continue;
            }
            var pushes = block.handler().stream().map(ERROR_RECORD::matcher).filter(m -> m.matches()).toList();
            assertEquals(1, pushes.size(), "one error record per handler: " + block.handler());
            var record = pushes.get(0);
            var type = ScriptOperation.fromScriptName(record.group(4)).orElseThrow().getTargetType();
            var target = new ApplyTarget(type, record.group(1), record.group(2), record.group(3));
            assertTrue(block.body().get(0).contains(target.collection() + "\""), block.body().get(0));
            if (target.index() != null) {
                assertTrue(block.body().get(0).contains("\"name\":\"" + target.index() + "\""), block.body().get(0));
            }
            recorded.add(target);
        }

        assertEquals(1, shardingBlocks);
        assertEquals(8, recorded.size());
        assertEquals(script.targets().stream().filter(t -> t.type() != ApplyTarget.Type.DATABASE).toList(), recorded);
    }

    @Test
    void existingCollectionCountsAsCreated() {
        var blocks = tryBlocks(generator.generate(sample(), "").body());

        var collectionBlocks = blocks.stream().filter(b -> b.body().get(0).contains("createCollection(")).toList();
        assertEquals(3, collectionBlocks.size());
        for (var block : collectionBlocks) {
            var handler = block.handler();
            assertEquals("if (e.code === 48) {", handler.get(0));
            int elseAt = handler.indexOf("} else {");
            assertTrue(handler.subList(1, elseAt).contains("results.collections++;"));
            assertTrue(handler.subList(1, elseAt).stream().noneMatch(l -> l.contains("results.errors.push")));
            assertTrue(handler.subList(elseAt, handler.size()).stream().anyMatch(l -> l.startsWith("results.errors.push(")));
            assertTrue(block.body().contains("results.collections++;"));
        }
    }

    @Test
    void targetsFollowSnapshotOrder() {
        var script = generator.generate(snapshot(database("db1", collection("c1", index("i1", "f")))), "");

        assertEquals(List.of(
            ApplyTarget.database("db1"),
            ApplyTarget.collection("db1", "c1"),
            ApplyTarget.index("db1", "c1", "i1")), script.targets());
    }

    @Test
    void summaryBlockIsPrintedLast() {
        var body = generator.generate(sample(), "").body();

        int errorsAt = body.indexOf("print('Errors: ' + results.errors.length);");
        assertTrue(errorsAt > body.indexOf("print('Indexes Created: ' + results.indexes);"));
        assertTrue(errorsAt > body.lastIndexOf("createIndex("));
        assertTrue(body.contains("print('  - ' + JSON.stringify(err));"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"bad'name", "bad\"name", "bad;name", "bad`name", "bad\nname"})
    void unsafeCollectionNamesAreRejected(String name) {
        var unsafe = snapshot(database("db1", collection(name)));

        assertThrows(UnsafeIdentifierException.class, () -> generator.generate(unsafe, ""));
    }

    @Test
    void unsafePrefixIsRejected() {
        var ex = assertThrows(UnsafeIdentifierException.class, () -> generator.generate(sample(), "x');"));

        assertEquals(2, ex.getProblems().size());
    }

    @Test
    void allProblemsAreReportedTogether() {
        var unsafe = snapshot(database("db1",
            collection("ok", index("idx'1", "a")),
            collection("c;2", index("idx_2", "b\"c"))));

        var ex = assertThrows(UnsafeIdentifierException.class, () -> generator.generate(unsafe, ""));

        assertEquals(3, ex.getProblems().size());
    }

    /** One top-level {@code try { ... } catch (e) { ... }} of a generated script. */
    private record TryBlock(List<String> body, List<String> handler) {}

    private static final Pattern STATEMENT =
        Pattern.compile("createCollection\\(|shardCollection: |createIndex\\(|enableSharding: ");
    private static final Pattern ERROR_RECORD = Pattern.compile(
        "results\\.errors\\.push\\(\\{ db: \"([^\"]*)\", collection: \"([^\"]*)\"(?:, index: \"([^\"]*)\")?, "
            + "operation: '(\\w+)', error: e\\.message \\}\\);");

    private static List<TryBlock> tryBlocks(String script) {
        var blocks = new ArrayList<TryBlock>();
        List<String> body = null;
        List<String> handler = null;
        for (var line : script.split("\n")) {
            if (line.equals("try {")) {
                body = new ArrayList<>();
            } else if (line.equals("} catch (e) {")) {
                handler = new ArrayList<>();
            } else if (line.equals("}") && handler != null) {
                blocks.add(new TryBlock(body, handler));
                body = null;
                handler = null;
            } else if (handler != null) {
                handler.add(line.trim());
            } else if (body != null) {
                body.add(line.trim());
            } else {
                assertFalse(STATEMENT.matcher(line).find(), "statement outside a try block: " + line);
            }
        }
        return blocks;
    }

    private static long statementCount(List<String> lines) {
        return lines.stream().filter(l -> STATEMENT.matcher(l).find()).count();
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        for (int at = text.indexOf(token); at >= 0; at = text.indexOf(token, at + token.length())) {
            count++;
        }
        return count;
    }
}
