// file: storage/src/test/java/io/budgetsync/storage/DeltaWriterTest.java
package io.budgetsync.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.budgetsync.core.EntityKind;
import io.budgetsync.core.entity.Payee;
import io.budgetsync.core.entity.Transaction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static io.budgetsync.storage.BudgetFixture.WRITER_A;
import static io.budgetsync.storage.BudgetFixture.WRITER_B;
import static io.budgetsync.storage.BudgetFixture.txn;
import static org.junit.jupiter.api.Assertions.*;

class DeltaWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-20T09:30:00Z"), ZoneOffset.UTC);

    @TempDir Path root;

    private EntityStore load(BudgetFileSystem fs) {
        EntityStore store = new JsonSnapshotLoader(fs).load(new BudgetLayout(root));
        new Reconciler(fs, EngineConfig.defaults()).reconcile(store);
        return store;
    }

    private static DeltaWriter writer(BudgetFileSystem fs) {
        return new DeltaWriter(fs, EngineConfig.defaults(), CLOCK);
    }

    private BudgetFixture fixture() {
        return new BudgetFixture(root)
                .snapshot(BudgetFixture.BASIC_SNAPSHOT)
                .writer(WRITER_A, "A", 15)
                .writer(WRITER_B, "B", 10)
                .segment(WRITER_A, "A", 11, 15, txn("t1", "A-15", 20000, null));
    }

    @Test
    void clean_store_writes_nothing() {
        fixture();
        var fs = new FaultInjectingFileSystem();

        CommitResult result = writer(fs).commit(load(fs), WRITER_B);

        assertFalse(result.written());
        assertTrue(fs.written().isEmpty());
    }

    @Test
    void dirty_entities_are_stamped_in_one_segment() throws Exception {
        BudgetFixture f = fixture();
        var fs = new FaultInjectingFileSystem();
        EntityStore store = load(fs);
        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withMemo("groceries"));
        store.put("p7", new Payee("Bakery", true, null));

        CommitResult result = writer(fs).commit(store, WRITER_B);

        assertEquals(new CounterRange(16, 17), result.range());
        assertEquals(f.layout.writerDir(WRITER_B).resolve("16_17.delta"), result.segment());
        assertTrue(Files.exists(result.segment()));

        JsonNode doc = JsonSupport.mapper().readTree(result.segment().toFile());
        assertEquals("B", doc.get("shortDeviceId").asText());
        assertEquals(16, doc.get("startVersion").asLong());
        assertEquals("2025-08-20T09:30:00Z", doc.get("publishTime").asText());
        assertEquals("p7", doc.get("items").get(0).get("entityId").asText());
        assertEquals("B-16", doc.get("items").get(0).get("entityVersion").asText());
        assertEquals("B-17", doc.get("items").get(1).get("entityVersion").asText());

        var meta = new KnowledgeTracker(fs, f.layout, EngineConfig.defaults()).findWriter(WRITER_B).orElseThrow();
        assertEquals(17, meta.knowledge());
        assertTrue(meta.hasFullKnowledge());

        assertFalse(store.hasChanges());
        assertEquals(17, store.get(EntityKind.TRANSACTION, "t1").orElseThrow().counter());
    }

    @Test
    void deletion_is_written_as_a_tombstone() throws Exception {
        fixture();
        var fs = new LocalBudgetFileSystem();
        EntityStore store = load(fs);
        store.delete(EntityKind.PAYEE, "p1");

        CommitResult result = writer(fs).commit(store, WRITER_B);

        JsonNode item = JsonSupport.mapper().readTree(result.segment().toFile()).get("items").get(0);
        assertEquals("payee", item.get("entityType").asText());
        assertTrue(item.get("isTombstone").asBoolean());
    }

    @Test
    void failed_metadata_write_removes_the_segment() {
        BudgetFixture f = fixture();
        var fs = new FaultInjectingFileSystem().failWritesTo(p -> p.toString().endsWith(".meta"));
        EntityStore store = load(fs);
        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withMemo("groceries"));

        assertThrows(CommitFailedException.class, () -> writer(fs).commit(store, WRITER_B));

        assertFalse(Files.exists(f.layout.writerDir(WRITER_B).resolve("16_16.delta")));
        assertTrue(store.hasChanges());
        assertEquals(15, store.get(EntityKind.TRANSACTION, "t1").orElseThrow().counter());
        assertTrue(f.read(f.layout.metadataFile(WRITER_B)).contains("\"knowledge\": 10"));
    }

    @Test
    void failed_segment_write_leaves_metadata_untouched() {
        BudgetFixture f = fixture();
        var fs = new FaultInjectingFileSystem().failWritesTo(p -> p.toString().endsWith(".delta"));
        EntityStore store = load(fs);
        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withMemo("groceries"));

        assertThrows(CommitFailedException.class, () -> writer(fs).commit(store, WRITER_B));

        assertTrue(fs.written().isEmpty());
        assertTrue(store.hasChanges());
    }

    @Test
    void corrupt_own_metadata_is_a_write_conflict() {
        BudgetFixture f = fixture();
        f.rawMeta(WRITER_B, "{ not json");
        var fs = new FaultInjectingFileSystem();
        EntityStore store = load(fs);
        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withMemo("groceries"));

        assertThrows(WriteConflictException.class, () -> writer(fs).commit(store, WRITER_B));
        assertTrue(fs.written().isEmpty());
    }

    @Test
    void unregistered_writer_is_a_write_conflict() {
        fixture();
        var fs = new FaultInjectingFileSystem();
        EntityStore store = load(fs);
        store.put("p7", new Payee("Bakery", true, null));

        assertThrows(WriteConflictException.class, () -> writer(fs).commit(store, "no-such-writer"));
    }

    @Test
    void new_writer_mints_above_snapshot_counters() {
        BudgetFixture f = new BudgetFixture(root).snapshot(BudgetFixture.BASIC_SNAPSHOT);
        var fs = new LocalBudgetFileSystem();
        var fresh = new KnowledgeTracker(fs, f.layout, EngineConfig.defaults()).registerWriter("phone");
        EntityStore store = load(fs);
        store.put("p7", new Payee("Bakery", true, null));

        CommitResult result = writer(fs).commit(store, fresh.writerGuid());

        assertEquals(new CounterRange(11, 11), result.range());
    }

    @Test
    void skipped_segment_clears_full_knowledge() {
        BudgetFixture f = fixture();
        f.rawSegment(WRITER_A, "9_9.delta", "garbage");
        var fs = new LocalBudgetFileSystem();
        EntityStore store = load(fs);
        store.put("p7", new Payee("Bakery", true, null));

        writer(fs).commit(store, WRITER_B);

        var meta = new KnowledgeTracker(fs, f.layout, EngineConfig.defaults()).findWriter(WRITER_B).orElseThrow();
        assertFalse(meta.hasFullKnowledge());
    }
}
