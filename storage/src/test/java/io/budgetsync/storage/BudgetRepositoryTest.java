// file: storage/src/test/java/io/budgetsync/storage/BudgetRepositoryTest.java
package io.budgetsync.storage;

import io.budgetsync.core.Entity;
import io.budgetsync.core.EntityKind;
import io.budgetsync.core.entity.Transaction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.budgetsync.storage.BudgetFixture.WRITER_A;
import static io.budgetsync.storage.BudgetFixture.WRITER_B;
import static io.budgetsync.storage.BudgetFixture.txn;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Load, modify, commit and reload through the repository facade.
 */
class BudgetRepositoryTest {

    @TempDir Path root;

    private final BudgetRepository repo = new BudgetRepository(new LocalBudgetFileSystem(), EngineConfig.defaults());

    private BudgetFixture fixture() {
        return new BudgetFixture(root)
                .snapshot(BudgetFixture.BASIC_SNAPSHOT)
                .writer(WRITER_A, "A", 15)
                .writer(WRITER_B, "B", 10)
                .segment(WRITER_A, "A", 11, 15, txn("t1", "A-15", 20000, null));
    }

    @Test
    void edit_survives_a_reload() {
        BudgetFixture f = fixture();

        EntityStore store = repo.loadState(root);
        assertEquals(20000, store.get(EntityKind.TRANSACTION, "t1").orElseThrow().payload(Transaction.class).amount());

        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withMemo("groceries"));
        CommitResult result = repo.commit(store, WRITER_B);

        assertTrue(Files.exists(f.layout.writerDir(WRITER_B).resolve("16_16.delta")));
        assertEquals(1, result.revisionCount());

        Entity t1 = repo.loadState(root).get(EntityKind.TRANSACTION, "t1").orElseThrow();
        Transaction txn = t1.payload(Transaction.class);
        assertEquals(20000, txn.amount());
        assertEquals("groceries", txn.memo());
        assertEquals(16, t1.counter());
        assertEquals("B", t1.version().writerTag());

        assertEquals(16, repo.tracker(root).findWriter(WRITER_B).orElseThrow().knowledge());
        assertEquals(16, repo.tracker(root).globalKnowledge());
    }

    @Test
    void second_commit_continues_after_the_first() {
        fixture();
        EntityStore store = repo.loadState(root);

        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withAmount(1));
        repo.commit(store, WRITER_B);
        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withAmount(2));
        CommitResult second = repo.commit(store, WRITER_A);

        assertEquals(new CounterRange(17, 17), second.range());
        assertEquals(2, repo.loadState(root).get(EntityKind.TRANSACTION, "t1").orElseThrow()
                .payload(Transaction.class).amount());
    }

    @Test
    void registered_writer_can_commit() {
        fixture();
        var phone = repo.registerWriter(root, "phone");
        EntityStore store = repo.loadState(root);
        store.delete(EntityKind.TRANSACTION, "t1");

        CommitResult result = repo.commit(store, phone.writerGuid());

        assertEquals("C", phone.writerTag());
        assertEquals(new CounterRange(16, 16), result.range());
        assertTrue(repo.loadState(root).get(EntityKind.TRANSACTION, "t1").isEmpty());
    }

    @Test
    void available_versions_list_segment_ends() {
        fixture().segment(WRITER_B, "B", 16, 17, txn("t1", "B-17", 5, null));

        assertEquals(List.of(0L, 15L, 17L), repo.availableVersions(root));
    }

    @Test
    void state_at_an_earlier_version_ignores_later_segments() {
        fixture().segment(WRITER_B, "B", 16, 17, txn("t1", "B-17", 5, null));

        long atSnapshot = repo.loadStateAt(root, 0).get(EntityKind.TRANSACTION, "t1").orElseThrow()
                .payload(Transaction.class).amount();
        long at15 = repo.loadStateAt(root, 15).get(EntityKind.TRANSACTION, "t1").orElseThrow()
                .payload(Transaction.class).amount();
        long at17 = repo.loadStateAt(root, 17).get(EntityKind.TRANSACTION, "t1").orElseThrow()
                .payload(Transaction.class).amount();

        assertEquals(0, atSnapshot);
        assertEquals(20000, at15);
        assertEquals(5, at17);
        assertThrows(IllegalArgumentException.class, () -> repo.loadStateAt(root, 16));
    }

    @Test
    void state_at_a_version_does_not_claim_full_knowledge() {
        fixture().segment(WRITER_B, "B", 16, 17, txn("t1", "B-17", 5, null));

        EntityStore store = repo.loadStateAt(root, 15);
        store.update(EntityKind.TRANSACTION, "t1", Transaction.class, t -> t.withMemo("late"));
        CommitResult result = repo.commit(store, WRITER_A);

        assertEquals(new CounterRange(18, 18), result.range());
        assertFalse(repo.tracker(root).findWriter(WRITER_A).orElseThrow().hasFullKnowledge());
    }

    @Test
    void missing_snapshot_fails_the_load() {
        assertThrows(MalformedSnapshotException.class, () -> repo.loadState(root));
    }
}
