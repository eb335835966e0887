// file: storage/src/main/java/io/budgetsync/storage/BudgetRepository.java
package io.budgetsync.storage;

import io.budgetsync.core.WriterRecord;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.TreeSet;

/**
 * Entry point for reading and writing one budget directory.
 * <p>
 * Load path:  snapshot -> reconcile every writer's segments -> {@link EntityStore}.
 * Write path: {@link EntityStore} dirty set -> one new segment -> updated writer metadata.
 * <p>
 * Exclusive access to the budget during a commit is the caller's business.
 */
public final class BudgetRepository {

    private final BudgetFileSystem fs;
    private final EngineConfig config;
    private final SnapshotLoader snapshotLoader;
    private final Reconciler reconciler;
    private final DeltaWriter deltaWriter;

    public BudgetRepository(BudgetFileSystem fs, EngineConfig config) {
        this(fs, config, Clock.systemUTC());
    }

    public BudgetRepository(BudgetFileSystem fs, EngineConfig config, Clock clock) {
        this.fs = fs;
        this.config = config;
        this.snapshotLoader = new JsonSnapshotLoader(fs);
        this.reconciler = new Reconciler(fs, config);
        this.deltaWriter = new DeltaWriter(fs, config, clock);
    }

    /** Current state: the snapshot with every writer's segments folded in. */
    public EntityStore loadState(Path root) {
        EntityStore store = snapshotLoader.load(new BudgetLayout(root));
        reconciler.reconcile(store);
        return store;
    }

    /**
     * State as of {@code counter}: only segments ending at or below it are folded.
     *
     * @throws IllegalArgumentException if {@code counter} is not one of {@link #availableVersions(Path)}
     */
    public EntityStore loadStateAt(Path root, long counter) {
        List<Long> versions = availableVersions(root);
        if (!versions.contains(counter))
            throw new IllegalArgumentException("Version " + counter + " not available; available: " + versions);
        EntityStore store = snapshotLoader.load(new BudgetLayout(root));
        reconciler.reconcileUpTo(store, counter);
        return store;
    }

    /** 0 (snapshot only) followed by every segment end counter, ascending. */
    public List<Long> availableVersions(Path root) {
        TreeSet<Long> versions = new TreeSet<>();
        versions.add(0L);
        for (SegmentRef s : new SegmentDiscovery(fs).discover(new BudgetLayout(root)).segments()) {
            versions.add(s.range().end());
        }
        return List.copyOf(versions);
    }

    /** Write the store's changes as writer {@code writerGuid}. */
    public CommitResult commit(EntityStore store, String writerGuid) {
        return deltaWriter.commit(store, writerGuid);
    }

    public WriterRecord registerWriter(Path root) {
        return tracker(root).registerWriter();
    }

    public WriterRecord registerWriter(Path root, String friendlyName) {
        return tracker(root).registerWriter(friendlyName);
    }

    public KnowledgeTracker tracker(Path root) {
        return new KnowledgeTracker(fs, new BudgetLayout(root), config);
    }
}
