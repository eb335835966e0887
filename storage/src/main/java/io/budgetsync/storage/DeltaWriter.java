// file: storage/src/main/java/io/budgetsync/storage/DeltaWriter.java
package io.budgetsync.storage;

import io.budgetsync.core.Entity;
import io.budgetsync.core.WriterRecord;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a store's dirty entities as one new delta segment.
 * <p>
 * Commit protocol:
 *  1) Look up the writer's own metadata; it must be present and readable.
 *  2) Mint one counter per dirty entity, above global knowledge.
 *  3) Stamp the dirty entities in key order.
 *  4) Write the segment atomically.
 *  5) Rewrite the writer's metadata with knowledge = range end.
 *  6) Only then install the stamped revisions and clear the dirty set.
 * <p>
 * If step 5 fails the segment is deleted again, so a failed commit leaves the
 * on-disk state unchanged and the store still dirty.
 */
public final class DeltaWriter {
    private static final Logger log = Logger.getLogger(DeltaWriter.class.getName());

    private final BudgetFileSystem fs;
    private final EngineConfig config;
    private final Clock clock;

    public DeltaWriter(BudgetFileSystem fs, EngineConfig config, Clock clock) {
        this.fs = fs;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws WriteConflictException if no safe range can be minted; nothing is written
     * @throws CommitFailedException  if writing failed; nothing is left behind
     */
    public CommitResult commit(EntityStore store, String writerGuid) {
        List<Entity> dirty = store.dirtyEntities();
        if (dirty.isEmpty()) {
            log.log(Level.FINE, "Nothing to commit for {0}", writerGuid);
            return CommitResult.nothingToCommit(writerGuid);
        }

        BudgetLayout layout = new BudgetLayout(store.root());
        KnowledgeTracker tracker = new KnowledgeTracker(fs, layout, config);
        WriterRecord writer = ownMetadata(tracker, layout, writerGuid);

        CounterRange range = tracker.mintRange(writer, dirty.size(), store.highestCounter());
        Path segment = layout.segmentFile(writer.writerGuid(), range);
        if (fs.exists(segment))
            throw new WriteConflictException("Segment " + segment + " already exists; another writer minted the same range");

        List<Entity> stamped = new ArrayList<>(dirty.size());
        long counter = range.start();
        for (Entity e : dirty) stamped.add(e.withVersion(writer.stamp(counter++)));

        byte[] bytes = SegmentCodec.encode(writer, range, clock.instant(), config.formatVersion(), stamped);
        try {
            fs.writeAtomically(segment, bytes);
        } catch (UncheckedIOException e) {
            throw new CommitFailedException("Failed to write segment " + segment, e);
        }

        try {
            tracker.recordKnowledge(writer, range.end(), store.report().complete());
        } catch (RuntimeException e) {
            rollback(segment, e);
            throw new CommitFailedException("Failed to update metadata of writer " + writerGuid + "; segment removed", e);
        }

        store.markCommitted(stamped);
        log.log(Level.INFO, "Committed {0} revision(s) as {1} in {2}",
                new Object[]{stamped.size(), writer.writerTag(), segment.getFileName()});
        return new CommitResult(writer.writerGuid(), range, segment, stamped.size());
    }

    private static WriterRecord ownMetadata(KnowledgeTracker tracker, BudgetLayout layout, String writerGuid) {
        try {
            return tracker.findWriter(writerGuid).orElseThrow(() -> new WriteConflictException(
                    "Writer " + writerGuid + " has no metadata under " + layout.devicesDir()));
        } catch (DeviceMetadataCorruptException e) {
            throw new WriteConflictException("Cannot read own metadata of writer " + writerGuid, e);
        }
    }

    private void rollback(Path segment, RuntimeException cause) {
        try {
            fs.deleteIfExists(segment);
        } catch (UncheckedIOException e) {
            cause.addSuppressed(e);
            log.log(Level.SEVERE, "Failed to remove segment " + segment + " after a failed commit", e);
        }
    }
}
