// file: storage/src/main/java/io/budgetsync/storage/Reconciler.java
package io.budgetsync.storage;

import io.budgetsync.core.ConflictResolver;
import io.budgetsync.core.Entity;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Folds every writer's delta segments onto a loaded snapshot.
 * <p>
 * Algorithm:
 *  1) Discover segments under every writer directory and sort them by counter range.
 *  2) Decode each one. Corrupt segments are skipped or abort the load, per policy.
 *  3) Flatten all revisions and sort them by counter (ties: writer tag, kind, id).
 *  4) Fold in that order through the conflict resolver; a revision wins only if
 *     it is newer than what the store holds.
 * <p>
 * The result depends only on the set of segment files, never on listing order.
 * Counter gaps between segments are reported as warnings; they do not stop the load.
 */
public final class Reconciler {
    private static final Logger log = Logger.getLogger(Reconciler.class.getName());

    static final Comparator<Entity> FOLD_ORDER =
            Comparator.comparingLong(Entity::counter)
                    .thenComparing(e -> e.version().writerTag())
                    .thenComparing(Entity::kind)
                    .thenComparing(Entity::entityId);

    private final BudgetFileSystem fs;
    private final EngineConfig config;
    private final SegmentDiscovery discovery;
    private final ConflictResolver resolver;

    public Reconciler(BudgetFileSystem fs, EngineConfig config) {
        this(fs, config, new ConflictResolver.LastWriterWins());
    }

    public Reconciler(BudgetFileSystem fs, EngineConfig config, ConflictResolver resolver) {
        this.fs = fs;
        this.config = config;
        this.discovery = new SegmentDiscovery(fs);
        this.resolver = resolver;
    }

    /** Fold every discovered segment. */
    public ReconcileReport reconcile(EntityStore store) {
        return fold(store, Long.MAX_VALUE);
    }

    /**
     * Fold only segments whose whole range lies at or below {@code versionCap}.
     * Used to inspect the budget as it was at an earlier counter.
     */
    public ReconcileReport reconcileUpTo(EntityStore store, long versionCap) {
        if (versionCap < 0) throw new IllegalArgumentException("versionCap must be >= 0");
        return fold(store, versionCap);
    }

    private ReconcileReport fold(EntityStore store, long versionCap) {
        BudgetLayout layout = new BudgetLayout(store.root());
        long snapshotKnowledge = store.highestCounter();
        SegmentDiscovery.Result discovered = discovery.discover(layout);

        List<MalformedDeltaException> skippedSegments = new ArrayList<>();
        for (MalformedDeltaException rejected : discovered.rejected()) {
            onCorruptSegment(rejected, skippedSegments);
        }

        List<DeltaSegment> segments = new ArrayList<>();
        List<UnknownEntityTypeException> skippedRecords = new ArrayList<>();
        boolean capped = false;
        for (SegmentRef ref : discovered.segments()) {
            if (ref.range().end() > versionCap) {
                capped = true;
                continue;
            }
            DeltaSegment segment;
            try {
                segment = SegmentCodec.decode(ref, readSegment(ref));
            } catch (MalformedDeltaException e) {
                onCorruptSegment(e, skippedSegments);
                continue;
            }
            skippedRecords.addAll(segment.skipped());
            segments.add(segment);
        }

        List<VersionGapException> gaps = detectGaps(segments, snapshotKnowledge);

        List<Entity> revisions = new ArrayList<>();
        for (DeltaSegment s : segments) revisions.addAll(s.revisions());
        revisions.sort(FOLD_ORDER);

        int applied = 0;
        int stale = 0;
        for (Entity rev : revisions) {
            Entity current = store.revisions().get(rev.key());
            if (resolver.supersedes(current, rev)) {
                store.replace(rev);
                applied++;
            } else {
                stale++;
                log.log(Level.FINE, "Ignoring {0} for {1}: store holds {2}",
                        new Object[]{rev.version(), rev.key(), current.version()});
            }
        }

        List<SegmentRef> appliedSegments = new ArrayList<>(segments.size());
        for (DeltaSegment s : segments) appliedSegments.add(s.ref());

        ReconcileReport report = new ReconcileReport(
                appliedSegments, skippedSegments, skippedRecords, gaps,
                applied, stale, store.highestCounter(), capped);
        store.attachReport(report);

        log.log(Level.INFO, "Reconciled {0}: {1} segment(s), {2} revision(s) applied, {3} stale, {4} segment(s) skipped, knowledge {5}",
                new Object[]{store.root(), appliedSegments.size(), applied, stale, skippedSegments.size(), String.valueOf(report.knowledge())});
        return report;
    }

    private byte[] readSegment(SegmentRef ref) {
        try {
            return fs.read(ref.path());
        } catch (UncheckedIOException e) {
            throw new MalformedDeltaException(ref.path(), "unreadable", e);
        }
    }

    private void onCorruptSegment(MalformedDeltaException e, List<MalformedDeltaException> skipped) {
        if (config.segmentFailurePolicy() == SegmentFailurePolicy.ABORT) throw e;
        log.log(Level.WARNING, e.getMessage() + "; segment skipped", e);
        skipped.add(e);
    }

    /**
     * Each segment should start right after the highest counter seen before it.
     * Segments entirely covered by the snapshot are expected after a compaction and
     * are not reported.
     */
    private static List<VersionGapException> detectGaps(List<DeltaSegment> sorted, long snapshotKnowledge) {
        List<VersionGapException> gaps = new ArrayList<>();
        long known = snapshotKnowledge;
        long previousEnd = 0;
        for (DeltaSegment s : sorted) {
            CounterRange r = s.ref().range();
            if (r.start() > known + 1) {
                VersionGapException gap = new VersionGapException(s.ref().path(), known + 1, r.start());
                log.log(Level.WARNING, gap.getMessage());
                gaps.add(gap);
            }
            if (r.start() <= previousEnd) {
                log.log(Level.WARNING, "Segment {0} overlaps a previous segment ending at {1}; two writers may have minted concurrently",
                        new Object[]{s.ref().path(), String.valueOf(previousEnd)});
            }
            previousEnd = Math.max(previousEnd, r.end());
            known = Math.max(known, r.end());
        }
        return gaps;
    }
}
