// file: storage/src/main/java/io/budgetsync/storage/ReconcileReport.java
package io.budgetsync.storage;

import java.util.List;

/**
 * Outcome of folding delta segments onto a snapshot.
 * <p>
 *  - appliedSegments:  segments that were read and folded, in counter order.
 *  - skippedSegments:  corrupt segments skipped under {@link SegmentFailurePolicy#SKIP_AND_WARN}.
 *  - skippedRecords:   records of unknown kinds dropped for forward compatibility.
 *  - versionGaps:      warnings for segments that do not follow the knowledge before them.
 *  - appliedRevisions: revisions that replaced the entity's previous revision.
 *  - staleRevisions:   revisions ignored because the store already held a newer one.
 *  - knowledge:        highest counter present in the store after folding.
 *  - capped:           true if only segments up to a version cap were folded.
 */
public record ReconcileReport(
        List<SegmentRef> appliedSegments,
        List<MalformedDeltaException> skippedSegments,
        List<UnknownEntityTypeException> skippedRecords,
        List<VersionGapException> versionGaps,
        int appliedRevisions,
        int staleRevisions,
        long knowledge,
        boolean capped
) {
    public ReconcileReport {
        appliedSegments = List.copyOf(appliedSegments);
        skippedSegments = List.copyOf(skippedSegments);
        skippedRecords = List.copyOf(skippedRecords);
        versionGaps = List.copyOf(versionGaps);
    }

    /** Report of a store that has not been reconciled against any segment. */
    static ReconcileReport snapshotOnly(long knowledge) {
        return new ReconcileReport(List.of(), List.of(), List.of(), List.of(), 0, 0, knowledge, false);
    }

    /** True if every discovered segment was folded: nothing skipped and no version cap. */
    public boolean complete() {
        return skippedSegments.isEmpty() && !capped;
    }
}
