// file: storage/src/main/java/io/budgetsync/storage/DeltaSegment.java
package io.budgetsync.storage;

import io.budgetsync.core.Entity;

import java.util.List;
import java.util.Objects;

/**
 * Parsed content of one delta segment.
 * <p>
 *  - revisions: decoded mutation records, in file order.
 *  - skipped:   records of unknown kinds that were dropped while decoding.
 */
public record DeltaSegment(
        SegmentRef ref,
        String deviceGuid,
        String shortDeviceId,
        String formatVersion,
        String publishTime,
        List<Entity> revisions,
        List<UnknownEntityTypeException> skipped
) {
    public DeltaSegment {
        Objects.requireNonNull(ref, "ref");
        revisions = List.copyOf(revisions);
        skipped = List.copyOf(skipped);
    }
}
