// file: storage/src/main/java/io/budgetsync/storage/SegmentRef.java
package io.budgetsync.storage;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/** A discovered delta segment: who wrote it, which counters it declares, where it lives. */
public record SegmentRef(String writerGuid, CounterRange range, Path path) {

    /** Deterministic order independent of directory listing: by start, end, then writer. */
    public static final Comparator<SegmentRef> BY_RANGE =
            Comparator.<SegmentRef>comparingLong(s -> s.range().start())
                    .thenComparingLong(s -> s.range().end())
                    .thenComparing(SegmentRef::writerGuid);

    public SegmentRef {
        Objects.requireNonNull(writerGuid, "writerGuid");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(path, "path");
    }
}
