// file: storage/src/main/java/io/budgetsync/storage/VersionGapException.java
package io.budgetsync.storage;

import java.nio.file.Path;

/**
 * A segment's start counter does not immediately follow the knowledge accumulated
 * before it. Recorded as a warning in {@link ReconcileReport}; never thrown out of
 * reconciliation, since segments may legitimately be discovered out of temporal order.
 */
public final class VersionGapException extends BudgetStoreException {
    private final Path segment;
    private final long expectedStart;
    private final long actualStart;

    public VersionGapException(Path segment, long expectedStart, long actualStart) {
        super("Counter gap before " + segment + ": expected start " + expectedStart + ", found " + actualStart);
        this.segment = segment;
        this.expectedStart = expectedStart;
        this.actualStart = actualStart;
    }

    public Path segment() { return segment; }

    public long expectedStart() { return expectedStart; }

    public long actualStart() { return actualStart; }
}
