// file: storage/src/main/java/io/budgetsync/storage/MalformedDeltaException.java
package io.budgetsync.storage;

import java.nio.file.Path;

/**
 * A delta segment could not be parsed: bad encoding, bad filename or a record
 * missing required envelope or payload fields.
 * Whether this aborts reconciliation depends on {@link SegmentFailurePolicy}.
 */
public final class MalformedDeltaException extends BudgetStoreException {
    private final Path segment;

    public MalformedDeltaException(Path segment, String message) {
        super("Malformed delta segment " + segment + ": " + message);
        this.segment = segment;
    }

    public MalformedDeltaException(Path segment, String message, Throwable cause) {
        super("Malformed delta segment " + segment + ": " + message, cause);
        this.segment = segment;
    }

    public Path segment() { return segment; }
}
