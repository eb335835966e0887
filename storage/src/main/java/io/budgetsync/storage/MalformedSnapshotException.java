// file: storage/src/main/java/io/budgetsync/storage/MalformedSnapshotException.java
package io.budgetsync.storage;

import java.nio.file.Path;

/** The full snapshot is missing, unreadable or lacks required fields. Fatal for a load. */
public final class MalformedSnapshotException extends BudgetStoreException {
    private final Path snapshot;

    public MalformedSnapshotException(Path snapshot, String message) {
        super("Malformed snapshot " + snapshot + ": " + message);
        this.snapshot = snapshot;
    }

    public MalformedSnapshotException(Path snapshot, String message, Throwable cause) {
        super("Malformed snapshot " + snapshot + ": " + message, cause);
        this.snapshot = snapshot;
    }

    public Path snapshot() { return snapshot; }
}
