// file: storage/src/main/java/io/budgetsync/storage/SnapshotLoader.java
package io.budgetsync.storage;

/**
 * Reads the full snapshot into a fresh store.
 * <p>
 * The returned store holds no dirty keys and has not been reconciled yet.
 */
public interface SnapshotLoader {

    /**
     * @throws MalformedSnapshotException if the snapshot is missing, unreadable or
     *         contains a record that cannot be decoded
     */
    EntityStore load(BudgetLayout layout);
}
