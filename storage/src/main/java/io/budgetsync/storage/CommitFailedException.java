// file: storage/src/main/java/io/budgetsync/storage/CommitFailedException.java
package io.budgetsync.storage;

/**
 * Writing the segment or the writer metadata failed. Any segment written by the
 * failed attempt has been removed again, and the store's dirty set is untouched.
 */
public final class CommitFailedException extends BudgetStoreException {

    public CommitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
