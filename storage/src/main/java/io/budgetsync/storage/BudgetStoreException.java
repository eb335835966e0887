// file: storage/src/main/java/io/budgetsync/storage/BudgetStoreException.java
package io.budgetsync.storage;

/**
 * Base of every typed failure the engine reports.
 * Unchecked: callers decide where to handle, the engine never guesses around data loss.
 */
public abstract class BudgetStoreException extends RuntimeException {

    protected BudgetStoreException(String message) {
        super(message);
    }

    protected BudgetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
