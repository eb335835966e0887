// file: storage/src/main/java/io/budgetsync/storage/WriteConflictException.java
package io.budgetsync.storage;

/** A counter range cannot be minted safely. The commit is aborted before anything is written. */
public final class WriteConflictException extends BudgetStoreException {

    public WriteConflictException(String message) {
        super(message);
    }

    public WriteConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
