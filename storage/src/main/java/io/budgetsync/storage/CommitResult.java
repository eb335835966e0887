// file: storage/src/main/java/io/budgetsync/storage/CommitResult.java
package io.budgetsync.storage;

import java.nio.file.Path;

/**
 * Outcome of a commit. {@code range} and {@code segment} are null when the store
 * had no changes and nothing was written.
 */
public record CommitResult(String writerGuid, CounterRange range, Path segment, int revisionCount) {

    static CommitResult nothingToCommit(String writerGuid) {
        return new CommitResult(writerGuid, null, null, 0);
    }

    public boolean written() {
        return range != null;
    }
}
