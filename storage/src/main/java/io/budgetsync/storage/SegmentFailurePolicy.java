// file: storage/src/main/java/io/budgetsync/storage/SegmentFailurePolicy.java
package io.budgetsync.storage;

/**
 * What reconciliation does with a delta segment that fails to parse.
 * <p>
 *  - SKIP_AND_WARN: log, record it in the report, keep folding the other segments.
 *  - ABORT:         rethrow the {@link MalformedDeltaException}; nothing is returned.
 */
public enum SegmentFailurePolicy {
    SKIP_AND_WARN,
    ABORT
}
