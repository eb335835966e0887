// file: core/src/main/java/io/budgetsync/core/WriterRecord.java
package io.budgetsync.core;

import java.util.Objects;

/**
 * Metadata of one writer (device) allowed to append delta segments.
 * <p>
 * Fields:
 *  - writerGuid:       directory name and identity of the writer.
 *  - writerTag:        short stable tag stamped into entity versions ("A", "B", ...).
 *  - friendlyName:     human-readable label, informational only.
 *  - knowledge:        highest counter this writer has incorporated.
 *  - hasFullKnowledge: true once the writer merged every segment it knows about.
 *  - formatVersion:    metadata format version string.
 */
public record WriterRecord(
        String writerGuid,
        String writerTag,
        String friendlyName,
        long knowledge,
        boolean hasFullKnowledge,
        String formatVersion
) {

    public WriterRecord {
        Objects.requireNonNull(writerGuid, "writerGuid");
        Objects.requireNonNull(writerTag, "writerTag");
        if (writerGuid.isBlank()) throw new IllegalArgumentException("writerGuid must not be blank");
        if (writerTag.isBlank()) throw new IllegalArgumentException("writerTag must not be blank");
        if (knowledge < 0) throw new IllegalArgumentException("knowledge must be >= 0");
    }

    public WriterRecord withKnowledge(long newKnowledge, boolean fullKnowledge) {
        return new WriterRecord(writerGuid, writerTag, friendlyName, newKnowledge, fullKnowledge, formatVersion);
    }

    /** Version stamp this writer puts on a revision minted at {@code counter}. */
    public EntityVersion stamp(long counter) {
        return new EntityVersion(writerTag, counter);
    }
}
