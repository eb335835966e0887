// file: core/src/main/java/io/budgetsync/core/EntityVersion.java
package io.budgetsync.core;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable version stamp carried by every entity revision.
 * <p>
 * Fields:
 *  - writerTag: short tag of the writer that authored the revision ("A", "B", ...).
 *  - counter:   globally comparable counter minted by the knowledge tracker.
 * <p>
 * Ordering:
 *  - Revisions are ordered by counter alone. Minting guarantees that a fresh
 *    counter is above every counter any writer has observed, so comparing
 *    counters is enough for last-writer-wins.
 *  - The writer tag only breaks ties, which a correctly minted log never contains.
 *    It keeps the order total and deterministic if two writers ever violate exclusivity.
 * <p>
 * Textual form is "tag-counter", e.g. "A-86". This is the form stored on disk.
 */
public record EntityVersion(String writerTag, long counter) implements Comparable<EntityVersion> {

    private static final Pattern TAG = Pattern.compile("^[A-Z]+$");
    private static final Pattern TEXT = Pattern.compile("^([A-Z]+)-(\\d+)$");

    public EntityVersion {
        Objects.requireNonNull(writerTag, "writerTag");
        if (!TAG.matcher(writerTag).matches())
            throw new IllegalArgumentException("writerTag must be upper-case letters, got: " + writerTag);
        if (counter < 0) throw new IllegalArgumentException("counter must be >= 0, got: " + counter);
    }

    /**
     * Parse the on-disk form "A-86".
     *
     * @throws IllegalArgumentException if the text does not match "TAG-COUNTER"
     */
    public static EntityVersion parse(String text) {
        if (text == null) throw new IllegalArgumentException("version text must not be null");
        Matcher m = TEXT.matcher(text.trim());
        if (!m.matches()) throw new IllegalArgumentException("Invalid version format: " + text);
        try {
            return new EntityVersion(m.group(1), Long.parseLong(m.group(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version counter out of range: " + text, e);
        }
    }

    /** True if this revision must replace {@code other} under last-writer-wins. */
    public boolean isNewerThan(EntityVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(EntityVersion other) {
        int byCounter = Long.compare(counter, other.counter);
        return byCounter != 0 ? byCounter : writerTag.compareTo(other.writerTag);
    }

    @Override
    public String toString() {
        return writerTag + "-" + counter;
    }
}
