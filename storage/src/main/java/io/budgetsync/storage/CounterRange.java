// file: storage/src/main/java/io/budgetsync/storage/CounterRange.java
package io.budgetsync.storage;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inclusive range of counters covered by one delta segment.
 * The segment's filename is the range in decimal: "16_18.delta".
 */
public record CounterRange(long start, long end) {

    private static final Pattern FILE_NAME = Pattern.compile("^(\\d+)_(\\d+)\\.delta$");

    public CounterRange {
        if (start < 1) throw new IllegalArgumentException("start must be >= 1, got " + start);
        if (end < start) throw new IllegalArgumentException("end " + end + " < start " + start);
    }

    /** Range of {@code count} counters starting right after {@code knowledge}. */
    public static CounterRange after(long knowledge, int count) {
        if (count <= 0) throw new IllegalArgumentException("count must be > 0, got " + count);
        long start = knowledge + 1;
        return new CounterRange(start, start + count - 1);
    }

    /**
     * Parse "START_END.delta". Empty if the name does not have that shape or the
     * bounds are out of order.
     */
    public static Optional<CounterRange> parseFileName(String fileName) {
        Matcher m = FILE_NAME.matcher(fileName);
        if (!m.matches()) return Optional.empty();
        try {
            long s = Long.parseLong(m.group(1));
            long e = Long.parseLong(m.group(2));
            if (s < 1 || e < s) return Optional.empty();
            return Optional.of(new CounterRange(s, e));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public int size() {
        return Math.toIntExact(end - start + 1);
    }

    public boolean contains(long counter) {
        return counter >= start && counter <= end;
    }

    public String fileName() {
        return start + "_" + end + BudgetLayout.DELTA_SUFFIX;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + "]";
    }
}
