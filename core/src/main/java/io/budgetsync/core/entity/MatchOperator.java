// file: core/src/main/java/io/budgetsync/core/entity/MatchOperator.java
package io.budgetsync.core.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a renaming rule compares its operand against a raw payee string.
 * Comparison is case-insensitive.
 */
public enum MatchOperator {
    IS("Is"),
    CONTAINS("Contains"),
    STARTS_WITH("StartsWith"),
    ENDS_WITH("EndsWith");

    private final String label;

    MatchOperator(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    @JsonCreator
    public static MatchOperator fromLabel(String label) {
        for (MatchOperator op : values()) {
            if (op.label.equalsIgnoreCase(label) || op.name().equalsIgnoreCase(label)) return op;
        }
        throw new IllegalArgumentException("Unknown match operator: " + label);
    }

    boolean test(String raw, String operand) {
        String r = raw.toLowerCase(Locale.ROOT);
        String o = operand.toLowerCase(Locale.ROOT);
        return switch (this) {
            case IS -> r.equals(o);
            case CONTAINS -> r.contains(o);
            case STARTS_WITH -> r.startsWith(o);
            case ENDS_WITH -> r.endsWith(o);
        };
    }
}
