// file: core/src/main/java/io/budgetsync/core/entity/ClearedState.java
package io.budgetsync.core.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClearedState {
    UNCLEARED("Uncleared"),
    CLEARED("Cleared"),
    RECONCILED("Reconciled");

    private final String label;

    ClearedState(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    /** Cleared and reconciled transactions count toward the cleared balance. */
    public boolean settled() { return this != UNCLEARED; }

    @JsonCreator
    public static ClearedState fromLabel(String label) {
        for (ClearedState s : values()) {
            if (s.label.equalsIgnoreCase(label) || s.name().equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown cleared state: " + label);
    }
}
