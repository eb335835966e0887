// file: core/src/main/java/io/budgetsync/core/entity/PayeeRenamingRule.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/**
 * Maps a raw payee string (as imported from a bank) to a standardized payee.
 * A missing operator means {@link MatchOperator#IS}.
 */
public record PayeeRenamingRule(
        String targetPayeeId,
        MatchOperator operator,
        String operand
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.PAYEE_RENAMING_RULE; }

    /** True if {@code rawPayee} is renamed by this rule. */
    public boolean matches(String rawPayee) {
        if (rawPayee == null || operand == null) return false;
        MatchOperator op = operator == null ? MatchOperator.IS : operator;
        return op.test(rawPayee.trim(), operand.trim());
    }
}
