// file: core/src/main/java/io/budgetsync/core/entity/Transaction.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

import java.util.List;

/**
 * A ledger transaction.
 * <p>
 * Fields:
 *  - amount:  integer minor currency units; negative for outflows.
 *  - date:    ISO date ("2025-08-14").
 *  - payeeId, categoryId: nullable for unassigned / uncategorized.
 *  - subTransactions: splits; empty for a plain transaction. Never null.
 */
public record Transaction(
        String accountId,
        String payeeId,
        String categoryId,
        long amount,
        String date,
        ClearedState cleared,
        boolean accepted,
        String memo,
        List<SubTransaction> subTransactions
) implements EntityPayload {

    public Transaction {
        cleared = cleared == null ? ClearedState.UNCLEARED : cleared;
        subTransactions = subTransactions == null ? List.of() : List.copyOf(subTransactions);
    }

    @Override
    public EntityKind kind() { return EntityKind.TRANSACTION; }

    public boolean hasSplits() {
        return !subTransactions.isEmpty();
    }

    public Transaction withMemo(String newMemo) {
        return new Transaction(accountId, payeeId, categoryId, amount, date, cleared, accepted, newMemo, subTransactions);
    }

    public Transaction withAmount(long newAmount) {
        return new Transaction(accountId, payeeId, categoryId, newAmount, date, cleared, accepted, memo, subTransactions);
    }
}
