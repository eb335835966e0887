// file: core/src/main/java/io/budgetsync/core/entity/ScheduledTransaction.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/** Recurring transaction template, e.g. frequency "Monthly". */
public record ScheduledTransaction(
        String frequency,
        long amount,
        String date,
        String accountId,
        String payeeId,
        String categoryId,
        String memo
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.SCHEDULED_TRANSACTION; }
}
