// file: core/src/main/java/io/budgetsync/core/entity/MonthlyBudget.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/**
 * One budget per calendar month.
 * {@code month} is an ISO date, conventionally the first of the month ("2025-08-01").
 */
public record MonthlyBudget(String month) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.MONTHLY_BUDGET; }
}
