// file: core/src/main/java/io/budgetsync/core/entity/MonthlyCategoryBudget.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/**
 * Budgeted amount for one category in one month.
 * {@code budgeted} is in integer minor currency units.
 */
public record MonthlyCategoryBudget(
        String parentMonthlyBudgetId,
        String categoryId,
        long budgeted,
        String overspendingHandling,
        String note
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.MONTHLY_CATEGORY_BUDGET; }
}
