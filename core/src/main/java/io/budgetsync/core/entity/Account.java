// file: core/src/main/java/io/budgetsync/core/entity/Account.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

public record Account(
        String accountName,
        String accountType,
        boolean onBudget,
        int sortableIndex,
        boolean hidden,
        String note
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.ACCOUNT; }
}
