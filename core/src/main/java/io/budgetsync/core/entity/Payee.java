// file: core/src/main/java/io/budgetsync/core/entity/Payee.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

public record Payee(
        String name,
        boolean enabled,
        String autoFillCategoryId
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.PAYEE; }

    public Payee withName(String newName) {
        return new Payee(newName, enabled, autoFillCategoryId);
    }
}
