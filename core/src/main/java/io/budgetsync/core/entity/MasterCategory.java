// file: core/src/main/java/io/budgetsync/core/entity/MasterCategory.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/** Top level of the two-level category hierarchy. */
public record MasterCategory(
        String name,
        String type,
        int sortableIndex,
        boolean expanded,
        boolean deleteable
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.MASTER_CATEGORY; }
}
