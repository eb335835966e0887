// file: core/src/main/java/io/budgetsync/core/entity/SubCategory.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/** Budget category living under a {@link MasterCategory}. */
public record SubCategory(
        String name,
        String type,
        String masterCategoryId,
        int sortableIndex,
        String note
) implements EntityPayload {

    @Override
    public EntityKind kind() { return EntityKind.SUB_CATEGORY; }
}
