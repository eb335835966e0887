// file: core/src/main/java/io/budgetsync/core/entity/EntityPayload.java
package io.budgetsync.core.entity;

import io.budgetsync.core.EntityKind;

/**
 * Typed field set of one entity kind.
 * <p>
 * One record per kind, see {@link EntityKind#payloadType()}. Records are bound from and written to
 * JSON by field name, so component names are the camelCase names used on disk.
 */
public interface EntityPayload {

    EntityKind kind();
}
