// file: core/src/main/java/io/budgetsync/core/EntityKey.java
package io.budgetsync.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of an entity inside the store: ids are unique within a kind.
 */
public record EntityKey(EntityKind kind, String entityId) implements Comparable<EntityKey> {

    private static final Comparator<EntityKey> ORDER =
            Comparator.comparing(EntityKey::entityId).thenComparing(EntityKey::kind);

    public EntityKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entityId, "entityId");
    }

    /** Stable order used when assigning counters at commit time: by id, then kind. */
    @Override
    public int compareTo(EntityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.discriminator() + ":" + entityId;
    }
}
