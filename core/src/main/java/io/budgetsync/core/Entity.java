// file: core/src/main/java/io/budgetsync/core/Entity.java
package io.budgetsync.core;

import io.budgetsync.core.entity.EntityPayload;

import java.util.Objects;

/**
 * Uniform envelope around one revision of one entity.
 * <p>
 * Fields:
 *  - kind:      which variant the payload is.
 *  - entityId:  stable identifier, never reused.
 *  - version:   stamp of this revision; null while the revision only exists in
 *               memory and has not been committed yet.
 *  - tombstone: logical delete marker. A tombstone stays in the log forever.
 *  - payload:   typed field set. May be null only for tombstones read from writers
 *               that emit bare delete markers.
 * <p>
 * Invariants:
 *  - Immutable. Mutation produces a new revision through the with-methods.
 *  - payload, when present, is an instance of {@code kind.payloadType()}.
 */
public record Entity(
        EntityKind kind,
        String entityId,
        EntityVersion version,
        boolean tombstone,
        EntityPayload payload
) {

    public Entity {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entityId, "entityId");
        if (entityId.isBlank()) throw new IllegalArgumentException("entityId must not be blank");
        if (payload == null && !tombstone)
            throw new IllegalArgumentException("live entity " + entityId + " must carry a payload");
        if (payload != null && !kind.payloadType().isInstance(payload))
            throw new IllegalArgumentException(
                    "payload " + payload.getClass().getSimpleName() + " does not match kind " + kind);
    }

    /** A brand-new, not yet committed, live entity. */
    public static Entity create(String entityId, EntityPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return new Entity(payload.kind(), entityId, null, false, payload);
    }

    public EntityKey key() {
        return new EntityKey(kind, entityId);
    }

    public boolean stamped() {
        return version != null;
    }

    /** Counter of this revision, or -1 when it has not been stamped yet. */
    public long counter() {
        return version == null ? -1 : version.counter();
    }

    public Entity withPayload(EntityPayload newPayload) {
        return new Entity(kind, entityId, version, tombstone, newPayload);
    }

    public Entity withVersion(EntityVersion newVersion) {
        return new Entity(kind, entityId, newVersion, tombstone, payload);
    }

    /** Same fields, marked deleted. */
    public Entity asTombstone() {
        return new Entity(kind, entityId, version, true, payload);
    }

    /** Typed access to the payload. */
    public <P extends EntityPayload> P payload(Class<P> type) {
        if (!type.isInstance(payload))
            throw new IllegalStateException("entity " + key() + " does not carry a " + type.getSimpleName());
        return type.cast(payload);
    }
}
