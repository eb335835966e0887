// file: storage/src/main/java/io/budgetsync/storage/EntityStore.java
package io.budgetsync.storage;

import io.budgetsync.core.Entity;
import io.budgetsync.core.EntityKey;
import io.budgetsync.core.EntityKind;
import io.budgetsync.core.entity.EntityPayload;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * The only holder of "current" state for one budget.
 * <p>
 * Responsibilities:
 *  - Keep an owned table: key -> latest revision (tombstones included).
 *  - Expose the current view, which hides tombstones.
 *  - Route every caller mutation through one entry point that updates the table
 *    and records the key in the dirty set.
 * <p>
 * Notes:
 *  - Mutations never stamp versions; the delta writer does that at commit time.
 *  - Entities are never removed. Deleting sets the tombstone flag through the same
 *    mutation path, so dirty tracking is uniform.
 *  - Only a successful commit clears the dirty set.
 *  - Not thread safe: one logical writer per session.
 */
public final class EntityStore {
    private final Path root;
    private final Map<EntityKey, Entity> entities = new HashMap<>();
    private final Set<EntityKey> dirty = new TreeSet<>();
    private ReconcileReport report = ReconcileReport.snapshotOnly(0);

    public EntityStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /** Budget root this state was loaded from and commits back to. */
    public Path root() {
        return root;
    }

    // ----------------- read side -----------------

    /** Live entity, or empty if unknown or tombstoned. */
    public Optional<Entity> get(EntityKind kind, String entityId) {
        Entity e = entities.get(new EntityKey(kind, entityId));
        return e == null || e.tombstone() ? Optional.empty() : Optional.of(e);
    }

    /** Latest revision including tombstones. */
    public Optional<Entity> revision(EntityKind kind, String entityId) {
        return Optional.ofNullable(entities.get(new EntityKey(kind, entityId)));
    }

    /** Live entities of one kind, ordered by id. */
    public List<Entity> all(EntityKind kind) {
        List<Entity> out = new ArrayList<>();
        for (Entity e : entities.values()) {
            if (e.kind() == kind && !e.tombstone()) out.add(e);
        }
        out.sort((a, b) -> a.entityId().compareTo(b.entityId()));
        return out;
    }

    /** Number of live entities across all kinds. */
    public int size() {
        return (int) entities.values().stream().filter(e -> !e.tombstone()).count();
    }

    /** Every revision held, tombstones included. */
    public Map<EntityKey, Entity> revisions() {
        return Collections.unmodifiableMap(entities);
    }

    /** Highest stamped counter held, 0 for an empty store. */
    public long highestCounter() {
        long max = 0;
        for (Entity e : entities.values()) max = Math.max(max, e.counter());
        return max;
    }

    public ReconcileReport report() {
        return report;
    }

    // ----------------- mutation side -----------------

    /**
     * Create an entity, or replace the full field set of a live one.
     *
     * @throws IllegalStateException if the id belongs to a deleted entity; ids are never reused
     */
    public Entity put(String entityId, EntityPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return mutate(new EntityKey(payload.kind(), entityId), current -> {
            if (current == null) return Entity.create(entityId, payload);
            if (current.tombstone())
                throw new IllegalStateException(payload.kind().discriminator() + " " + entityId + " was deleted and cannot be reused");
            return current.withPayload(payload);
        });
    }

    /**
     * Apply {@code change} to the fields of a live entity.
     *
     * @throws NoSuchElementException if the entity is unknown or tombstoned
     */
    public <P extends EntityPayload> Entity update(EntityKind kind, String entityId, Class<P> type, UnaryOperator<P> change) {
        Objects.requireNonNull(change, "change");
        return mutate(new EntityKey(kind, entityId), current -> {
            if (current == null || current.tombstone())
                throw new NoSuchElementException("no live " + kind.discriminator() + " " + entityId);
            return current.withPayload(change.apply(current.payload(type)));
        });
    }

    /**
     * Logically delete a live entity. Deleting an already deleted entity is a no-op.
     *
     * @throws NoSuchElementException if the entity is unknown
     */
    public Entity delete(EntityKind kind, String entityId) {
        EntityKey key = new EntityKey(kind, entityId);
        Entity current = entities.get(key);
        if (current == null) throw new NoSuchElementException("no " + kind.discriminator() + " " + entityId);
        if (current.tombstone()) return current;
        return mutate(key, Entity::asTombstone);
    }

    /** Keys changed since load or since the last successful commit, in commit order. */
    public Set<EntityKey> dirtyKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(dirty));
    }

    public boolean hasChanges() {
        return !dirty.isEmpty();
    }

    private Entity mutate(EntityKey key, UnaryOperator<Entity> change) {
        Entity next = change.apply(entities.get(key));
        entities.put(key, next);
        dirty.add(key);
        return next;
    }

    // ----------------- engine side -----------------

    /** Current revisions of every dirty key, ordered by key. */
    List<Entity> dirtyEntities() {
        List<Entity> out = new ArrayList<>(dirty.size());
        for (EntityKey k : dirty) out.add(entities.get(k));
        return out;
    }

    /** Install a revision read from the log. Does not touch the dirty set. */
    void replace(Entity revision) {
        entities.put(revision.key(), revision);
    }

    /** Install freshly stamped revisions and forget that they were dirty. */
    void markCommitted(List<Entity> stamped) {
        for (Entity e : stamped) {
            entities.put(e.key(), e);
            dirty.remove(e.key());
        }
    }

    void attachReport(ReconcileReport newReport) {
        this.report = Objects.requireNonNull(newReport, "report");
    }
}
