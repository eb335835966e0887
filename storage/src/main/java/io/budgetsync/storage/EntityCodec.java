// file: storage/src/main/java/io/budgetsync/storage/EntityCodec.java
package io.budgetsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.budgetsync.core.Entity;
import io.budgetsync.core.EntityKind;
import io.budgetsync.core.EntityVersion;
import io.budgetsync.core.entity.EntityPayload;

/**
 * JSON form of one entity revision: envelope fields followed by the kind's fields.
 * <p>
 *   {
 *     "entityType": "transaction",     (delta records only; the snapshot groups by kind)
 *     "entityId": "t1",
 *     "entityVersion": "A-15",
 *     "isTombstone": false,
 *     "accountId": "...", "amount": 20000, ...
 *   }
 * <p>
 * Malformed input is reported as {@link IllegalArgumentException}; callers wrap it into
 * the snapshot or delta exception with the file it came from.
 */
final class EntityCodec {

    static final String ENTITY_TYPE = "entityType";
    static final String ENTITY_ID = "entityId";
    static final String ENTITY_VERSION = "entityVersion";
    static final String IS_TOMBSTONE = "isTombstone";

    private EntityCodec() {
        // utility
    }

    /**
     * Decode a delta mutation record. The full envelope is required.
     *
     * @throws UnknownEntityTypeException if "entityType" names a kind we do not know
     * @throws IllegalArgumentException   if the record is malformed
     */
    static Entity decodeMutation(JsonNode item, String source) {
        if (item == null || !item.isObject()) throw new IllegalArgumentException("mutation record is not an object");
        String type = requireText(item, ENTITY_TYPE);
        String id = requireText(item, ENTITY_ID);
        if (!item.hasNonNull(IS_TOMBSTONE)) {
            throw new IllegalArgumentException("record " + id + " is missing '" + IS_TOMBSTONE + "'");
        }
        EntityKind kind = EntityKind.fromDiscriminator(type)
                .orElseThrow(() -> new UnknownEntityTypeException(type, id, source));
        return decode(kind, item);
    }

    /** Decode a record whose kind is already known (snapshot sections). */
    static Entity decode(EntityKind kind, JsonNode node) {
        if (node == null || !node.isObject()) throw new IllegalArgumentException(kind.snapshotKey() + " entry is not an object");
        String id = requireText(node, ENTITY_ID);
        EntityVersion version = parseVersion(id, requireText(node, ENTITY_VERSION));
        boolean tombstone = readTombstone(id, node);
        EntityPayload payload = bindPayload(kind, id, node, tombstone);
        return new Entity(kind, id, version, tombstone, payload);
    }

    static ObjectNode encode(Entity entity) {
        ObjectNode node = JsonSupport.mapper().createObjectNode();
        node.put(ENTITY_TYPE, entity.kind().discriminator());
        node.put(ENTITY_ID, entity.entityId());
        if (entity.version() != null) node.put(ENTITY_VERSION, entity.version().toString());
        node.put(IS_TOMBSTONE, entity.tombstone());
        if (entity.payload() != null) {
            ObjectNode fields = JsonSupport.mapper().valueToTree(entity.payload());
            node.setAll(fields);
        }
        return node;
    }

    // ----------------- helpers -----------------

    private static EntityPayload bindPayload(EntityKind kind, String id, JsonNode node, boolean tombstone) {
        boolean complete = kind.requiredFields().stream().allMatch(node::hasNonNull);
        if (!complete) {
            // Bare delete markers carry only the envelope.
            if (tombstone) return null;
            String missing = kind.requiredFields().stream()
                    .filter(f -> !node.hasNonNull(f))
                    .findFirst()
                    .orElseThrow();
            throw new IllegalArgumentException(
                    kind.discriminator() + " " + id + " is missing required field '" + missing + "'");
        }
        try {
            return JsonSupport.mapper().treeToValue(node, kind.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "cannot bind " + kind.discriminator() + " " + id + ": " + e.getMessage(), e);
        }
    }

    private static boolean readTombstone(String id, JsonNode node) {
        JsonNode t = node.get(IS_TOMBSTONE);
        if (t == null || t.isNull()) return false;
        if (!t.isBoolean()) throw new IllegalArgumentException("record " + id + " has a non-boolean '" + IS_TOMBSTONE + "'");
        return t.booleanValue();
    }

    private static EntityVersion parseVersion(String id, String text) {
        try {
            return EntityVersion.parse(text);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("record " + id + ": " + e.getMessage(), e);
        }
    }

    static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isTextual() || v.textValue().isBlank()) {
            throw new IllegalArgumentException("missing required field '" + field + "'");
        }
        return v.textValue();
    }
}
