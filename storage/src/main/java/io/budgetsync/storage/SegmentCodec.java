// file: storage/src/main/java/io/budgetsync/storage/SegmentCodec.java
package io.budgetsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.budgetsync.core.Entity;
import io.budgetsync.core.WriterRecord;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON framing for delta segments.
 * <p>
 * Document layout:
 * <pre>
 *   {
 *     "formatVersion": "1.0",
 *     "deviceGuid":    "...",
 *     "shortDeviceId": "B",
 *     "startVersion":  16,
 *     "endVersion":    16,
 *     "publishTime":   "2026-10-19T08:00:00Z",
 *     "items": [ { envelope + fields }, ... ]
 *   }
 * </pre>
 * The filename is the authority for the counter range. Header bounds that disagree
 * with it are logged and otherwise ignored.
 */
final class SegmentCodec {
    private static final Logger log = Logger.getLogger(SegmentCodec.class.getName());

    static final String ITEMS = "items";

    private SegmentCodec() {
        // utility
    }

    /** Encode a segment authored by {@code writer} covering {@code range}. */
    static byte[] encode(WriterRecord writer, CounterRange range, Instant publishTime,
                         String formatVersion, List<Entity> revisions) {
        ObjectNode doc = JsonSupport.mapper().createObjectNode();
        doc.put("formatVersion", formatVersion);
        doc.put("deviceGuid", writer.writerGuid());
        doc.put("shortDeviceId", writer.writerTag());
        doc.put("startVersion", range.start());
        doc.put("endVersion", range.end());
        doc.put("publishTime", publishTime.toString());
        ArrayNode items = doc.putArray(ITEMS);
        for (Entity e : revisions) items.add(EntityCodec.encode(e));
        try {
            return JsonSupport.mapper().writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode segment " + range, e);
        }
    }

    /**
     * Decode a segment file.
     *
     * @throws MalformedDeltaException on bad encoding or a record with a broken envelope.
     *         Records of unknown kinds do not fail the segment; they end up in
     *         {@link DeltaSegment#skipped()}.
     */
    static DeltaSegment decode(SegmentRef ref, byte[] bytes) {
        JsonNode doc;
        try {
            doc = JsonSupport.mapper().readTree(bytes);
        } catch (IOException e) {
            throw new MalformedDeltaException(ref.path(), "unreadable JSON", e);
        }
        if (doc == null || !doc.isObject()) throw new MalformedDeltaException(ref.path(), "document is not an object");

        JsonNode items = doc.get(ITEMS);
        if (items == null || !items.isArray()) throw new MalformedDeltaException(ref.path(), "missing '" + ITEMS + "' list");

        checkHeaderBounds(ref, doc);

        String source = ref.path().getFileName().toString();
        List<Entity> revisions = new ArrayList<>(items.size());
        List<UnknownEntityTypeException> skipped = new ArrayList<>();
        for (JsonNode item : items) {
            Entity rev;
            try {
                rev = EntityCodec.decodeMutation(item, source);
            } catch (UnknownEntityTypeException e) {
                log.log(Level.WARNING, e.getMessage() + "; record skipped");
                skipped.add(e);
                continue;
            } catch (IllegalArgumentException e) {
                throw new MalformedDeltaException(ref.path(), e.getMessage(), e);
            }
            if (!ref.range().contains(rev.counter())) {
                log.log(Level.WARNING, "Revision {0} of {1} lies outside declared range {2} of {3}",
                        new Object[]{rev.version(), rev.key(), ref.range(), source});
            }
            revisions.add(rev);
        }

        return new DeltaSegment(
                ref,
                doc.path("deviceGuid").asText(null),
                doc.path("shortDeviceId").asText(null),
                doc.path("formatVersion").asText(null),
                doc.path("publishTime").asText(null),
                revisions,
                skipped
        );
    }

    /**
     * Tag of the writer that authored a segment, read from its header.
     * Empty if the bytes are not a readable segment document.
     */
    static Optional<String> readWriterTag(byte[] bytes) {
        try {
            JsonNode tag = JsonSupport.mapper().readTree(bytes).path("shortDeviceId");
            return tag.isTextual() && !tag.textValue().isBlank() ? Optional.of(tag.textValue()) : Optional.empty();
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private static void checkHeaderBounds(SegmentRef ref, JsonNode doc) {
        JsonNode start = doc.get("startVersion");
        JsonNode end = doc.get("endVersion");
        if (start == null || end == null || !start.canConvertToLong() || !end.canConvertToLong()) return;
        if (start.asLong() != ref.range().start() || end.asLong() != ref.range().end()) {
            log.log(Level.WARNING, "Segment {0} declares {1}..{2} in its header; using the filename range",
                    new Object[]{ref.path(), String.valueOf(start.asLong()), String.valueOf(end.asLong())});
        }
    }
}
