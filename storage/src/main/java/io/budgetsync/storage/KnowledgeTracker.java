// file: storage/src/main/java/io/budgetsync/storage/KnowledgeTracker.java
package io.budgetsync.storage;

import io.budgetsync.core.WriterRecord;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks what every writer knows and hands out fresh counter ranges.
 * <p>
 * Responsibilities:
 *  - Read every writer's metadata record; corrupt ones are skipped with a warning.
 *  - Compute global knowledge: the max of all recorded knowledge and all segment end counters.
 *  - Mint ranges strictly above global knowledge, so any later revision sorts above
 *    anything already written.
 *  - Register new writers with a unique GUID and the next free tag.
 * <p>
 * Minting assumes the caller holds exclusive write access to the budget for the
 * duration of a commit. Without it two writers can mint overlapping ranges.
 */
public final class KnowledgeTracker {
    private static final Logger log = Logger.getLogger(KnowledgeTracker.class.getName());

    private final BudgetFileSystem fs;
    private final BudgetLayout layout;
    private final EngineConfig config;
    private final SegmentDiscovery discovery;

    public KnowledgeTracker(BudgetFileSystem fs, BudgetLayout layout, EngineConfig config) {
        this.fs = fs;
        this.layout = layout;
        this.config = config;
        this.discovery = new SegmentDiscovery(fs);
    }

    /** Writers read from disk plus the metadata files that could not be used. */
    public record WriterScan(List<WriterRecord> writers, List<DeviceMetadataCorruptException> corrupt) {
        public WriterScan {
            writers = List.copyOf(writers);
            corrupt = List.copyOf(corrupt);
        }
    }

    /**
     * Highest counter that any writer has recorded or any segment covers.
     * Orphan segments (written by a writer whose metadata update was lost) count too.
     */
    public static long globalKnowledge(Collection<WriterRecord> writers, Collection<SegmentRef> segments) {
        long max = 0;
        for (WriterRecord w : writers) max = Math.max(max, w.knowledge());
        for (SegmentRef s : segments) max = Math.max(max, s.range().end());
        return max;
    }

    /** Global knowledge as found on disk. 0 for a budget nobody has written to yet. */
    public long globalKnowledge() {
        return globalKnowledge(readWriters(), discovery.discover(layout).segments());
    }

    public List<WriterRecord> readWriters() {
        return scanWriters().writers();
    }

    public WriterScan scanWriters() {
        List<WriterRecord> writers = new ArrayList<>();
        List<DeviceMetadataCorruptException> corrupt = new ArrayList<>();
        for (Path dir : fs.list(layout.devicesDir())) {
            if (!fs.isDirectory(dir)) continue;
            String guid = dir.getFileName().toString();
            try {
                Optional<WriterRecord> w = findWriter(guid);
                if (w.isPresent()) {
                    writers.add(w.get());
                } else {
                    corrupt.add(new DeviceMetadataCorruptException(layout.metadataFile(guid), "metadata file missing", null));
                    log.log(Level.WARNING, "Writer directory {0} has no metadata; skipped", dir);
                }
            } catch (DeviceMetadataCorruptException e) {
                log.log(Level.WARNING, e.getMessage() + "; writer skipped", e);
                corrupt.add(e);
            }
        }
        writers.sort(Comparator.comparing(WriterRecord::writerTag).thenComparing(WriterRecord::writerGuid));
        return new WriterScan(writers, corrupt);
    }

    /**
     * Metadata of one writer, or empty if it has no metadata file.
     *
     * @throws DeviceMetadataCorruptException if the file exists but cannot be used
     */
    public Optional<WriterRecord> findWriter(String writerGuid) {
        Path meta = layout.metadataFile(writerGuid);
        if (!fs.exists(meta)) return Optional.empty();
        byte[] bytes;
        try {
            bytes = fs.read(meta);
        } catch (UncheckedIOException e) {
            throw new DeviceMetadataCorruptException(meta, "unreadable", e);
        }
        WriterRecord w = WriterMetadataCodec.decode(meta, bytes);
        if (!w.writerGuid().equalsIgnoreCase(writerGuid)) {
            log.log(Level.WARNING, "Metadata {0} names writer {1}", new Object[]{meta, w.writerGuid()});
        }
        return Optional.of(w);
    }

    /** Writer with the highest recorded knowledge; ties go to the lowest tag. */
    public Optional<WriterRecord> mostKnowledgeableWriter() {
        return readWriters().stream()
                .max(Comparator.comparingLong(WriterRecord::knowledge)
                        .thenComparing(WriterRecord::writerTag, Comparator.reverseOrder()));
    }

    public WriterRecord registerWriter() {
        return registerWriter(config.defaultFriendlyName());
    }

    /**
     * Create a writer directory and metadata record with knowledge 0.
     *
     * @throws IllegalStateException if every tag is already taken
     */
    public WriterRecord registerWriter(String friendlyName) {
        WriterScan scan = scanWriters();
        Set<String> used = new HashSet<>();
        Set<String> readable = new HashSet<>();
        for (WriterRecord w : scan.writers()) {
            used.add(w.writerTag());
            readable.add(w.writerGuid());
        }

        // Writers without usable metadata keep their tag: recover it from their segments.
        Set<String> recovered = new HashSet<>();
        for (SegmentRef s : discovery.discover(layout).segments()) {
            if (readable.contains(s.writerGuid())) continue;
            Optional<String> tag = segmentTag(s);
            if (tag.isPresent()) {
                used.add(tag.get());
                recovered.add(s.writerGuid());
            }
        }
        int unknownOccupants = 0;
        for (DeviceMetadataCorruptException e : scan.corrupt()) {
            String guid = e.metadata().getParent().getFileName().toString();
            if (!recovered.contains(guid)) unknownOccupants++;
        }
        if (!scan.corrupt().isEmpty()) {
            log.log(Level.WARNING, "{0} writer(s) have unreadable metadata; {1} tag(s) recovered from their segments",
                    new Object[]{scan.corrupt().size(), recovered.size()});
        }
        String tag = nextFreeTag(used, unknownOccupants);

        String guid;
        do {
            guid = UUID.randomUUID().toString().toUpperCase(Locale.ROOT);
        } while (fs.exists(layout.writerDir(guid)));

        WriterRecord writer = new WriterRecord(guid, tag, friendlyName, 0, false, config.formatVersion());
        fs.createDirectories(layout.writerDir(guid));
        fs.writeAtomically(layout.metadataFile(guid), WriterMetadataCodec.encode(writer));
        log.log(Level.INFO, "Registered writer {0} ({1}) as tag {2}", new Object[]{guid, friendlyName, tag});
        return writer;
    }

    private Optional<String> segmentTag(SegmentRef segment) {
        try {
            return SegmentCodec.readWriterTag(fs.read(segment.path()));
        } catch (UncheckedIOException e) {
            log.log(Level.FINE, "Cannot read writer tag from " + segment.path(), e);
            return Optional.empty();
        }
    }

    /** First tag not in {@code used}; writers whose tag is unknown still take up a slot. */
    private String nextFreeTag(Set<String> used, int unknownOccupants) {
        if (used.size() + unknownOccupants >= config.maxWriters())
            throw new IllegalStateException("Maximum writer count (" + config.maxWriters() + ") exceeded");
        for (int i = 0; i < config.maxWriters(); i++) {
            String tag = String.valueOf((char) ('A' + i));
            if (!used.contains(tag)) return tag;
        }
        throw new IllegalStateException("Maximum writer count (" + config.maxWriters() + ") exceeded");
    }

    public CounterRange mintRange(WriterRecord writer, int count) {
        return mintRange(writer, count, 0);
    }

    /**
     * Reserve {@code count} fresh counters for {@code writer}.
     *
     * @param observedFloor highest counter the caller has seen (for example in its
     *                      loaded snapshot); the range starts above it as well
     * @throws WriteConflictException if global knowledge cannot be established
     */
    public CounterRange mintRange(WriterRecord writer, int count, long observedFloor) {
        if (count <= 0) throw new IllegalArgumentException("count must be > 0, got " + count);
        long global;
        try {
            global = globalKnowledge();
        } catch (UncheckedIOException e) {
            throw new WriteConflictException("Cannot establish global knowledge under " + layout.devicesDir(), e);
        }
        long base = Math.max(global, Math.max(writer.knowledge(), observedFloor));
        CounterRange range = CounterRange.after(base, count);
        log.log(Level.FINE, "Minted {0} for writer {1} (global knowledge {2})",
                new Object[]{range, writer.writerTag(), String.valueOf(global)});
        return range;
    }

    /** Persist a writer's new knowledge. The metadata file is replaced atomically. */
    public WriterRecord recordKnowledge(WriterRecord writer, long knowledge, boolean fullKnowledge) {
        WriterRecord updated = writer.withKnowledge(knowledge, fullKnowledge);
        fs.writeAtomically(layout.metadataFile(writer.writerGuid()), WriterMetadataCodec.encode(updated));
        return updated;
    }
}
