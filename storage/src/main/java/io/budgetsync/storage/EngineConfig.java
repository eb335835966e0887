// file: storage/src/main/java/io/budgetsync/storage/EngineConfig.java
package io.budgetsync.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Engine configuration.
 * <p>
 * Supports:
 *  - segmentFailurePolicy: abort or skip when a delta segment is corrupt
 *  - formatVersion:        format version written into metadata and segments
 *  - maxWriters:           how many writer tags may be handed out (A..Z by default)
 *  - defaultFriendlyName:  label for writers registered without one
 */
public record EngineConfig(
        SegmentFailurePolicy segmentFailurePolicy,
        String formatVersion,
        int maxWriters,
        String defaultFriendlyName
) {
    public static final String DEFAULT_FORMAT_VERSION = "1.0";
    public static final int MAX_SINGLE_LETTER_TAGS = 26;

    public EngineConfig {
        Objects.requireNonNull(segmentFailurePolicy, "segmentFailurePolicy");
        Objects.requireNonNull(formatVersion, "formatVersion");
        Objects.requireNonNull(defaultFriendlyName, "defaultFriendlyName");
        if (formatVersion.isBlank()) throw new IllegalArgumentException("formatVersion must not be blank");
        if (maxWriters <= 0 || maxWriters > MAX_SINGLE_LETTER_TAGS)
            throw new IllegalArgumentException("maxWriters must be in 1.." + MAX_SINGLE_LETTER_TAGS);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(SegmentFailurePolicy.SKIP_AND_WARN, DEFAULT_FORMAT_VERSION,
                MAX_SINGLE_LETTER_TAGS, "budget-sync");
    }

    public EngineConfig withSegmentFailurePolicy(SegmentFailurePolicy policy) {
        return new EngineConfig(policy, formatVersion, maxWriters, defaultFriendlyName);
    }

    /**
     * Load from a JSON file. Absent fields keep their defaults:
     * <pre>
     *   { "segmentFailurePolicy": "ABORT", "formatVersion": "1.0",
     *     "maxWriters": 26, "defaultFriendlyName": "laptop" }
     * </pre>
     */
    public static EngineConfig fromJsonFile(Path path) {
        ObjectMapper mapper = JsonSupport.mapper();
        try {
            JsonEngineConfig cfg = mapper.readValue(path.toFile(), JsonEngineConfig.class);
            EngineConfig d = defaults();
            return new EngineConfig(
                    cfg.segmentFailurePolicy != null ? cfg.segmentFailurePolicy : d.segmentFailurePolicy(),
                    cfg.formatVersion != null ? cfg.formatVersion : d.formatVersion(),
                    cfg.maxWriters != null ? cfg.maxWriters : d.maxWriters(),
                    cfg.defaultFriendlyName != null ? cfg.defaultFriendlyName : d.defaultFriendlyName()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EngineConfig from " + path, e);
        }
    }

    public static final class JsonEngineConfig {
        public SegmentFailurePolicy segmentFailurePolicy;
        public String formatVersion;
        public Integer maxWriters;
        public String defaultFriendlyName;
    }
}
