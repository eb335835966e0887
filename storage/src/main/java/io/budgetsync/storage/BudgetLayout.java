// file: storage/src/main/java/io/budgetsync/storage/BudgetLayout.java
package io.budgetsync.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of one budget:
 * <pre>
 *   root/data/Full.snapshot
 *   root/devices/GUID/GUID.meta
 *   root/devices/GUID/START_END.delta
 * </pre>
 */
public record BudgetLayout(Path root) {

    public static final String SNAPSHOT_FILE = "Full.snapshot";
    public static final String META_SUFFIX = ".meta";
    public static final String DELTA_SUFFIX = ".delta";

    public BudgetLayout {
        Objects.requireNonNull(root, "root");
    }

    public Path dataDir() { return root.resolve("data"); }

    public Path snapshotFile() { return dataDir().resolve(SNAPSHOT_FILE); }

    public Path devicesDir() { return root.resolve("devices"); }

    public Path writerDir(String writerGuid) { return devicesDir().resolve(writerGuid); }

    public Path metadataFile(String writerGuid) { return writerDir(writerGuid).resolve(writerGuid + META_SUFFIX); }

    public Path segmentFile(String writerGuid, CounterRange range) {
        return writerDir(writerGuid).resolve(range.fileName());
    }
}
