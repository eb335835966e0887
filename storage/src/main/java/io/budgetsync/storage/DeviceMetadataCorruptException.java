// file: storage/src/main/java/io/budgetsync/storage/DeviceMetadataCorruptException.java
package io.budgetsync.storage;

import java.nio.file.Path;

/** A writer's metadata file is missing or unreadable. Skipped when computing global knowledge. */
public final class DeviceMetadataCorruptException extends BudgetStoreException {
    private final Path metadata;

    public DeviceMetadataCorruptException(Path metadata, String message, Throwable cause) {
        super("Corrupt writer metadata " + metadata + ": " + message, cause);
        this.metadata = metadata;
    }

    public Path metadata() { return metadata; }
}
