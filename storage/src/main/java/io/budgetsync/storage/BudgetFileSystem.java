// file: storage/src/main/java/io/budgetsync/storage/BudgetFileSystem.java
package io.budgetsync.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Filesystem seam supplied by the caller.
 * <p>
 * The engine never decides how exclusivity or backups are handled; it only needs
 * listing, reading and an atomic write. Failures surface as
 * {@link java.io.UncheckedIOException}.
 * <p>
 * Contract:
 *  - writeAtomically() either leaves the previous content (or no file) in place,
 *    or the complete new content. Readers never observe a partial file.
 *  - list() returns an empty list for a missing directory; listing order is
 *    unspecified and must never matter for correctness.
 */
public interface BudgetFileSystem {

    boolean exists(Path path);

    boolean isDirectory(Path path);

    /** Direct children of {@code dir}, in no particular order. Empty if {@code dir} does not exist. */
    List<Path> list(Path dir);

    byte[] read(Path file);

    /** Write to a temporary sibling, then rename over {@code file}. */
    void writeAtomically(Path file, byte[] content);

    void createDirectories(Path dir);

    /** Delete a file if present. Used to roll back a half-finished commit. */
    void deleteIfExists(Path file);
}
