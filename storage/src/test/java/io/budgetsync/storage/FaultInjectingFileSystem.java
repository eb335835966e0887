// file: storage/src/test/java/io/budgetsync/storage/FaultInjectingFileSystem.java
package io.budgetsync.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Local filesystem that records writes, can fail selected operations and can
 * shuffle directory listings.
 */
final class FaultInjectingFileSystem implements BudgetFileSystem {

    private final LocalBudgetFileSystem delegate = new LocalBudgetFileSystem();
    private final List<Path> written = new ArrayList<>();
    private final List<Path> deleted = new ArrayList<>();
    private Predicate<Path> failWrite = p -> false;
    private Predicate<Path> failList = p -> false;
    private Random shuffle;

    FaultInjectingFileSystem failWritesTo(Predicate<Path> which) {
        this.failWrite = which;
        return this;
    }

    FaultInjectingFileSystem failListing(Predicate<Path> which) {
        this.failList = which;
        return this;
    }

    FaultInjectingFileSystem shuffleListings(long seed) {
        this.shuffle = new Random(seed);
        return this;
    }

    List<Path> written() {
        return written;
    }

    List<Path> deleted() {
        return deleted;
    }

    @Override
    public boolean exists(Path path) {
        return delegate.exists(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return delegate.isDirectory(path);
    }

    @Override
    public List<Path> list(Path dir) {
        if (failList.test(dir)) throw new UncheckedIOException(new IOException("injected listing failure: " + dir));
        List<Path> children = new ArrayList<>(delegate.list(dir));
        if (shuffle != null) Collections.shuffle(children, shuffle);
        else Collections.reverse(children);
        return children;
    }

    @Override
    public byte[] read(Path file) {
        return delegate.read(file);
    }

    @Override
    public void writeAtomically(Path file, byte[] content) {
        if (failWrite.test(file)) throw new UncheckedIOException(new IOException("injected write failure: " + file));
        delegate.writeAtomically(file, content);
        written.add(file);
    }

    @Override
    public void createDirectories(Path dir) {
        delegate.createDirectories(dir);
    }

    @Override
    public void deleteIfExists(Path file) {
        delegate.deleteIfExists(file);
        deleted.add(file);
    }
}
