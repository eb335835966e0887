// file: storage/src/main/java/io/budgetsync/storage/SegmentDiscovery.java
package io.budgetsync.storage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds every delta segment under every writer directory.
 * <p>
 *  - Scans root/devices/GUID/ for files ending in ".delta".
 *  - Parses the inclusive counter range out of each filename.
 *  - Returns segments sorted by range, never in directory listing order.
 *  - Names ending in ".delta" that do not parse are returned as rejected, so the
 *    caller can apply its failure policy. Other files (metadata, temp files) are ignored.
 */
public final class SegmentDiscovery {
    private static final Logger log = Logger.getLogger(SegmentDiscovery.class.getName());

    private final BudgetFileSystem fs;

    public SegmentDiscovery(BudgetFileSystem fs) {
        this.fs = fs;
    }

    public record Result(List<SegmentRef> segments, List<MalformedDeltaException> rejected) {
        public Result {
            segments = List.copyOf(segments);
            rejected = List.copyOf(rejected);
        }
    }

    public Result discover(BudgetLayout layout) {
        List<SegmentRef> found = new ArrayList<>();
        List<MalformedDeltaException> rejected = new ArrayList<>();

        for (Path writerDir : fs.list(layout.devicesDir())) {
            if (!fs.isDirectory(writerDir)) continue;
            String writerGuid = writerDir.getFileName().toString();
            for (Path file : fs.list(writerDir)) {
                String name = file.getFileName().toString();
                if (!name.endsWith(BudgetLayout.DELTA_SUFFIX)) continue;
                Optional<CounterRange> range = CounterRange.parseFileName(name);
                if (range.isPresent()) {
                    found.add(new SegmentRef(writerGuid, range.get(), file));
                } else {
                    rejected.add(new MalformedDeltaException(file, "filename is not START_END.delta"));
                }
            }
        }

        found.sort(SegmentRef.BY_RANGE);
        log.log(Level.FINE, "Discovered {0} segment(s) under {1}", new Object[]{found.size(), layout.devicesDir()});
        return new Result(found, rejected);
    }
}
