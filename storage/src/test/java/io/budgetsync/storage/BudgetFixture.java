// file: storage/src/test/java/io/budgetsync/storage/BudgetFixture.java
package io.budgetsync.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds budget directories on disk for tests: snapshot, writer metadata and raw segment files.
 */
final class BudgetFixture {

    static final String WRITER_A = "AAAAAAAA-0000-0000-0000-00000000000A";
    static final String WRITER_B = "BBBBBBBB-0000-0000-0000-00000000000B";
    static final String WRITER_C = "CCCCCCCC-0000-0000-0000-00000000000C";

    /** Snapshot with one account, payee, category tree, August budget and transaction t1 at A-10. */
    static final String BASIC_SNAPSHOT = """
            {
              "accounts": [
                {"entityId": "acc1", "entityVersion": "A-1", "accountName": "Checking",
                 "accountType": "Checking", "onBudget": true}
              ],
              "payees": [
                {"entityId": "p1", "entityVersion": "A-2", "name": "Corner Grocer"}
              ],
              "masterCategories": [
                {"entityId": "mc1", "entityVersion": "A-3", "name": "Everyday",
                 "subCategories": [
                   {"entityId": "c1", "entityVersion": "A-4", "name": "Groceries"}
                 ]}
              ],
              "monthlyBudgets": [
                {"entityId": "mb1", "entityVersion": "A-5", "month": "2025-08-01",
                 "monthlySubCategoryBudgets": [
                   {"entityId": "mcb1", "entityVersion": "A-6", "categoryId": "c1", "budgeted": 50000}
                 ]}
              ],
              "transactions": [
                {"entityId": "t1", "entityVersion": "A-10", "accountId": "acc1", "amount": 0,
                 "date": "2025-08-14", "cleared": "Uncleared", "accepted": true}
              ]
            }
            """;

    final Path root;
    final BudgetLayout layout;

    BudgetFixture(Path root) {
        this.root = root;
        this.layout = new BudgetLayout(root);
    }

    BudgetFixture snapshot(String json) {
        write(layout.snapshotFile(), json);
        return this;
    }

    BudgetFixture writer(String guid, String tag, long knowledge) {
        return rawMeta(guid, """
                {"deviceGuid": "%s", "shortDeviceId": "%s", "friendlyName": "device %s",
                 "hasFullKnowledge": false, "knowledge": %d, "formatVersion": "1.0"}
                """.formatted(guid, tag, tag, knowledge));
    }

    BudgetFixture rawMeta(String guid, String content) {
        write(layout.metadataFile(guid), content);
        return this;
    }

    /** Segment file named after the range, with the given mutation records as "items". */
    BudgetFixture segment(String guid, String tag, long start, long end, String items) {
        return rawSegment(guid, start + "_" + end + ".delta", """
                {"formatVersion": "1.0", "deviceGuid": "%s", "shortDeviceId": "%s",
                 "startVersion": %d, "endVersion": %d, "publishTime": "2025-08-15T10:00:00Z",
                 "items": [%s]}
                """.formatted(guid, tag, start, end, items));
    }

    BudgetFixture rawSegment(String guid, String fileName, String content) {
        write(layout.writerDir(guid).resolve(fileName), content);
        return this;
    }

    /** A transaction mutation record. */
    static String txn(String id, String version, long amount, String memo) {
        String memoField = memo == null ? "" : ", \"memo\": \"" + memo + "\"";
        return """
                {"entityType": "transaction", "entityId": "%s", "entityVersion": "%s", "isTombstone": false,
                 "accountId": "acc1", "amount": %d, "date": "2025-08-14", "cleared": "Uncleared",
                 "accepted": true%s}
                """.formatted(id, version, amount, memoField);
    }

    static String tombstone(String type, String id, String version) {
        return """
                {"entityType": "%s", "entityId": "%s", "entityVersion": "%s", "isTombstone": true}
                """.formatted(type, id, version);
    }

    String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
