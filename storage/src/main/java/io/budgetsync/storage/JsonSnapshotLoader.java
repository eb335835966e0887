// file: storage/src/main/java/io/budgetsync/storage/JsonSnapshotLoader.java
package io.budgetsync.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.budgetsync.core.ConflictResolver;
import io.budgetsync.core.Entity;
import io.budgetsync.core.EntityKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Snapshot loader for the JSON "Full.snapshot" document.
 * <p>
 * Format:
 *  - Top-level keys group records by kind: "accounts", "payees", "transactions", ...
 *  - Master categories may nest their categories under "subCategories"; monthly budgets
 *    may nest per-category amounts under "monthlySubCategoryBudgets". Nested records
 *    inherit the parent id when they omit it.
 *  - Unknown top-level keys are ignored.
 *  - If an id appears twice, the higher version wins.
 */
public final class JsonSnapshotLoader implements SnapshotLoader {
    private static final Logger log = Logger.getLogger(JsonSnapshotLoader.class.getName());

    static final String NESTED_CATEGORIES = "subCategories";
    static final String NESTED_CATEGORY_BUDGETS = "monthlySubCategoryBudgets";

    private final BudgetFileSystem fs;
    private final ConflictResolver resolver;

    public JsonSnapshotLoader(BudgetFileSystem fs) {
        this(fs, new ConflictResolver.LastWriterWins());
    }

    public JsonSnapshotLoader(BudgetFileSystem fs, ConflictResolver resolver) {
        this.fs = fs;
        this.resolver = resolver;
    }

    @Override
    public EntityStore load(BudgetLayout layout) {
        Path file = layout.snapshotFile();
        if (!fs.exists(file)) throw new MalformedSnapshotException(file, "snapshot file not found");

        byte[] bytes;
        try {
            bytes = fs.read(file);
        } catch (UncheckedIOException e) {
            throw new MalformedSnapshotException(file, "unreadable", e);
        }

        JsonNode doc;
        try {
            doc = JsonSupport.mapper().readTree(bytes);
        } catch (IOException e) {
            throw new MalformedSnapshotException(file, "unreadable JSON", e);
        }
        if (doc == null || !doc.isObject()) throw new MalformedSnapshotException(file, "document is not an object");

        EntityStore store = new EntityStore(layout.root());
        Iterator<Map.Entry<String, JsonNode>> sections = doc.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            Optional<EntityKind> kind = EntityKind.fromSnapshotKey(section.getKey());
            if (kind.isEmpty()) {
                log.log(Level.FINE, "Ignoring snapshot section {0}", section.getKey());
                continue;
            }
            if (!section.getValue().isArray())
                throw new MalformedSnapshotException(file, "'" + section.getKey() + "' is not a list");
            for (JsonNode node : section.getValue()) {
                loadRecord(store, kind.get(), node, file);
            }
        }

        long knowledge = store.highestCounter();
        store.attachReport(ReconcileReport.snapshotOnly(knowledge));
        log.log(Level.INFO, "Loaded snapshot {0}: {1} live entities, knowledge {2}",
                new Object[]{file, store.size(), String.valueOf(knowledge)});
        return store;
    }

    private void loadRecord(EntityStore store, EntityKind kind, JsonNode node, Path file) {
        Entity rev;
        try {
            rev = EntityCodec.decode(kind, node);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException(file, e.getMessage(), e);
        }
        install(store, rev);

        if (kind == EntityKind.MASTER_CATEGORY) {
            loadNested(store, EntityKind.SUB_CATEGORY, node.get(NESTED_CATEGORIES), "masterCategoryId", rev.entityId(), file);
        } else if (kind == EntityKind.MONTHLY_BUDGET) {
            loadNested(store, EntityKind.MONTHLY_CATEGORY_BUDGET, node.get(NESTED_CATEGORY_BUDGETS), "parentMonthlyBudgetId", rev.entityId(), file);
        }
    }

    private void loadNested(EntityStore store, EntityKind kind, JsonNode children,
                            String parentField, String parentId, Path file) {
        if (children == null || children.isNull()) return;
        if (!children.isArray())
            throw new MalformedSnapshotException(file, "nested " + kind.snapshotKey() + " of " + parentId + " is not a list");
        for (JsonNode child : children) {
            if (!child.isObject())
                throw new MalformedSnapshotException(file, "nested " + kind.snapshotKey() + " entry of " + parentId + " is not an object");
            ObjectNode copy = ((ObjectNode) child).deepCopy();
            if (!copy.hasNonNull(parentField)) copy.put(parentField, parentId);
            loadRecord(store, kind, copy, file);
        }
    }

    private void install(EntityStore store, Entity rev) {
        Entity current = store.revisions().get(rev.key());
        if (current != null) {
            log.log(Level.WARNING, "Snapshot lists {0} twice ({1} and {2}); keeping the newer",
                    new Object[]{rev.key(), current.version(), rev.version()});
        }
        if (resolver.supersedes(current, rev)) store.replace(rev);
    }
}
