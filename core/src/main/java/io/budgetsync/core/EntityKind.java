// file: core/src/main/java/io/budgetsync/core/EntityKind.java
package io.budgetsync.core;

import io.budgetsync.core.entity.Account;
import io.budgetsync.core.entity.EntityPayload;
import io.budgetsync.core.entity.MasterCategory;
import io.budgetsync.core.entity.MonthlyBudget;
import io.budgetsync.core.entity.MonthlyCategoryBudget;
import io.budgetsync.core.entity.Payee;
import io.budgetsync.core.entity.PayeeRenamingRule;
import io.budgetsync.core.entity.ScheduledTransaction;
import io.budgetsync.core.entity.SubCategory;
import io.budgetsync.core.entity.Transaction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of entity kinds the ledger knows about.
 * <p>
 * Each kind carries:
 *  - discriminator: the "entityType" value used in delta segment records,
 *  - snapshotKey:   the top-level key grouping this kind in the full snapshot,
 *  - payloadType:   the typed variant its fields are bound to,
 *  - requiredFields: fields a live (non-tombstone) record must carry.
 * <p>
 * This enum is the single dispatch point from a textual discriminator to a variant.
 * Unknown discriminators come back as {@link Optional#empty()} so callers can skip
 * records written by newer writers instead of failing.
 */
public enum EntityKind {
    ACCOUNT("account", "accounts", Account.class,
            List.of("accountName", "accountType")),
    PAYEE("payee", "payees", Payee.class,
            List.of("name")),
    PAYEE_RENAMING_RULE("payeeRenamingRule", "payeeRenamingRules", PayeeRenamingRule.class,
            List.of("targetPayeeId", "operand"), "payeeStringCondition"),
    MASTER_CATEGORY("masterCategory", "masterCategories", MasterCategory.class,
            List.of("name")),
    SUB_CATEGORY("category", "subCategories", SubCategory.class,
            List.of("name", "masterCategoryId")),
    MONTHLY_BUDGET("monthlyBudget", "monthlyBudgets", MonthlyBudget.class,
            List.of("month")),
    MONTHLY_CATEGORY_BUDGET("monthlyCategoryBudget", "monthlyCategoryBudgets", MonthlyCategoryBudget.class,
            List.of("parentMonthlyBudgetId", "categoryId", "budgeted")),
    TRANSACTION("transaction", "transactions", Transaction.class,
            List.of("accountId", "amount", "date")),
    SCHEDULED_TRANSACTION("scheduledTransaction", "scheduledTransactions", ScheduledTransaction.class,
            List.of("frequency", "amount"));

    private static final Map<String, EntityKind> BY_DISCRIMINATOR = new HashMap<>();
    private static final Map<String, EntityKind> BY_SNAPSHOT_KEY = new HashMap<>();

    static {
        for (EntityKind k : values()) {
            BY_DISCRIMINATOR.put(k.discriminator, k);
            for (String alias : k.aliases) BY_DISCRIMINATOR.put(alias, k);
            BY_SNAPSHOT_KEY.put(k.snapshotKey, k);
        }
    }

    private final String discriminator;
    private final String snapshotKey;
    private final Class<? extends EntityPayload> payloadType;
    private final List<String> requiredFields;
    private final List<String> aliases;

    EntityKind(String discriminator,
               String snapshotKey,
               Class<? extends EntityPayload> payloadType,
               List<String> requiredFields,
               String... aliases) {
        this.discriminator = discriminator;
        this.snapshotKey = snapshotKey;
        this.payloadType = payloadType;
        this.requiredFields = requiredFields;
        this.aliases = List.of(aliases);
    }

    public String discriminator() { return discriminator; }

    public String snapshotKey() { return snapshotKey; }

    public Class<? extends EntityPayload> payloadType() { return payloadType; }

    public List<String> requiredFields() { return requiredFields; }

    /** Resolve a delta record's "entityType". Accepts legacy aliases. */
    public static Optional<EntityKind> fromDiscriminator(String discriminator) {
        if (discriminator == null) return Optional.empty();
        return Optional.ofNullable(BY_DISCRIMINATOR.get(discriminator));
    }

    /** Resolve a top-level snapshot key such as "transactions". */
    public static Optional<EntityKind> fromSnapshotKey(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(BY_SNAPSHOT_KEY.get(key));
    }
}
