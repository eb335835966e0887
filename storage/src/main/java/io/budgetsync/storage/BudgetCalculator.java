// file: storage/src/main/java/io/budgetsync/storage/BudgetCalculator.java
package io.budgetsync.storage;

import io.budgetsync.core.Entity;
import io.budgetsync.core.EntityKind;
import io.budgetsync.core.entity.MonthlyBudget;
import io.budgetsync.core.entity.MonthlyCategoryBudget;
import io.budgetsync.core.entity.PayeeRenamingRule;
import io.budgetsync.core.entity.SubCategory;
import io.budgetsync.core.entity.SubTransaction;
import io.budgetsync.core.entity.Transaction;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over the current view of a store. Tombstoned entities never count.
 */
public final class BudgetCalculator {

    private final EntityStore store;
    private final Clock clock;

    public BudgetCalculator(EntityStore store) {
        this(store, Clock.systemDefaultZone());
    }

    public BudgetCalculator(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Cleared (Cleared or Reconciled) and uncleared totals of an account.
     * Transactions dated today are left out; they may still be pending.
     */
    public AccountBalance accountBalance(String accountId) {
        String today = LocalDate.now(clock).toString();
        long cleared = 0;
        long uncleared = 0;
        for (Entity e : store.all(EntityKind.TRANSACTION)) {
            Transaction t = e.payload(Transaction.class);
            if (!accountId.equals(t.accountId()) || today.equals(t.date())) continue;
            if (t.cleared().settled()) cleared += t.amount();
            else uncleared += t.amount();
        }
        return new AccountBalance(cleared, uncleared);
    }

    /**
     * Every category with a positive budgeted amount in {@code month}, ordered by name.
     * Split transactions count per split. Empty if the month has no budget.
     */
    public List<CategoryActivity> monthlySummary(YearMonth month) {
        Optional<Entity> budget = store.all(EntityKind.MONTHLY_BUDGET).stream()
                .filter(e -> e.payload(MonthlyBudget.class).month().startsWith(month.toString()))
                .findFirst();
        if (budget.isEmpty()) return List.of();

        List<CategoryActivity> out = new ArrayList<>();
        for (Entity e : store.all(EntityKind.MONTHLY_CATEGORY_BUDGET)) {
            MonthlyCategoryBudget mcb = e.payload(MonthlyCategoryBudget.class);
            if (!budget.get().entityId().equals(mcb.parentMonthlyBudgetId()) || mcb.budgeted() <= 0) continue;
            Optional<Entity> category = store.get(EntityKind.SUB_CATEGORY, mcb.categoryId());
            if (category.isEmpty()) continue;
            String name = category.get().payload(SubCategory.class).name();
            out.add(new CategoryActivity(mcb.categoryId(), name, mcb.budgeted(), outflow(month, mcb.categoryId())));
        }
        out.sort(Comparator.comparing(CategoryActivity::categoryName));
        return out;
    }

    /**
     * Payee a raw imported payee string is renamed to. Rules are tried in id order;
     * rules pointing at a deleted payee are ignored.
     */
    public Optional<Entity> resolvePayee(String rawPayee) {
        for (Entity e : store.all(EntityKind.PAYEE_RENAMING_RULE)) {
            PayeeRenamingRule rule = e.payload(PayeeRenamingRule.class);
            if (!rule.matches(rawPayee)) continue;
            Optional<Entity> target = store.get(EntityKind.PAYEE, rule.targetPayeeId());
            if (target.isPresent()) return target;
        }
        return Optional.empty();
    }

    private long outflow(YearMonth month, String categoryId) {
        String prefix = month.toString();
        long sum = 0;
        for (Entity e : store.all(EntityKind.TRANSACTION)) {
            Transaction t = e.payload(Transaction.class);
            if (t.date() == null || !t.date().startsWith(prefix)) continue;
            if (t.hasSplits()) {
                for (SubTransaction s : t.subTransactions()) {
                    if (categoryId.equals(s.categoryId()) && s.amount() < 0) sum += -s.amount();
                }
            } else if (categoryId.equals(t.categoryId()) && t.amount() < 0) {
                sum += -t.amount();
            }
        }
        return sum;
    }
}
