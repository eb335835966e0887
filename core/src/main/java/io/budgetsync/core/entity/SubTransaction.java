// file: core/src/main/java/io/budgetsync/core/entity/SubTransaction.java
package io.budgetsync.core.entity;

/**
 * One split of a {@link Transaction}. Shares the parent's account and date,
 * carries its own amount, category, payee and memo.
 */
public record SubTransaction(
        String entityId,
        long amount,
        String categoryId,
        String payeeId,
        String memo
) {
}
