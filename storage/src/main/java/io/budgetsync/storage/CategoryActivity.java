// file: storage/src/main/java/io/budgetsync/storage/CategoryActivity.java
package io.budgetsync.storage;

/**
 * Budgeted amount and outflow of one category in one month.
 * {@code outflow} is the positive sum of the month's negative amounts.
 */
public record CategoryActivity(String categoryId, String categoryName, long budgeted, long outflow) {
}
