// file: storage/src/main/java/io/budgetsync/storage/AccountBalance.java
package io.budgetsync.storage;

/** Balance of one account in minor currency units. */
public record AccountBalance(long cleared, long uncleared) {

    public long total() {
        return cleared + uncleared;
    }
}
