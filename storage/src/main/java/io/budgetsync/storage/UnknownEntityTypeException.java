// file: storage/src/main/java/io/budgetsync/storage/UnknownEntityTypeException.java
package io.budgetsync.storage;

/**
 * A mutation record carries an entity kind this engine does not know.
 * Always recovered locally: only that record is skipped.
 */
public final class UnknownEntityTypeException extends BudgetStoreException {
    private final String entityType;
    private final String entityId;

    public UnknownEntityTypeException(String entityType, String entityId, String source) {
        super("Unknown entity type '" + entityType + "' for entity " + entityId + " in " + source);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String entityType() { return entityType; }

    public String entityId() { return entityId; }
}
