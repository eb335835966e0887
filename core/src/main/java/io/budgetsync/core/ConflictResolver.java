// file: core/src/main/java/io/budgetsync/core/ConflictResolver.java
package io.budgetsync.core;

/**
 * Policy deciding whether an incoming revision replaces the current one.
 * <p>
 * Reconciliation folds every revision through this policy in increasing counter
 * order, so the policy only has to answer a pairwise question.
 */
public interface ConflictResolver {

    /**
     * @param current  revision currently held for the entity, or null if none
     * @param incoming revision being folded in
     * @return true if {@code incoming} must replace {@code current}
     */
    boolean supersedes(Entity current, Entity incoming);

    /**
     * Default policy: last-writer-wins by version counter.
     * <p>
     * Important:
     *  - The authoring writer never matters, only the counter does.
     *  - Unstamped revisions (not committed yet) never win against stamped ones
     *    and are always replaced by them.
     *  - Equal versions do not supersede, which makes re-applying a revision a no-op.
     */
    final class LastWriterWins implements ConflictResolver {
        @Override
        public boolean supersedes(Entity current, Entity incoming) {
            if (incoming == null) throw new IllegalArgumentException("incoming must not be null");
            if (current == null) return true;
            if (!incoming.stamped()) return false;
            if (!current.stamped()) return true;
            return incoming.version().isNewerThan(current.version());
        }
    }
}
