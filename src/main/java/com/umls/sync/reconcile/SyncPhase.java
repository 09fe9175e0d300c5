package com.umls.sync.reconcile;

/**
 * Reconciliation states, in the order they are reached.
 */
public enum SyncPhase {
    INIT,
    CONSTRAINTS_ENSURED,
    DELETED,
    MERGED,
    LOADED,
    SWEPT,
    COMMITTED;

    /**
     * The phase reached after this one, or {@code null} after {@link #COMMITTED}.
     */
    public SyncPhase next() {
        SyncPhase[] phases = values();
        return ordinal() + 1 < phases.length ? phases[ordinal() + 1] : null;
    }
}
