package com.umls.sync.reconcile;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a reconciliation run stops before {@link SyncPhase#COMMITTED}.
 * The version marker still holds the previous version, so the run can be retried from the start.
 */
public class ReconciliationException extends RuntimeException {

    private final SyncPhase failedPhase;
    private final SyncPhase lastCompletedPhase;

    public ReconciliationException(SyncPhase failedPhase, SyncPhase lastCompletedPhase, Throwable cause) {
        super("Reconciliation stopped while reaching " + failedPhase
                + " (last completed phase: " + lastCompletedPhase + "): "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.failedPhase = failedPhase;
        this.lastCompletedPhase = lastCompletedPhase;
    }

    /**
     * The phase that was being executed.
     */
    public SyncPhase getFailedPhase() {
        return failedPhase;
    }

    /**
     * The last phase that finished successfully.
     */
    public SyncPhase getLastCompletedPhase() {
        return lastCompletedPhase;
    }

    public boolean isCancellation() {
        return getCause() instanceof CancellationException;
    }
}
