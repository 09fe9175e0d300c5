package com.umls.sync.reconcile;

import java.time.Duration;

/**
 * Counts of one committed reconciliation run.
 */
public record ReconciliationResult(
        String version,
        long conceptsDeleted,
        long mergesApplied,
        long mergesSkipped,
        long conceptsLoaded,
        long codesLoaded,
        long membershipsLoaded,
        long assertionsLoaded,
        long staleAssertionsSwept,
        long staleMembershipsSwept,
        long staleCodesSwept,
        Duration duration
) {
    public long totalSwept() {
        return staleAssertionsSwept + staleMembershipsSwept + staleCodesSwept;
    }

    @Override
    public String toString() {
        return "ReconciliationResult{version=" + version +
                ", deleted=" + conceptsDeleted +
                ", mergesApplied=" + mergesApplied +
                ", mergesSkipped=" + mergesSkipped +
                ", concepts=" + conceptsLoaded +
                ", codes=" + codesLoaded +
                ", memberships=" + membershipsLoaded +
                ", assertions=" + assertionsLoaded +
                ", swept=" + totalSwept() +
                ", durationMs=" + (duration != null ? duration.toMillis() : 0) + '}';
    }
}
