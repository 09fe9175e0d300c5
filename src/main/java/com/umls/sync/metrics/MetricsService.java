package com.umls.sync.metrics;

import com.umls.sync.extract.ExtractionStats;
import com.umls.sync.reconcile.SyncPhase;

import java.time.Duration;

/**
 * Interface for recording synchronization metrics.
 * The default {@link NoOpMetricsService} does nothing, so a run needs no metrics backend.
 */
public interface MetricsService {

    void recordPhaseDuration(SyncPhase phase, Duration duration);

    void recordExtraction(ExtractionStats stats);

    void incrementMergeApplied();

    void incrementMergeSkipped(String reason);

    void recordDeleted(long count);

    void recordSwept(String kind, long count);

    void recordBatchSize(int size);
}
