package com.umls.sync.metrics;

import com.umls.sync.extract.ExtractionStats;
import com.umls.sync.reconcile.SyncPhase;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPhaseDuration(SyncPhase phase, Duration duration) {
    }

    @Override
    public void recordExtraction(ExtractionStats stats) {
    }

    @Override
    public void incrementMergeApplied() {
    }

    @Override
    public void incrementMergeSkipped(String reason) {
    }

    @Override
    public void recordDeleted(long count) {
    }

    @Override
    public void recordSwept(String kind, long count) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
