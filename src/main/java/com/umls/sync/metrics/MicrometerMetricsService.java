package com.umls.sync.metrics;

import com.umls.sync.extract.ExtractionStats;
import com.umls.sync.reconcile.SyncPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code umls.sync.phase.duration} (Timer, tag: phase)</li>
 *   <li>{@code umls.extract.rows} (Counter, tags: file, outcome)</li>
 *   <li>{@code umls.sync.merges} (Counter, tags: outcome, reason)</li>
 *   <li>{@code umls.sync.deleted} (Counter)</li>
 *   <li>{@code umls.sync.swept} (Counter, tag: kind)</li>
 *   <li>{@code umls.sync.batch.size} (DistributionSummary)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter deletedCounter;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.deletedCounter = Counter.builder("umls.sync.deleted")
                .description("Concepts removed by the deletion list")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("umls.sync.batch.size")
                .description("Rows sent per store batch")
                .register(registry);
    }

    @Override
    public void recordPhaseDuration(SyncPhase phase, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(phase.name(), k ->
                Timer.builder("umls.sync.phase.duration")
                        .description("Duration of reconciliation phases")
                        .tag("phase", phase.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordExtraction(ExtractionStats stats) {
        rowCounter(stats.file(), "accepted").increment(stats.accepted());
        rowCounter(stats.file(), "rejected").increment(stats.rejected());
        rowCounter(stats.file(), "malformed").increment(stats.malformed());
    }

    private Counter rowCounter(String file, String outcome) {
        return counterCache.computeIfAbsent("rows:" + file + ":" + outcome, k ->
                Counter.builder("umls.extract.rows")
                        .description("Release rows read during extraction")
                        .tag("file", file)
                        .tag("outcome", outcome)
                        .register(registry));
    }

    @Override
    public void incrementMergeApplied() {
        mergeCounter("applied", "none").increment();
    }

    @Override
    public void incrementMergeSkipped(String reason) {
        mergeCounter("skipped", reason).increment();
    }

    private Counter mergeCounter(String outcome, String reason) {
        return counterCache.computeIfAbsent("merge:" + outcome + ":" + reason, k ->
                Counter.builder("umls.sync.merges")
                        .description("Merge instructions processed")
                        .tag("outcome", outcome)
                        .tag("reason", reason)
                        .register(registry));
    }

    @Override
    public void recordDeleted(long count) {
        deletedCounter.increment(count);
    }

    @Override
    public void recordSwept(String kind, long count) {
        Counter counter = counterCache.computeIfAbsent("swept:" + kind, k ->
                Counter.builder("umls.sync.swept")
                        .description("Stale records removed by the staleness sweep")
                        .tag("kind", kind)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
