package com.umls.sync.reconcile;

import com.umls.sync.audit.MergeLedger;
import com.umls.sync.audit.MergeOutcome;
import com.umls.sync.audit.MergeRecord;
import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.ExtractedSnapshot;
import com.umls.sync.core.model.MergeInstruction;
import com.umls.sync.graph.GraphStore;
import com.umls.sync.graph.InputSanitizer;
import com.umls.sync.logging.LogContext;
import com.umls.sync.merge.ProvenanceMerger;
import com.umls.sync.metrics.MetricsService;
import com.umls.sync.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Converges the graph to a new release snapshot plus its deletion and merge lists.
 *
 * <p>Phases run strictly in order, each idempotent on its own:</p>
 * <ol>
 *   <li>{@link SyncPhase#CONSTRAINTS_ENSURED}: indexes for the keyed upserts</li>
 *   <li>{@link SyncPhase#DELETED}: listed concepts removed with their edges; absent CUIs ignored</li>
 *   <li>{@link SyncPhase#MERGED}: merge instructions applied in list order, chasing earlier merges</li>
 *   <li>{@link SyncPhase#LOADED}: snapshot upserted, every record stamped with the run version</li>
 *   <li>{@link SyncPhase#SWEPT}: assertion edges, memberships and codes not stamped by this run removed</li>
 *   <li>{@link SyncPhase#COMMITTED}: version marker set to the run version</li>
 * </ol>
 *
 * <p>Concepts are never swept; they leave the graph only through the deletion or merge lists.
 * A failure or cancellation before the commit leaves the version marker untouched and is
 * reported as a {@link ReconciliationException} naming the phase that did not complete.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final GraphStore store;
    private final int batchSize;
    private final MergeLedger mergeLedger;
    private final ProvenanceMerger provenanceMerger;
    private final MetricsService metricsService;

    public ReconciliationEngine(GraphStore store, SyncSettings settings) {
        this(store, settings, new MergeLedger(), new NoOpMetricsService());
    }

    public ReconciliationEngine(GraphStore store, SyncSettings settings,
                                MergeLedger mergeLedger, MetricsService metricsService) {
        this.store = store;
        this.batchSize = settings.getBatchSize();
        this.mergeLedger = mergeLedger != null ? mergeLedger : new MergeLedger();
        this.provenanceMerger = new ProvenanceMerger();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public ReconciliationResult reconcile(SyncRequest request) {
        return reconcile(request, () -> false);
    }

    /**
     * Runs every phase for {@code request}.
     *
     * @param cancelled polled before each phase and between batches
     * @throws ReconciliationException if a phase fails or the run is cancelled
     */
    public ReconciliationResult reconcile(SyncRequest request, BooleanSupplier cancelled) {
        InputSanitizer.validateVersion(request.version());
        Run run = new Run(request, cancelled);

        try (LogContext ignored = LogContext.forSync(LogContext.generateRunId(), request.version())) {
            log.info("sync.starting version={} snapshot={} deletions={} merges={}",
                    request.version(), request.snapshot(), request.deletions().size(), request.merges().size());

            run.phase(SyncPhase.CONSTRAINTS_ENSURED, () -> store.ensureConstraints());
            run.phase(SyncPhase.DELETED, () -> applyDeletions(run));
            run.phase(SyncPhase.MERGED, () -> applyMerges(run));
            run.phase(SyncPhase.LOADED, () -> applyLoad(run));
            run.phase(SyncPhase.SWEPT, () -> applySweep(run));
            run.phase(SyncPhase.COMMITTED, () -> store.commitVersion(request.version()));

            ReconciliationResult result = run.result();
            log.info("sync.completed result={}", result);
            return result;
        }
    }

    private void applyDeletions(Run run) {
        List<String> deletions = run.request.deletions();
        forEachBatch(run, deletions, batch -> {
            long deleted = store.deleteConcepts(batch);
            run.conceptsDeleted += deleted;
            if (deleted < batch.size()) {
                log.debug("delete.absentConcepts requested={} deleted={}", batch.size(), deleted);
            }
        });
        metricsService.recordDeleted(run.conceptsDeleted);
        log.info("delete.completed requested={} deleted={}", deletions.size(), run.conceptsDeleted);
    }

    private void applyMerges(Run run) {
        for (MergeInstruction instruction : run.request.merges()) {
            run.checkCancelled();
            MergeOutcome outcome = applyMerge(instruction, run.request.version(), run.forwarding);
            if (outcome == MergeOutcome.APPLIED) {
                run.mergesApplied++;
                metricsService.incrementMergeApplied();
            } else {
                run.mergesSkipped++;
                metricsService.incrementMergeSkipped(outcome.name());
            }
        }
        log.info("merge.completed applied={} skipped={}", run.mergesApplied, run.mergesSkipped);
    }

    /**
     * Applies one merge instruction: memberships and assertion edges of {@code old} move to the
     * concept currently holding {@code new}'s identity, then {@code old} is removed.
     *
     * @param forwarding merges applied earlier in the same run; {@code new} is resolved through it only
     */
    MergeOutcome applyMerge(MergeInstruction instruction, String version, MergeLedger forwarding) {
        String oldCui = instruction.oldCui();
        String target = forwarding.resolve(instruction.newCui());

        MergeOutcome outcome;
        if (oldCui.equals(target)) {
            outcome = MergeOutcome.SKIPPED_SELF;
        } else if (!store.conceptExists(oldCui)) {
            outcome = MergeOutcome.SKIPPED_MISSING_OLD;
        } else if (!store.conceptExists(target)) {
            log.warn("merge.targetMissing oldCui={} newCui={} resolvedCui={}", oldCui, instruction.newCui(), target);
            outcome = MergeOutcome.SKIPPED_MISSING_TARGET;
        } else {
            List<CodeMembership> memberships = new ArrayList<>();
            for (CodeMembership membership : store.findMemberships(oldCui)) {
                memberships.add(membership.withCui(target));
            }
            store.mergeMemberships(memberships);

            List<AssertionEdge> repointed = new ArrayList<>();
            for (AssertionEdge edge : store.findAssertions(oldCui)) {
                repointed.add(edge.repoint(oldCui, target));
            }
            store.mergeAssertions(provenanceMerger.collapse(repointed));

            store.deleteConcepts(List.of(oldCui));
            log.debug("merge.applied oldCui={} newCui={} resolvedCui={} memberships={} assertions={}",
                    oldCui, instruction.newCui(), target, memberships.size(), repointed.size());
            outcome = MergeOutcome.APPLIED;
        }

        MergeRecord mergeRecord = new MergeRecord(oldCui, instruction.newCui(), target, version, outcome, Instant.now());
        forwarding.record(mergeRecord);
        mergeLedger.record(mergeRecord);
        return outcome;
    }

    private void applyLoad(Run run) {
        ExtractedSnapshot snapshot = run.request.snapshot();
        String version = run.request.version();

        forEachBatch(run, snapshot.concepts(), batch -> store.upsertConcepts(batch, version));
        forEachBatch(run, snapshot.codes(), batch -> store.upsertCodes(batch, version));
        forEachBatch(run, snapshot.memberships(), batch -> store.upsertMemberships(batch, version));
        forEachBatch(run, snapshot.assertions(), batch -> store.upsertAssertions(batch, version));

        run.conceptsLoaded = snapshot.concepts().size();
        run.codesLoaded = snapshot.codes().size();
        run.membershipsLoaded = snapshot.memberships().size();
        run.assertionsLoaded = snapshot.assertions().size();
        log.info("load.completed concepts={} codes={} memberships={} assertions={}",
                run.conceptsLoaded, run.codesLoaded, run.membershipsLoaded, run.assertionsLoaded);
    }

    private void applySweep(Run run) {
        String version = run.request.version();
        run.staleAssertions = sweep(run, "assertion", () -> store.deleteStaleAssertions(version, batchSize));
        run.staleMemberships = sweep(run, "membership", () -> store.deleteStaleMemberships(version, batchSize));
        run.staleCodes = sweep(run, "code", () -> store.deleteStaleCodes(version, batchSize));
        log.info("sweep.completed assertions={} memberships={} codes={}",
                run.staleAssertions, run.staleMemberships, run.staleCodes);
    }

    private long sweep(Run run, String kind, BatchDeletion deletion) {
        long total = 0;
        long deleted;
        do {
            run.checkCancelled();
            deleted = deletion.deleteBatch();
            total += deleted;
            if (deleted > 0) {
                log.debug("sweep.batch kind={} batch={} total={}", kind, deleted, total);
            }
        } while (deleted >= batchSize);
        metricsService.recordSwept(kind, total);
        return total;
    }

    private <T> void forEachBatch(Run run, List<T> items, Consumer<List<T>> action) {
        for (int start = 0; start < items.size(); start += batchSize) {
            run.checkCancelled();
            List<T> batch = items.subList(start, Math.min(start + batchSize, items.size()));
            metricsService.recordBatchSize(batch.size());
            action.accept(batch);
        }
    }

    /**
     * Merge history across every run of this engine. Only used for auditing; merges are
     * resolved against the current run.
     */
    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    @FunctionalInterface
    private interface BatchDeletion {
        long deleteBatch();
    }

    /**
     * Mutable state of one run, owned by the calling thread.
     */
    private final class Run {
        private final SyncRequest request;
        private final BooleanSupplier cancelled;
        private final Instant started = Instant.now();
        private final MergeLedger forwarding = new MergeLedger();
        private SyncPhase lastCompleted = SyncPhase.INIT;
        private SyncPhase current = SyncPhase.INIT;

        private long conceptsDeleted;
        private long mergesApplied;
        private long mergesSkipped;
        private long conceptsLoaded;
        private long codesLoaded;
        private long membershipsLoaded;
        private long assertionsLoaded;
        private long staleAssertions;
        private long staleMemberships;
        private long staleCodes;

        Run(SyncRequest request, BooleanSupplier cancelled) {
            this.request = request;
            this.cancelled = cancelled != null ? cancelled : () -> false;
        }

        void phase(SyncPhase phase, Runnable body) {
            current = phase;
            try (LogContext ignored = LogContext.forPhase(phase.name())) {
                checkCancelled();
                Instant phaseStart = Instant.now();
                body.run();
                Duration elapsed = Duration.between(phaseStart, Instant.now());
                metricsService.recordPhaseDuration(phase, elapsed);
                lastCompleted = phase;
                log.info("sync.phaseCompleted phase={} durationMs={}", phase, elapsed.toMillis());
            } catch (ReconciliationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("sync.phaseFailed phase={} lastCompleted={} error={}", phase, lastCompleted, e.getMessage());
                throw new ReconciliationException(phase, lastCompleted, e);
            }
        }

        void checkCancelled() {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.warn("sync.cancelled phase={} lastCompleted={}", current, lastCompleted);
                throw new ReconciliationException(current, lastCompleted,
                        new CancellationException("Reconciliation cancelled"));
            }
        }

        ReconciliationResult result() {
            return new ReconciliationResult(request.version(), conceptsDeleted, mergesApplied, mergesSkipped,
                    conceptsLoaded, codesLoaded, membershipsLoaded, assertionsLoaded,
                    staleAssertions, staleMemberships, staleCodes,
                    Duration.between(started, Instant.now()));
        }
    }
}
