package com.umls.sync.extract;

import com.umls.sync.bulk.ProgressCallback;
import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.ExtractedSnapshot;
import com.umls.sync.core.model.RelationshipAssertion;
import com.umls.sync.core.model.TermCandidate;
import com.umls.sync.logging.LogContext;
import com.umls.sync.mapping.BiolinkMapper;
import com.umls.sync.merge.ProvenanceMerger;
import com.umls.sync.metrics.MetricsService;
import com.umls.sync.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Parallel extraction of a release directory into an {@link ExtractedSnapshot}.
 *
 * <p>Each release file is planned into byte ranges and the ranges are filtered row by row on a
 * fixed worker pool. Workers share no state: each returns an immutable {@link ChunkResult}.
 * Results are joined in plan order, then concepts are reduced in a single pass over all rows so
 * that no concept is ranked from a partial set of rows. Relationship assertions whose endpoints
 * did not survive reduction are dropped before provenance aggregation.</p>
 *
 * <p>A failing chunk does not stop its siblings; once every chunk has finished the extraction
 * fails if any chunk failed. Cancellation is honoured between chunks and never yields partial
 * output.</p>
 */
public class ExtractionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExtractionCoordinator.class);

    public static final String NAMES_FILE = "MRCONSO.RRF";
    public static final String RELATIONSHIPS_FILE = "MRREL.RRF";
    public static final String SEMANTIC_TYPES_FILE = "MRSTY.RRF";

    private final SyncSettings settings;
    private final ChunkPlanner planner;
    private final RrfChunkReader reader;
    private final RecordFilter recordFilter;
    private final RelationshipExtractor relationshipExtractor;
    private final EntityReducer reducer;
    private final SemanticTypeReader semanticTypeReader;
    private final ProvenanceMerger provenanceMerger;
    private final MetricsService metricsService;

    public ExtractionCoordinator(SyncSettings settings) {
        this(settings, new NoOpMetricsService());
    }

    public ExtractionCoordinator(SyncSettings settings, MetricsService metricsService) {
        this.settings = settings;
        this.planner = new ChunkPlanner();
        this.reader = new RrfChunkReader();
        this.recordFilter = new RecordFilter(settings);
        this.relationshipExtractor = new RelationshipExtractor(settings);
        this.reducer = new EntityReducer(settings);
        this.semanticTypeReader = new SemanticTypeReader();
        this.provenanceMerger = new ProvenanceMerger();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public ExtractionResult extract(Path metaDir) {
        return extract(metaDir, () -> false, ProgressCallback.NOOP);
    }

    /**
     * Extracts MRCONSO, MRREL and MRSTY from {@code metaDir}.
     *
     * @param metaDir   directory holding the release files
     * @param cancelled polled between chunks; extraction stops when it returns {@code true}
     * @param callback  receives one notification per finished chunk
     * @throws SourceUnavailableException if a required file is missing
     * @throws ExtractionException        if a chunk fails or extraction is cancelled
     */
    public ExtractionResult extract(Path metaDir, BooleanSupplier cancelled, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        log.info("extraction.starting metaDir={} workers={} settings={}", metaDir, settings.getWorkers(), settings);

        Map<String, Set<BiolinkCategory>> categories = semanticTypeReader.read(metaDir.resolve(SEMANTIC_TYPES_FILE));

        ExecutorService pool = Executors.newFixedThreadPool(settings.getWorkers(), workerThreadFactory());
        try {
            List<ChunkResult<TermCandidate>> nameChunks =
                    runChunks(pool, metaDir.resolve(NAMES_FILE), recordFilter, cancelled, cb);
            List<ChunkResult<RelationshipAssertion>> relationshipChunks =
                    runChunks(pool, metaDir.resolve(RELATIONSHIPS_FILE), relationshipExtractor, cancelled, cb);

            ExtractionStats nameStats = ExtractionStats.of(NAMES_FILE, nameChunks);
            ExtractionStats relationshipStats = ExtractionStats.of(RELATIONSHIPS_FILE, relationshipChunks);
            metricsService.recordExtraction(nameStats);
            metricsService.recordExtraction(relationshipStats);

            ReducedConcepts reduced = reducer.reduce(flatten(nameChunks), categories);

            Set<String> survivingCuis = reduced.cuis();
            List<RelationshipAssertion> assertions = new ArrayList<>();
            long dangling = 0;
            for (ChunkResult<RelationshipAssertion> chunk : relationshipChunks) {
                for (RelationshipAssertion assertion : chunk.rows()) {
                    if (survivingCuis.contains(assertion.sourceCui())
                            && survivingCuis.contains(assertion.targetCui())) {
                        assertions.add(assertion);
                    } else {
                        dangling++;
                    }
                }
            }
            List<AssertionEdge> edges = provenanceMerger.aggregate(assertions, BiolinkMapper::predicateFor);

            ExtractedSnapshot snapshot = new ExtractedSnapshot(
                    reduced.concepts(), reduced.codes(), reduced.memberships(), edges);
            ExtractionResult result = new ExtractionResult(snapshot, nameStats, relationshipStats, dangling);
            log.info("extraction.completed result={}", result);
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Plans {@code file}, filters every range on the pool and returns the chunk results in plan order.
     */
    <T> List<ChunkResult<T>> runChunks(ExecutorService pool, Path file, RowMapper<T> mapper,
                                       BooleanSupplier cancelled, ProgressCallback callback) {
        String fileName = file.getFileName().toString();
        try (LogContext ignored = LogContext.forExtraction(fileName)) {
            List<ByteRange> ranges = planner.plan(file, settings.getWorkers() * settings.getChunksPerWorker());
            log.info("extraction.fileStarting file={} chunks={}", fileName, ranges.size());

            List<Future<ChunkResult<T>>> futures = new ArrayList<>(ranges.size());
            for (int i = 0; i < ranges.size(); i++) {
                final int index = i;
                final ByteRange range = ranges.get(i);
                futures.add(pool.submit(() -> {
                    if (cancelled.getAsBoolean()) {
                        throw new CancellationException("Extraction cancelled before chunk " + index);
                    }
                    return reader.read(file, index, range, mapper);
                }));
            }

            List<ChunkResult<T>> results = new ArrayList<>(ranges.size());
            List<Throwable> failures = new ArrayList<>();
            boolean cancellation = false;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                    callback.onProgress(i + 1, futures.size(), fileName);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(f -> f.cancel(true));
                    throw new ExtractionException("Extraction of " + fileName + " interrupted",
                            new CancellationException("interrupted"));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof CancellationException) {
                        cancellation = true;
                    } else {
                        log.error("extraction.chunkFailed file={} chunk={} range={} error={}",
                                fileName, i, ranges.get(i), cause.getMessage());
                        failures.add(cause);
                    }
                }
            }

            if (cancellation || cancelled.getAsBoolean()) {
                log.warn("extraction.cancelled file={}", fileName);
                throw new ExtractionException("Extraction of " + fileName + " cancelled",
                        new CancellationException("cancelled"));
            }
            if (!failures.isEmpty()) {
                ExtractionException failure = new ExtractionException(
                        failures.size() + " of " + ranges.size() + " chunks of " + fileName + " failed",
                        failures.get(0));
                for (int i = 1; i < failures.size(); i++) {
                    failure.addSuppressed(failures.get(i));
                }
                throw failure;
            }

            log.info("extraction.fileCompleted stats={}", ExtractionStats.of(fileName, results));
            return results;
        }
    }

    private static <T> List<T> flatten(List<ChunkResult<T>> chunks) {
        int size = 0;
        for (ChunkResult<T> chunk : chunks) {
            size += chunk.rows().size();
        }
        List<T> rows = new ArrayList<>(size);
        for (ChunkResult<T> chunk : chunks) {
            rows.addAll(chunk.rows());
        }
        return rows;
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "umls-extract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
