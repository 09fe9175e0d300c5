package com.umls.sync.api;

import com.umls.sync.audit.MergeLedger;
import com.umls.sync.bulk.CsvSnapshotWriter;
import com.umls.sync.bulk.ProgressCallback;
import com.umls.sync.bulk.SnapshotManifest;
import com.umls.sync.bulk.SnapshotWriteResult;
import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.MergeInstruction;
import com.umls.sync.extract.ChangeListReader;
import com.umls.sync.extract.ExtractionCoordinator;
import com.umls.sync.extract.ExtractionResult;
import com.umls.sync.graph.CypherGraphStore;
import com.umls.sync.graph.FalkorDBConnection;
import com.umls.sync.graph.GraphConnection;
import com.umls.sync.graph.GraphStats;
import com.umls.sync.graph.GraphStore;
import com.umls.sync.graph.InputSanitizer;
import com.umls.sync.metrics.MetricsService;
import com.umls.sync.metrics.NoOpMetricsService;
import com.umls.sync.reconcile.ReconciliationEngine;
import com.umls.sync.reconcile.ReconciliationResult;
import com.umls.sync.reconcile.SyncRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Main entry point for synchronizing a UMLS release into a graph.
 *
 * <pre>
 * try (UmlsSyncer syncer = UmlsSyncer.builder()
 *         .settings(SyncSettings.load())
 *         .falkorDB("localhost", 6379, "umls")
 *         .build()) {
 *     ReconciliationResult result = syncer.incrementalSync(metaDir, "2025AA", importDir);
 * }
 * </pre>
 *
 * <p>Workflows:</p>
 * <ul>
 *   <li>{@link #fullImport}: writes the bulk-import files and command for an empty database</li>
 *   <li>{@link #initMeta}: after the bulk import, creates indexes and records the version</li>
 *   <li>{@link #incrementalSync}: reconciles a versioned graph with a new release</li>
 *   <li>{@link #bootstrap}: loads a release straight into the store, without bulk files</li>
 * </ul>
 */
public class UmlsSyncer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UmlsSyncer.class);

    public static final String DELETED_CUIS_FILE = "DELETEDCUI.RRF";
    public static final String MERGED_CUIS_FILE = "MERGEDCUI.RRF";

    private final SyncSettings settings;
    private final GraphStore store;
    private final boolean ownsStore;
    private final ExtractionCoordinator coordinator;
    private final ChangeListReader changeListReader;
    private final CsvSnapshotWriter snapshotWriter;
    private final ReconciliationEngine engine;
    private final BooleanSupplier cancelled;
    private final ProgressCallback progressCallback;

    private UmlsSyncer(Builder builder) {
        this.settings = builder.settings;
        this.store = builder.store;
        this.ownsStore = builder.ownsStore;
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.coordinator = new ExtractionCoordinator(settings, metrics);
        this.changeListReader = new ChangeListReader();
        this.snapshotWriter = new CsvSnapshotWriter(settings.getGraphName());
        this.engine = store != null
                ? new ReconciliationEngine(store, settings, builder.mergeLedger, metrics)
                : null;
        this.cancelled = builder.cancelled;
        this.progressCallback = builder.progressCallback;
    }

    /**
     * Extracts the release in {@code metaDir} without touching the store.
     */
    public ExtractionResult extract(Path metaDir) {
        return coordinator.extract(metaDir, cancelled, progressCallback);
    }

    /**
     * Extracts the release and writes the bulk-import files, manifest and command to {@code importDir}.
     * Run the returned command against a stopped, empty database, then call {@link #initMeta}.
     */
    public SnapshotWriteResult fullImport(Path metaDir, String version, Path importDir) {
        InputSanitizer.validateVersion(version);
        log.info("fullImport.starting metaDir={} version={} importDir={}", metaDir, version, importDir);
        ExtractionResult extraction = extract(metaDir);
        SnapshotWriteResult result = snapshotWriter.write(extraction.snapshot(), version, importDir, progressCallback);
        log.info("fullImport.completed result={}", result);
        return result;
    }

    /**
     * Creates the indexes and records {@code version} after a bulk import.
     */
    public void initMeta(String version) {
        InputSanitizer.validateVersion(version);
        GraphStore graph = requireStore();
        graph.ensureConstraints();
        graph.commitVersion(version);
        log.info("initMeta.completed version={}", version);
    }

    /**
     * Like {@link #initMeta(String)}, first checking that the snapshot in {@code importDir}
     * was written for {@code version}.
     *
     * @throws IllegalStateException if the manifest names another version
     */
    public void initMeta(String version, Path importDir) {
        SnapshotManifest manifest = SnapshotManifest.readFrom(importDir);
        if (!version.equals(manifest.version())) {
            throw new IllegalStateException("Snapshot in " + importDir + " was written for version "
                    + manifest.version() + ", not " + version);
        }
        initMeta(version);
    }

    /**
     * Reconciles the graph with the release in {@code metaDir}.
     *
     * @param importDir when not {@code null}, the new snapshot is also written there
     * @throws IllegalStateException if the graph has no version marker yet
     */
    public ReconciliationResult incrementalSync(Path metaDir, String version, Path importDir) {
        InputSanitizer.validateVersion(version);
        GraphStore graph = requireStore();
        Optional<String> previous = graph.currentVersion();
        if (previous.isEmpty()) {
            throw new IllegalStateException(
                    "Graph has no version marker; run fullImport and initMeta before an incremental sync");
        }
        log.info("incrementalSync.starting previousVersion={} version={}", previous.get(), version);
        return synchronize(metaDir, version, importDir);
    }

    /**
     * Loads the release in {@code metaDir} into the store whatever its current state.
     * On an empty graph this is a complete import.
     */
    public ReconciliationResult bootstrap(Path metaDir, String version) {
        InputSanitizer.validateVersion(version);
        requireStore();
        log.info("bootstrap.starting version={}", version);
        return synchronize(metaDir, version, null);
    }

    private ReconciliationResult synchronize(Path metaDir, String version, Path importDir) {
        ExtractionResult extraction = extract(metaDir);
        if (importDir != null) {
            snapshotWriter.write(extraction.snapshot(), version, importDir, progressCallback);
        }
        List<String> deletions = changeListReader.readDeletions(metaDir.resolve(DELETED_CUIS_FILE));
        List<MergeInstruction> merges = changeListReader.readMerges(metaDir.resolve(MERGED_CUIS_FILE));
        SyncRequest request = new SyncRequest(version, extraction.snapshot(), deletions, merges);
        return engine.reconcile(request, cancelled);
    }

    public Optional<String> currentVersion() {
        return requireStore().currentVersion();
    }

    public GraphStats stats() {
        return requireStore().stats();
    }

    public SyncSettings getSettings() {
        return settings;
    }

    public MergeLedger getMergeLedger() {
        return engine != null ? engine.getMergeLedger() : null;
    }

    private GraphStore requireStore() {
        if (store == null) {
            throw new IllegalStateException("No graph store configured");
        }
        return store;
    }

    @Override
    public void close() {
        if (ownsStore && store != null) {
            store.close();
        }
        log.info("UmlsSyncer closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SyncSettings settings = SyncSettings.defaults();
        private GraphStore store;
        private boolean ownsStore = false;
        private MetricsService metricsService;
        private MergeLedger mergeLedger;
        private BooleanSupplier cancelled = () -> false;
        private ProgressCallback progressCallback = ProgressCallback.NOOP;

        public Builder settings(SyncSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Uses a store managed by the caller.
         */
        public Builder graphStore(GraphStore store) {
            this.store = store;
            this.ownsStore = false;
            return this;
        }

        /**
         * Uses a Cypher store over a connection managed by the caller.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.store = new CypherGraphStore(connection);
            this.ownsStore = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned by the syncer.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.store = new CypherGraphStore(new FalkorDBConnection(host, port, graphName));
            this.ownsStore = true;
            return this;
        }

        /**
         * Creates a FalkorDB connection from the host, port and graph name of the current settings.
         */
        public Builder falkorDBFromSettings() {
            return falkorDB(settings.getHost(), settings.getPort(), settings.getGraphName());
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
            return this;
        }

        /**
         * Polled between extraction chunks, reconciliation phases and batches.
         */
        public Builder cancellation(BooleanSupplier cancelled) {
            this.cancelled = cancelled != null ? cancelled : () -> false;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback != null ? progressCallback : ProgressCallback.NOOP;
            return this;
        }

        public UmlsSyncer build() {
            if (settings == null) {
                throw new IllegalStateException("settings are required");
            }
            return new UmlsSyncer(this);
        }
    }
}
