package com.umls.sync.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable settings for extraction and reconciliation.
 * Passed explicitly to every component; nothing reads ambient global state.
 *
 * <p>Defaults mirror {@code META-INF/microprofile-config.properties}.</p>
 */
public class SyncSettings {

    public static final String PREFIX = "umls-sync.";

    private final String targetLanguage;
    private final Set<String> includedSources;
    private final Set<String> excludedSuppressions;
    private final List<String> sourcePriority;
    private final int workers;
    private final int chunksPerWorker;
    private final int batchSize;
    private final String host;
    private final int port;
    private final String graphName;

    private SyncSettings(Builder builder) {
        this.targetLanguage = builder.targetLanguage;
        this.includedSources = Set.copyOf(builder.includedSources);
        this.excludedSuppressions = Set.copyOf(builder.excludedSuppressions);
        this.sourcePriority = List.copyOf(builder.sourcePriority);
        this.workers = builder.workers;
        this.chunksPerWorker = builder.chunksPerWorker;
        this.batchSize = builder.batchSize;
        this.host = builder.host;
        this.port = builder.port;
        this.graphName = builder.graphName;
    }

    public String getTargetLanguage() { return targetLanguage; }
    public Set<String> getIncludedSources() { return includedSources; }
    public Set<String> getExcludedSuppressions() { return excludedSuppressions; }
    public List<String> getSourcePriority() { return sourcePriority; }
    public int getWorkers() { return workers; }
    public int getChunksPerWorker() { return chunksPerWorker; }
    public int getBatchSize() { return batchSize; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getGraphName() { return graphName; }

    public static SyncSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from the MicroProfile Config of the current class loader.
     */
    public static SyncSettings load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    /**
     * Reads settings from MicroProfile Config, falling back to the builder defaults
     * for any key that is absent.
     */
    public static SyncSettings fromConfig(Config config) {
        Builder builder = builder();
        config.getOptionalValue(PREFIX + "target-language", String.class)
                .ifPresent(builder::targetLanguage);
        config.getOptionalValues(PREFIX + "included-sources", String.class)
                .ifPresent(builder::includedSources);
        config.getOptionalValues(PREFIX + "excluded-suppressions", String.class)
                .ifPresent(builder::excludedSuppressions);
        config.getOptionalValues(PREFIX + "source-priority", String.class)
                .ifPresent(builder::sourcePriority);
        config.getOptionalValue(PREFIX + "workers", Integer.class)
                .ifPresent(builder::workers);
        config.getOptionalValue(PREFIX + "chunks-per-worker", Integer.class)
                .ifPresent(builder::chunksPerWorker);
        config.getOptionalValue(PREFIX + "batch-size", Integer.class)
                .ifPresent(builder::batchSize);
        config.getOptionalValue(PREFIX + "falkordb.host", String.class)
                .ifPresent(builder::host);
        config.getOptionalValue(PREFIX + "falkordb.port", Integer.class)
                .ifPresent(builder::port);
        config.getOptionalValue(PREFIX + "falkordb.graph-name", String.class)
                .ifPresent(builder::graphName);
        return builder.build();
    }

    public static class Builder {
        private String targetLanguage = "ENG";
        private Set<String> includedSources = Set.of("RXNORM", "SNOMEDCT_US", "MTH", "MSH", "LNC");
        private Set<String> excludedSuppressions = Set.of("O", "E");
        private List<String> sourcePriority = List.of(
                "RXNORM", "SNOMEDCT_US", "MTH", "MSH", "LNC", "GO", "HGNC",
                "NCBI", "OMIM", "ICD10CM", "CPT");
        private int workers = 4;
        private int chunksPerWorker = 4;
        private int batchSize = 10_000;
        private String host = "localhost";
        private int port = 6379;
        private String graphName = "umls";

        public Builder targetLanguage(String targetLanguage) {
            if (targetLanguage == null || targetLanguage.isBlank()) {
                throw new IllegalArgumentException("targetLanguage must not be blank");
            }
            this.targetLanguage = targetLanguage;
            return this;
        }

        public Builder includedSources(Iterable<String> sources) {
            this.includedSources = toSet(sources, "includedSources");
            return this;
        }

        public Builder excludedSuppressions(Iterable<String> flags) {
            this.excludedSuppressions = toSet(flags, "excludedSuppressions");
            return this;
        }

        public Builder sourcePriority(List<String> sourcePriority) {
            if (sourcePriority == null) throw new IllegalArgumentException("sourcePriority must not be null");
            this.sourcePriority = List.copyOf(sourcePriority);
            return this;
        }

        public Builder workers(int workers) {
            if (workers <= 0) throw new IllegalArgumentException("workers must be > 0");
            this.workers = workers;
            return this;
        }

        public Builder chunksPerWorker(int chunksPerWorker) {
            if (chunksPerWorker <= 0) throw new IllegalArgumentException("chunksPerWorker must be > 0");
            this.chunksPerWorker = chunksPerWorker;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
            this.batchSize = batchSize;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder graphName(String graphName) {
            this.graphName = graphName;
            return this;
        }

        public SyncSettings build() {
            if (includedSources.isEmpty()) {
                throw new IllegalArgumentException("includedSources must not be empty");
            }
            return new SyncSettings(this);
        }

        private static Set<String> toSet(Iterable<String> values, String name) {
            if (values == null) throw new IllegalArgumentException(name + " must not be null");
            LinkedHashSet<String> set = new LinkedHashSet<>();
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    set.add(value.trim());
                }
            }
            return set;
        }
    }

    @Override
    public String toString() {
        return "SyncSettings{" +
                "targetLanguage='" + targetLanguage + '\'' +
                ", includedSources=" + includedSources +
                ", excludedSuppressions=" + excludedSuppressions +
                ", sourcePriority=" + sourcePriority +
                ", workers=" + workers +
                ", chunksPerWorker=" + chunksPerWorker +
                ", batchSize=" + batchSize +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", graphName='" + graphName + '\'' +
                '}';
    }
}
