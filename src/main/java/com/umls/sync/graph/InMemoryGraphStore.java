package com.umls.sync.graph;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.merge.ProvenanceMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * {@link GraphStore} held in memory, with the same keyed-upsert semantics as the Cypher store.
 * Used for dry runs and tests. All methods are synchronized.
 */
public class InMemoryGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final Map<String, Concept> concepts = new LinkedHashMap<>();
    private final Map<String, Code> codes = new LinkedHashMap<>();
    private final Map<CodeMembership.Key, CodeMembership> memberships = new LinkedHashMap<>();
    private final Map<AssertionEdge.Key, AssertionEdge> assertions = new LinkedHashMap<>();
    private final ProvenanceMerger provenanceMerger = new ProvenanceMerger();
    private String version;

    @Override
    public synchronized void ensureConstraints() {
        log.debug("In-memory store keys are unique by construction");
    }

    @Override
    public synchronized boolean conceptExists(String cui) {
        return concepts.containsKey(cui);
    }

    @Override
    public synchronized Optional<Concept> findConcept(String cui) {
        return Optional.ofNullable(concepts.get(cui));
    }

    @Override
    public synchronized long deleteConcepts(List<String> cuis) {
        long deleted = 0;
        for (String cui : cuis) {
            if (concepts.remove(cui) != null) {
                deleted++;
                memberships.values().removeIf(m -> m.cui().equals(cui));
                assertions.values().removeIf(e -> e.sourceCui().equals(cui) || e.targetCui().equals(cui));
            }
        }
        return deleted;
    }

    @Override
    public synchronized void upsertConcepts(List<Concept> batch, String version) {
        for (Concept concept : batch) {
            concepts.put(concept.cui(), concept.withVersion(version));
        }
    }

    @Override
    public synchronized void upsertCodes(List<Code> batch, String version) {
        for (Code code : batch) {
            codes.put(code.codeId(), code.withVersion(version));
        }
    }

    @Override
    public synchronized void upsertMemberships(List<CodeMembership> batch, String version) {
        for (CodeMembership membership : batch) {
            if (endpointsExist(membership)) {
                memberships.put(membership.key(), membership.withVersion(version));
            }
        }
    }

    @Override
    public synchronized void mergeMemberships(List<CodeMembership> batch) {
        for (CodeMembership membership : batch) {
            if (endpointsExist(membership)) {
                memberships.putIfAbsent(membership.key(), membership);
            }
        }
    }

    @Override
    public synchronized void upsertAssertions(List<AssertionEdge> batch, String version) {
        for (AssertionEdge edge : batch) {
            if (endpointsExist(edge)) {
                AssertionEdge stored = assertions.get(edge.key());
                AssertionEdge merged = stored == null ? edge : provenanceMerger.merge(stored, edge);
                assertions.put(edge.key(), merged.withVersion(version));
            }
        }
    }

    @Override
    public synchronized void mergeAssertions(List<AssertionEdge> batch) {
        for (AssertionEdge edge : batch) {
            if (endpointsExist(edge)) {
                assertions.merge(edge.key(), edge, provenanceMerger::merge);
            }
        }
    }

    @Override
    public synchronized List<CodeMembership> findMemberships(String cui) {
        List<CodeMembership> found = new ArrayList<>();
        for (CodeMembership membership : memberships.values()) {
            if (membership.cui().equals(cui)) {
                found.add(membership);
            }
        }
        return found;
    }

    @Override
    public synchronized List<AssertionEdge> findAssertions(String cui) {
        List<AssertionEdge> found = new ArrayList<>();
        for (AssertionEdge edge : assertions.values()) {
            if (edge.sourceCui().equals(cui) || edge.targetCui().equals(cui)) {
                found.add(edge);
            }
        }
        return found;
    }

    @Override
    public synchronized long deleteStaleAssertions(String version, int batchSize) {
        return removeStale(assertions, e -> !version.equals(e.lastSeenVersion()), batchSize);
    }

    @Override
    public synchronized long deleteStaleMemberships(String version, int batchSize) {
        return removeStale(memberships, m -> !version.equals(m.lastSeenVersion()), batchSize);
    }

    @Override
    public synchronized long deleteStaleCodes(String version, int batchSize) {
        List<String> stale = new ArrayList<>();
        for (Code code : codes.values()) {
            if (stale.size() >= batchSize) {
                break;
            }
            if (!version.equals(code.lastSeenVersion())) {
                stale.add(code.codeId());
            }
        }
        for (String codeId : stale) {
            codes.remove(codeId);
            memberships.values().removeIf(m -> m.codeId().equals(codeId));
        }
        return stale.size();
    }

    @Override
    public synchronized Optional<String> currentVersion() {
        return Optional.ofNullable(version);
    }

    @Override
    public synchronized void commitVersion(String version) {
        this.version = version;
    }

    @Override
    public synchronized GraphStats stats() {
        return new GraphStats(concepts.size(), codes.size(), memberships.size(), assertions.size());
    }

    public synchronized Optional<Code> findCode(String codeId) {
        return Optional.ofNullable(codes.get(codeId));
    }

    public synchronized List<Concept> concepts() {
        return List.copyOf(concepts.values());
    }

    public synchronized List<Code> codes() {
        return List.copyOf(codes.values());
    }

    public synchronized List<CodeMembership> memberships() {
        return List.copyOf(memberships.values());
    }

    public synchronized List<AssertionEdge> assertions() {
        return List.copyOf(assertions.values());
    }

    @Override
    public void close() {
        // nothing to release
    }

    private boolean endpointsExist(CodeMembership membership) {
        return concepts.containsKey(membership.cui()) && codes.containsKey(membership.codeId());
    }

    private boolean endpointsExist(AssertionEdge edge) {
        return concepts.containsKey(edge.sourceCui()) && concepts.containsKey(edge.targetCui());
    }

    private static <K, V> long removeStale(Map<K, V> records, Predicate<V> stale, int batchSize) {
        long removed = 0;
        Iterator<V> it = records.values().iterator();
        while (it.hasNext() && removed < batchSize) {
            if (stale.test(Objects.requireNonNull(it.next()))) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
