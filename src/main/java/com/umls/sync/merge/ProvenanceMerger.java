package com.umls.sync.merge;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.Predicate;
import com.umls.sync.core.model.RelationshipAssertion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Relationship-merge rule: assertions that share an {@link AssertionEdge.Key} collapse into a
 * single edge whose provenance is the union of the asserting sources.
 *
 * <p>The key includes the relation label, so two assertions that map to the same predicate
 * from different labels stay separate edges.</p>
 */
public class ProvenanceMerger {

    /**
     * Reduces raw relationship assertions into provenance-bearing edges, in first-seen order.
     *
     * @param assertions raw assertions, one per relationship row
     * @param predicates maps a relation label to the predicate of the edge
     */
    public List<AssertionEdge> aggregate(Collection<RelationshipAssertion> assertions,
                                         Function<String, Predicate> predicates) {
        Map<String, Predicate> predicateCache = new LinkedHashMap<>();
        Map<AssertionEdge.Key, AssertionEdge> edges = new LinkedHashMap<>();
        for (RelationshipAssertion assertion : assertions) {
            Predicate predicate = predicateCache.computeIfAbsent(assertion.relationLabel(), predicates);
            AssertionEdge edge = AssertionEdge.of(assertion.sourceCui(), assertion.targetCui(),
                    assertion.relationLabel(), predicate, List.of(assertion.source()));
            edges.merge(edge.key(), edge, this::merge);
        }
        return new ArrayList<>(edges.values());
    }

    /**
     * Collapses edges sharing a key, for example after re-pointing a merged concept's edges.
     */
    public List<AssertionEdge> collapse(Collection<AssertionEdge> edges) {
        Map<AssertionEdge.Key, AssertionEdge> collapsed = new LinkedHashMap<>();
        for (AssertionEdge edge : edges) {
            collapsed.merge(edge.key(), edge, this::merge);
        }
        return new ArrayList<>(collapsed.values());
    }

    /**
     * Merges two edges with the same key. The union of both provenance sets is kept; the version
     * of {@code existing} wins when it has one.
     *
     * @throws IllegalArgumentException if the keys differ
     */
    public AssertionEdge merge(AssertionEdge existing, AssertionEdge incoming) {
        if (!existing.key().equals(incoming.key())) {
            throw new IllegalArgumentException(
                    "Cannot merge edges with different keys: " + existing.key() + " vs " + incoming.key());
        }
        String version = existing.lastSeenVersion() != null
                ? existing.lastSeenVersion()
                : incoming.lastSeenVersion();
        return new AssertionEdge(existing.sourceCui(), existing.targetCui(), existing.relationLabel(),
                existing.predicate(), union(existing.assertedBy(), incoming.assertedBy()), version);
    }

    public static SortedSet<String> union(Collection<String> left, Collection<String> right) {
        SortedSet<String> union = new TreeSet<>(left);
        union.addAll(right);
        return union;
    }
}
