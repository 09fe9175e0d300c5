package com.umls.sync.merge;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkPredicate;
import com.umls.sync.core.model.Predicate;
import com.umls.sync.core.model.RelationshipAssertion;
import com.umls.sync.mapping.BiolinkMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProvenanceMerger Tests")
class ProvenanceMergerTest {

    private final ProvenanceMerger merger = new ProvenanceMerger();
    private final Predicate treats = Predicate.of(BiolinkPredicate.TREATS);

    @Test
    @DisplayName("Assertions with the same key should collapse with unioned provenance")
    void aggregateCollapses() {
        List<AssertionEdge> edges = merger.aggregate(List.of(
                new RelationshipAssertion("C1", "C2", "treats", "MSH"),
                new RelationshipAssertion("C1", "C2", "treats", "RXNORM"),
                new RelationshipAssertion("C1", "C2", "treats", "MSH")), BiolinkMapper::predicateFor);

        assertEquals(1, edges.size());
        assertEquals(Set.of("MSH", "RXNORM"), edges.get(0).assertedBy());
        assertEquals(treats, edges.get(0).predicate());
    }

    @Test
    @DisplayName("Different labels mapping to one predicate should stay separate")
    void differentLabelsStaySeparate() {
        List<AssertionEdge> edges = merger.aggregate(List.of(
                new RelationshipAssertion("C1", "C2", "RO", "MSH"),
                new RelationshipAssertion("C1", "C2", "associated_with", "MSH")), BiolinkMapper::predicateFor);

        assertEquals(2, edges.size());
        assertEquals(edges.get(0).predicate(), edges.get(1).predicate());
    }

    @Test
    @DisplayName("Direction should be part of the key")
    void directionMatters() {
        List<AssertionEdge> edges = merger.aggregate(List.of(
                new RelationshipAssertion("C1", "C2", "treats", "MSH"),
                new RelationshipAssertion("C2", "C1", "treats", "MSH")), BiolinkMapper::predicateFor);

        assertEquals(2, edges.size());
    }

    @Test
    @DisplayName("Merge should keep the existing version when present")
    void mergeKeepsExistingVersion() {
        AssertionEdge existing = AssertionEdge.of("C1", "C2", "treats", treats, List.of("MSH")).withVersion("2024AB");
        AssertionEdge incoming = AssertionEdge.of("C1", "C2", "treats", treats, List.of("RXNORM")).withVersion("2023AA");

        AssertionEdge merged = merger.merge(existing, incoming);

        assertEquals("2024AB", merged.lastSeenVersion());
        assertEquals(Set.of("MSH", "RXNORM"), merged.assertedBy());
    }

    @Test
    @DisplayName("Merge should take the incoming version when the existing edge has none")
    void mergeTakesIncomingVersion() {
        AssertionEdge existing = AssertionEdge.of("C1", "C2", "treats", treats, List.of("MSH"));
        AssertionEdge incoming = AssertionEdge.of("C1", "C2", "treats", treats, List.of("MSH")).withVersion("2023AA");

        assertEquals("2023AA", merger.merge(existing, incoming).lastSeenVersion());
    }

    @Test
    @DisplayName("Merging edges with different keys should be rejected")
    void mergeRejectsDifferentKeys() {
        AssertionEdge a = AssertionEdge.of("C1", "C2", "treats", treats, List.of("MSH"));
        AssertionEdge b = AssertionEdge.of("C1", "C3", "treats", treats, List.of("MSH"));

        assertThrows(IllegalArgumentException.class, () -> merger.merge(a, b));
    }

    @Test
    @DisplayName("Collapse should fold re-pointed edges onto one key")
    void collapseRepointed() {
        AssertionEdge fromOld = AssertionEdge.of("OLD", "C2", "treats", treats, List.of("MSH")).repoint("OLD", "NEW");
        AssertionEdge fromNew = AssertionEdge.of("NEW", "C2", "treats", treats, List.of("SNOMEDCT_US"));

        List<AssertionEdge> collapsed = merger.collapse(List.of(fromOld, fromNew));

        assertEquals(1, collapsed.size());
        assertEquals("NEW", collapsed.get(0).sourceCui());
        assertEquals(Set.of("MSH", "SNOMEDCT_US"), collapsed.get(0).assertedBy());
    }
}
