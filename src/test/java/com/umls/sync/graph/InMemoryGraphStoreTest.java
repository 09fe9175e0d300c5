package com.umls.sync.graph;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkPredicate;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryGraphStore Tests")
class InMemoryGraphStoreTest {

    private static final Predicate TREATS = Predicate.of(BiolinkPredicate.TREATS);

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.upsertConcepts(List.of(
                new Concept("C1", "Aspirin", Set.of()),
                new Concept("C2", "Pain", Set.of())), "v1");
        store.upsertCodes(List.of(new Code("MSH:D1", "MSH", "Aspirin")), "v1");
    }

    @Test
    @DisplayName("Edges with a missing endpoint should not be written")
    void missingEndpointsAreNoOps() {
        store.upsertMemberships(List.of(new CodeMembership("C9", "MSH:D1")), "v1");
        store.upsertMemberships(List.of(new CodeMembership("C1", "MSH:D9")), "v1");
        store.upsertAssertions(List.of(AssertionEdge.of("C1", "C9", "treats", TREATS, List.of("MSH"))), "v1");

        assertEquals(new GraphStats(2, 1, 0, 0), store.stats());
    }

    @Test
    @DisplayName("Upserting an assertion should union provenance and restamp the version")
    void upsertAssertionUnions() {
        store.upsertAssertions(List.of(AssertionEdge.of("C1", "C2", "treats", TREATS, List.of("MSH"))), "v1");
        store.upsertAssertions(List.of(AssertionEdge.of("C1", "C2", "treats", TREATS, List.of("RXNORM"))), "v2");

        AssertionEdge edge = store.findAssertions("C1").get(0);
        assertEquals(Set.of("MSH", "RXNORM"), edge.assertedBy());
        assertEquals("v2", edge.lastSeenVersion());
    }

    @Test
    @DisplayName("Merging an assertion should keep the stored version")
    void mergeAssertionKeepsVersion() {
        store.upsertAssertions(List.of(AssertionEdge.of("C1", "C2", "treats", TREATS, List.of("MSH"))), "v1");
        store.mergeAssertions(List.of(
                AssertionEdge.of("C1", "C2", "treats", TREATS, List.of("LNC")).withVersion("v0")));

        AssertionEdge edge = store.findAssertions("C2").get(0);
        assertEquals(Set.of("LNC", "MSH"), edge.assertedBy());
        assertEquals("v1", edge.lastSeenVersion());
    }

    @Test
    @DisplayName("Deleting a concept should remove its edges and ignore absent CUIs")
    void deleteConceptRemovesEdges() {
        store.upsertMemberships(List.of(new CodeMembership("C1", "MSH:D1")), "v1");
        store.upsertAssertions(List.of(AssertionEdge.of("C2", "C1", "treats", TREATS, List.of("MSH"))), "v1");

        assertEquals(1, store.deleteConcepts(List.of("C1", "C404")));

        assertEquals(new GraphStats(1, 1, 0, 0), store.stats());
    }

    @Test
    @DisplayName("Stale deletes should respect the batch size")
    void staleDeletesAreBatched() {
        store.upsertCodes(List.of(
                new Code("MSH:D2", "MSH", "b"),
                new Code("MSH:D3", "MSH", "c")), "v1");
        store.upsertCodes(List.of(new Code("MSH:D4", "MSH", "d")), "v2");

        assertEquals(2, store.deleteStaleCodes("v2", 2));
        assertEquals(1, store.deleteStaleCodes("v2", 2));
        assertEquals(0, store.deleteStaleCodes("v2", 2));
        assertEquals(List.of("MSH:D4"), store.codes().stream().map(Code::codeId).toList());
    }

    @Test
    @DisplayName("Deleting a stale code should remove its memberships")
    void staleCodeRemovesMemberships() {
        store.upsertMemberships(List.of(new CodeMembership("C1", "MSH:D1")), "v2");

        store.deleteStaleCodes("v2", 10);

        assertTrue(store.memberships().isEmpty());
    }

    @Test
    @DisplayName("Version marker should be empty until committed")
    void versionMarker() {
        assertTrue(store.currentVersion().isEmpty());

        store.commitVersion("v1");

        assertEquals("v1", store.currentVersion().orElseThrow());
    }
}
