package com.umls.sync.integration;

import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.BiolinkPredicate;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.ExtractedSnapshot;
import com.umls.sync.core.model.MergeInstruction;
import com.umls.sync.core.model.Predicate;
import com.umls.sync.graph.CypherGraphStore;
import com.umls.sync.graph.FalkorDBConnection;
import com.umls.sync.graph.GraphStats;
import com.umls.sync.reconcile.ReconciliationEngine;
import com.umls.sync.reconcile.ReconciliationResult;
import com.umls.sync.reconcile.SyncRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reconciliation against a live FalkorDB instance.
 */
@Tag("integration")
class CypherGraphStoreIT extends AbstractFalkorDBIntegrationTest {

    private static final Predicate TREATS = Predicate.of(BiolinkPredicate.TREATS);

    private FalkorDBConnection connection;
    private CypherGraphStore store;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        connection = createConnection("umls-sync");
        store = new CypherGraphStore(connection);
        engine = new ReconciliationEngine(store, SyncSettings.builder().batchSize(2).build());
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private static ExtractedSnapshot versionOne() {
        return new ExtractedSnapshot(
                List.of(new Concept("A", "Aspirin", Set.of(BiolinkCategory.DRUG)),
                        new Concept("B", "ASA", Set.of(BiolinkCategory.CHEMICAL_ENTITY)),
                        new Concept("C", "Acetylsalicylic acid", Set.of(BiolinkCategory.DRUG)),
                        new Concept("D", "Headache", Set.of(BiolinkCategory.SIGN_OR_SYMPTOM))),
                List.of(new Code("MSH:DA", "MSH", "Aspirin"),
                        new Code("MSH:DC", "MSH", "Acetylsalicylic acid"),
                        new Code("MSH:OLD", "MSH", "Obsolete")),
                List.of(new CodeMembership("A", "MSH:DA"),
                        new CodeMembership("C", "MSH:DC"),
                        new CodeMembership("D", "MSH:OLD")),
                List.of(AssertionEdge.of("A", "D", "treats", TREATS, List.of("MSH")),
                        AssertionEdge.of("C", "D", "treats", TREATS, List.of("RXNORM"))));
    }

    private static ExtractedSnapshot versionTwo() {
        return new ExtractedSnapshot(
                List.of(new Concept("C", "Aspirin", Set.of(BiolinkCategory.DRUG)),
                        new Concept("D", "Headache", Set.of(BiolinkCategory.SIGN_OR_SYMPTOM, BiolinkCategory.DISEASE))),
                List.of(new Code("MSH:DA", "MSH", "Aspirin"), new Code("MSH:DC", "MSH", "Acetylsalicylic acid")),
                List.of(new CodeMembership("C", "MSH:DA"), new CodeMembership("C", "MSH:DC")),
                List.of(AssertionEdge.of("C", "D", "treats", TREATS, List.of("RXNORM"))));
    }

    @Test
    @DisplayName("Should load a snapshot and commit the version marker")
    void loadsSnapshot() {
        engine.reconcile(SyncRequest.of("2024AB", versionOne()));

        assertEquals(new GraphStats(4, 3, 3, 2), store.stats());
        assertEquals("2024AB", store.currentVersion().orElseThrow());
        Concept a = store.findConcept("A").orElseThrow();
        assertEquals("Aspirin", a.preferredName());
        assertEquals(Set.of(BiolinkCategory.DRUG), a.categories());
    }

    @Test
    @DisplayName("Re-running the same version should not change the graph")
    void idempotent() {
        engine.reconcile(SyncRequest.of("2024AB", versionOne()));
        GraphStats first = store.stats();

        ReconciliationResult second = engine.reconcile(SyncRequest.of("2024AB", versionOne()));

        assertEquals(first, store.stats());
        assertEquals(0, second.totalSwept());
        assertEquals(Set.of("RXNORM"), store.findAssertions("C").get(0).assertedBy());
    }

    @Test
    @DisplayName("findAssertions should return outgoing, incoming and self-loop edges exactly once")
    void findsEdgesInBothDirections() {
        engine.reconcile(SyncRequest.of("2024AB", new ExtractedSnapshot(
                List.of(new Concept("A", "Aspirin", Set.of()),
                        new Concept("B", "Fever", Set.of()),
                        new Concept("D", "Headache", Set.of())),
                List.of(), List.of(),
                List.of(AssertionEdge.of("A", "D", "treats", TREATS, List.of("MSH")),
                        AssertionEdge.of("D", "B", "treats", TREATS, List.of("MSH")),
                        AssertionEdge.of("D", "D", "treats", TREATS, List.of("MSH")),
                        AssertionEdge.of("A", "B", "treats", TREATS, List.of("MSH"))))));

        List<AssertionEdge> edges = store.findAssertions("D");

        assertEquals(3, edges.size());
        assertEquals(Set.of("A->D", "D->B", "D->D"), Set.copyOf(edges.stream()
                .map(e -> e.sourceCui() + "->" + e.targetCui())
                .toList()));
    }

    @Test
    @DisplayName("Should chase merges, union provenance and sweep stale records")
    void upgradesWithMergesAndSweep() {
        engine.reconcile(SyncRequest.of("2024AB", versionOne()));

        ReconciliationResult result = engine.reconcile(new SyncRequest("2025AA", versionTwo(), List.of(),
                List.of(new MergeInstruction("A", "B"), new MergeInstruction("B", "C"))));

        assertEquals(2, result.mergesApplied());
        assertFalse(store.conceptExists("A"));
        assertFalse(store.conceptExists("B"));
        assertEquals(2, store.findMemberships("C").size());

        List<AssertionEdge> edges = store.findAssertions("D");
        assertEquals(1, edges.size());
        assertEquals("C", edges.get(0).sourceCui());
        assertEquals(Set.of("MSH", "RXNORM"), edges.get(0).assertedBy());
        assertEquals("2025AA", edges.get(0).lastSeenVersion());

        assertEquals(new GraphStats(2, 2, 2, 1), store.stats());
        assertEquals(Set.of(BiolinkCategory.SIGN_OR_SYMPTOM, BiolinkCategory.DISEASE),
                store.findConcept("D").orElseThrow().categories());
        assertEquals("2025AA", store.currentVersion().orElseThrow());
    }

    @Test
    @DisplayName("Deleting concepts should detach their edges and ignore absent CUIs")
    void deletesConcepts() {
        engine.reconcile(SyncRequest.of("2024AB", versionOne()));

        assertEquals(1, store.deleteConcepts(List.of("D", "ZZZ")));

        assertTrue(store.findAssertions("A").isEmpty());
        assertTrue(store.findMemberships("D").isEmpty());
    }

    @Test
    @DisplayName("Category labels should follow the concept's categories")
    void categoryLabels() {
        engine.reconcile(SyncRequest.of("2024AB", versionOne()));
        engine.reconcile(SyncRequest.of("2025AA", versionTwo()));

        List<Map<String, Object>> diseases = connection.query(
                "MATCH (c:`biolink:Disease`) RETURN c.cui as cui");
        List<Map<String, Object>> drugs = connection.query(
                "MATCH (c:`biolink:Drug`) RETURN c.cui as cui");
        List<Map<String, Object>> chemicals = connection.query(
                "MATCH (c:`biolink:ChemicalEntity`) RETURN c.cui as cui");

        assertEquals(List.of("D"), diseases.stream().map(r -> r.get("cui").toString()).toList());
        assertEquals(List.of("C"), drugs.stream().map(r -> r.get("cui").toString()).toList());
        assertTrue(chemicals.isEmpty());
    }
}
