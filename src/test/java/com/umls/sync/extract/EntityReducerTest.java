package com.umls.sync.extract;

import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.TermCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityReducer Tests")
class EntityReducerTest {

    private final EntityReducer reducer = new EntityReducer(SyncSettings.builder()
            .sourcePriority(List.of("RXNORM", "SNOMEDCT_US", "MSH"))
            .build());

    private static TermCandidate term(String cui, String sab, String code, String name,
                                      String ts, String stt, String ispref) {
        return new TermCandidate(cui, sab, code, name, ts, stt, ispref);
    }

    @Nested
    @DisplayName("Preferred name")
    class PreferredName {

        @Test
        @DisplayName("Highest-priority source should win over a better-ranked lower source")
        void prioritySourceWins() {
            TermCandidate msh = term("C1", "MSH", "D1", "Aspirin", "P", "PF", "Y");
            TermCandidate rxnorm = term("C1", "RXNORM", "1191", "aspirin", "S", "VO", "N");

            assertSame(rxnorm, reducer.selectPreferred(List.of(msh, rxnorm)));
        }

        @Test
        @DisplayName("Within a source the best rank should win")
        void bestRankWithinSource() {
            TermCandidate synonym = term("C1", "MSH", "D1", "ASA", "S", "PF", "N");
            TermCandidate preferred = term("C1", "MSH", "D1", "Aspirin", "P", "VO", "N");

            assertSame(preferred, reducer.selectPreferred(List.of(synonym, preferred)));
        }

        @Test
        @DisplayName("Ties should keep the first candidate")
        void tiesKeepFirst() {
            TermCandidate first = term("C1", "MSH", "D1", "First", "P", "PF", "Y");
            TermCandidate second = term("C1", "MSH", "D2", "Second", "P", "PF", "Y");

            assertSame(first, reducer.selectPreferred(List.of(first, second)));
        }

        @Test
        @DisplayName("Without a listed source the best rank overall should win")
        void fallbackToBestOverall() {
            TermCandidate lnc = term("C1", "LNC", "L1", "Loinc name", "S", "VO", "N");
            TermCandidate go = term("C1", "GO", "G1", "Go name", "P", "PF", "N");

            assertSame(go, reducer.selectPreferred(List.of(lnc, go)));
        }

        @Test
        @DisplayName("No candidates should be rejected")
        void emptyCandidates() {
            assertThrows(IllegalArgumentException.class, () -> reducer.selectPreferred(List.of()));
        }
    }

    @Test
    @DisplayName("Should group rows into concepts, codes and memberships")
    void groupsRows() {
        List<TermCandidate> rows = List.of(
                term("C1", "MSH", "D1", "Aspirin", "P", "PF", "Y"),
                term("C2", "MSH", "D2", "Fever", "P", "PF", "Y"),
                term("C1", "RXNORM", "1191", "aspirin", "P", "PF", "Y"),
                term("C1", "MSH", "D1", "ASA", "S", "VO", "N"));

        ReducedConcepts reduced = reducer.reduce(rows, Map.of(
                "C1", Set.of(BiolinkCategory.DRUG),
                "C2", Set.of(BiolinkCategory.SIGN_OR_SYMPTOM, BiolinkCategory.DISEASE)));

        assertEquals(List.of("C1", "C2"), reduced.concepts().stream().map(Concept::cui).toList());
        assertEquals("aspirin", reduced.concepts().get(0).preferredName());
        assertEquals(Set.of(BiolinkCategory.DRUG), reduced.concepts().get(0).categories());
        assertEquals(Set.of("C1", "C2"), reduced.cuis());

        assertEquals(3, reduced.codes().size());
        assertEquals("Aspirin", reduced.codes().stream()
                .filter(c -> c.codeId().equals("MSH:D1")).findFirst().orElseThrow().name());

        assertEquals(3, reduced.memberships().size());
        assertTrue(reduced.memberships().contains(new CodeMembership("C1", "RXNORM:1191")));
    }

    @Test
    @DisplayName("Concepts without semantic types should have no categories")
    void missingSemanticTypes() {
        ReducedConcepts reduced = reducer.reduce(
                List.of(term("C9", "MSH", "D9", "Unknown", "P", "PF", "Y")), Map.of());

        assertTrue(reduced.concepts().get(0).categories().isEmpty());
    }
}
