package com.umls.sync.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MergeLedger Tests")
class MergeLedgerTest {

    private MergeLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MergeLedger();
    }

    private MergeRecord applied(String oldCui, String newCui) {
        return ledger.record(new MergeRecord(oldCui, newCui, newCui, "2025AA", MergeOutcome.APPLIED, null));
    }

    @Test
    @DisplayName("Resolve should follow applied merges to the surviving concept")
    void resolveFollowsChain() {
        applied("A", "B");
        applied("B", "C");

        assertEquals("C", ledger.resolve("A"));
        assertEquals("C", ledger.resolve("B"));
        assertEquals("C", ledger.resolve("C"));
        assertEquals("X", ledger.resolve("X"));
    }

    @Test
    @DisplayName("Skipped merges should not forward")
    void skippedMergesDoNotForward() {
        ledger.record(new MergeRecord("A", "Z", "Z", "2025AA", MergeOutcome.SKIPPED_MISSING_TARGET, null));

        assertEquals("A", ledger.resolve("A"));
        assertEquals(1, ledger.count(MergeOutcome.SKIPPED_MISSING_TARGET));
    }

    @Test
    @DisplayName("Resolve should stop on a forwarding cycle")
    void resolveStopsOnCycle() {
        applied("A", "B");
        applied("B", "A");

        assertDoesNotThrow(() -> ledger.resolve("A"));
        assertEquals("B", ledger.resolve("A"));
    }

    @Test
    @DisplayName("Should record timestamps and filter by outcome")
    void recordsAndFilters() {
        applied("A", "B");
        ledger.record(new MergeRecord("X", "A", "B", "2025AA", MergeOutcome.SKIPPED_MISSING_OLD, null));

        assertEquals(2, ledger.size());
        assertNotNull(ledger.getAllRecords().get(0).timestamp());
        assertEquals(1, ledger.getRecordsByOutcome(MergeOutcome.APPLIED).size());
        assertTrue(ledger.getAllRecords().get(0).applied());
    }

    @Test
    @DisplayName("Merge chain should list every concept merged into a survivor")
    void mergeChain() {
        applied("A", "B");
        applied("B", "C");
        applied("D", "C");

        List<String> chain = ledger.getMergeChain("C");

        assertEquals(3, chain.size());
        assertTrue(chain.containsAll(List.of("A", "B", "D")));
    }
}
