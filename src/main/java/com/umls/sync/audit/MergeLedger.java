package com.umls.sync.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of processed merge instructions.
 *
 * <p>The reconciliation engine keeps one ledger per run to chase multi-hop merges, and a
 * long-lived one as audit history. Applied merges form a forwarding table: after
 * {@code A -> B} and {@code B -> C} have been applied, {@link #resolve(String)} of either
 * {@code A} or {@code B} returns {@code C}.</p>
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();
    private final Map<String, String> forwarding = new ConcurrentHashMap<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        if (mergeRecord.applied()) {
            forwarding.put(mergeRecord.oldCui(), mergeRecord.resolvedCui());
        }
        log.debug("merge.recorded oldCui={} newCui={} resolvedCui={} outcome={}",
                mergeRecord.oldCui(), mergeRecord.newCui(), mergeRecord.resolvedCui(), mergeRecord.outcome());
        return mergeRecord;
    }

    /**
     * Follows applied merges from {@code cui} to the concept that currently holds its identity.
     * A forwarding cycle stops at the last concept before it repeats.
     */
    public String resolve(String cui) {
        Set<String> visited = new HashSet<>();
        String current = cui;
        visited.add(current);
        String next = forwarding.get(current);
        while (next != null && visited.add(next)) {
            current = next;
            next = forwarding.get(current);
        }
        return current;
    }

    public List<MergeRecord> getAllRecords() {
        return List.copyOf(records);
    }

    public List<MergeRecord> getRecordsByOutcome(MergeOutcome outcome) {
        return records.stream()
                .filter(r -> r.outcome() == outcome)
                .collect(Collectors.toList());
    }

    public long count(MergeOutcome outcome) {
        return records.stream().filter(r -> r.outcome() == outcome).count();
    }

    public int size() {
        return records.size();
    }

    /**
     * Gets every concept merged, directly or transitively, into {@code cui}.
     */
    public List<String> getMergeChain(String cui) {
        List<String> chain = new ArrayList<>();
        collectMergeChain(cui, chain, new HashSet<>());
        return chain;
    }

    private void collectMergeChain(String cui, List<String> chain, Set<String> visited) {
        if (!visited.add(cui)) {
            return;
        }
        for (MergeRecord record : records) {
            if (record.applied() && record.resolvedCui().equals(cui)) {
                chain.add(record.oldCui());
                collectMergeChain(record.oldCui(), chain, visited);
            }
        }
    }
}
