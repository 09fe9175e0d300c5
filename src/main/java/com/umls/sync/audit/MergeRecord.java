package com.umls.sync.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * One processed merge instruction.
 *
 * @param oldCui         concept named as merged away
 * @param newCui         concept named as the merge target
 * @param resolvedCui    target after following earlier merges of this run
 * @param version        release version of the run
 * @param outcome        what was done
 * @param timestamp      when the instruction was processed
 */
public record MergeRecord(
        String oldCui,
        String newCui,
        String resolvedCui,
        String version,
        MergeOutcome outcome,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(oldCui, "oldCui is required");
        Objects.requireNonNull(newCui, "newCui is required");
        Objects.requireNonNull(resolvedCui, "resolvedCui is required");
        Objects.requireNonNull(outcome, "outcome is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean applied() {
        return outcome == MergeOutcome.APPLIED;
    }
}
