package com.umls.sync.core.model;

import java.util.Objects;

/**
 * One MERGEDCUI row: {@code oldCui} was merged into {@code newCui} by the release.
 */
public record MergeInstruction(String oldCui, String newCui) {

    public MergeInstruction {
        Objects.requireNonNull(oldCui, "oldCui is required");
        Objects.requireNonNull(newCui, "newCui is required");
    }
}
