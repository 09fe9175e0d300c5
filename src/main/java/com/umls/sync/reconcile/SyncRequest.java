package com.umls.sync.reconcile;

import com.umls.sync.core.model.ExtractedSnapshot;
import com.umls.sync.core.model.MergeInstruction;

import java.util.List;
import java.util.Objects;

/**
 * Input of one reconciliation run.
 *
 * @param version   caller-supplied release version; every refreshed record is stamped with it
 * @param snapshot  the release as extracted
 * @param deletions CUIs to remove, from DELETEDCUI
 * @param merges    merge instructions in list order, from MERGEDCUI
 */
public record SyncRequest(
        String version,
        ExtractedSnapshot snapshot,
        List<String> deletions,
        List<MergeInstruction> merges
) {
    public SyncRequest {
        Objects.requireNonNull(version, "version is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
        deletions = deletions != null ? List.copyOf(deletions) : List.of();
        merges = merges != null ? List.copyOf(merges) : List.of();
    }

    public static SyncRequest of(String version, ExtractedSnapshot snapshot) {
        return new SyncRequest(version, snapshot, List.of(), List.of());
    }
}
