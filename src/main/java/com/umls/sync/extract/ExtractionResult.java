package com.umls.sync.extract;

import com.umls.sync.core.model.ExtractedSnapshot;

/**
 * Snapshot produced by {@link ExtractionCoordinator} with the row statistics of each file.
 *
 * @param snapshot           resolved concepts, codes, memberships and assertion edges
 * @param names              MRCONSO statistics
 * @param relationships      MRREL statistics
 * @param danglingAssertions accepted relationship rows dropped because an endpoint did not survive
 */
public record ExtractionResult(
        ExtractedSnapshot snapshot,
        ExtractionStats names,
        ExtractionStats relationships,
        long danglingAssertions
) {
    @Override
    public String toString() {
        return "ExtractionResult{snapshot=" + snapshot +
                ", names=" + names +
                ", relationships=" + relationships +
                ", danglingAssertions=" + danglingAssertions + '}';
    }
}
