package com.umls.sync.extract;

import java.util.List;

/**
 * Immutable output of one worker over one byte range.
 *
 * @param index     position of the range in the plan
 * @param range     bytes that were read
 * @param rows      accepted rows in file order
 * @param rejected  well-formed rows refused by the acceptance predicate
 * @param malformed rows with the wrong field count, missing keys or invalid UTF-8
 */
public record ChunkResult<T>(int index, ByteRange range, List<T> rows, long rejected, long malformed) {

    public ChunkResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public long accepted() {
        return rows.size();
    }
}
