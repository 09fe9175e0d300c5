package com.umls.sync.extract;

/**
 * Row counts for one extracted file.
 */
public record ExtractionStats(String file, int chunks, long accepted, long rejected, long malformed) {

    public static ExtractionStats of(String file, Iterable<? extends ChunkResult<?>> results) {
        int chunks = 0;
        long accepted = 0;
        long rejected = 0;
        long malformed = 0;
        for (ChunkResult<?> result : results) {
            chunks++;
            accepted += result.accepted();
            rejected += result.rejected();
            malformed += result.malformed();
        }
        return new ExtractionStats(file, chunks, accepted, rejected, malformed);
    }

    public long total() {
        return accepted + rejected + malformed;
    }

    @Override
    public String toString() {
        return "ExtractionStats{file=" + file +
                ", chunks=" + chunks +
                ", accepted=" + accepted +
                ", rejected=" + rejected +
                ", malformed=" + malformed + '}';
    }
}
