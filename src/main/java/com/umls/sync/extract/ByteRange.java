package com.umls.sync.extract;

/**
 * Half-open byte span {@code [offset, offset + length)} of an input file.
 */
public record ByteRange(long offset, long length) {

    public ByteRange {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        if (length < 0) throw new IllegalArgumentException("length must be >= 0");
    }

    public long end() {
        return offset + length;
    }
}
