package com.umls.sync.extract;

/**
 * Stateless per-row transformation applied by extraction workers.
 *
 * @param <T> the row type produced for accepted rows
 */
public interface RowMapper<T> {

    /**
     * Number of fields a well-formed row splits into, trailing empty field included.
     */
    int width();

    /**
     * Whether the row has the expected shape. Rows failing this check are counted as malformed.
     */
    default boolean isWellFormed(String[] fields) {
        return fields.length == width();
    }

    /**
     * Maps a well-formed row.
     *
     * @return the mapped value, or {@code null} when the acceptance predicate rejects the row
     */
    T map(String[] fields);
}
