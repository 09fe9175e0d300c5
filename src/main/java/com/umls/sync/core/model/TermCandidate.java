package com.umls.sync.core.model;

/**
 * A name row (MRCONSO atom) that passed the record filter, reduced to the fields the
 * preferred-name rule and code extraction need.
 *
 * @param cui        concept the atom belongs to
 * @param source     SAB
 * @param code       source code
 * @param name       STR
 * @param termStatus TS, {@code P} for the preferred term of the concept
 * @param stringType STT, {@code PF} for the preferred form of the term
 * @param preferred  ISPREF, {@code Y} for the preferred string of its source
 */
public record TermCandidate(
        String cui,
        String source,
        String code,
        String name,
        String termStatus,
        String stringType,
        String preferred
) {
    /**
     * Secondary rank: 4 for TS=P, 2 for STT=PF, 1 for ISPREF=Y.
     */
    public int rank() {
        int rank = 0;
        if ("P".equals(termStatus)) rank += 4;
        if ("PF".equals(stringType)) rank += 2;
        if ("Y".equals(preferred)) rank += 1;
        return rank;
    }

    public String codeId() {
        return Code.idOf(source, code);
    }
}
