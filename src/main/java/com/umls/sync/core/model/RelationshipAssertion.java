package com.umls.sync.core.model;

/**
 * A single MRREL row that survived filtering: one source's assertion of a relationship.
 *
 * @param sourceCui     CUI1
 * @param targetCui     CUI2
 * @param relationLabel RELA, falling back to REL; empty when the row has neither
 * @param source        SAB of the asserting vocabulary
 */
public record RelationshipAssertion(String sourceCui, String targetCui, String relationLabel, String source) {
}
