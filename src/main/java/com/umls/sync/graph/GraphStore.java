package com.umls.sync.graph;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;

import java.util.List;
import java.util.Optional;

/**
 * Store-side primitives the reconciliation engine is written against.
 *
 * <p>All writes are keyed upserts and are idempotent: concepts by CUI, codes by code id,
 * memberships by (cui, code id) and assertion edges by {@link AssertionEdge.Key}. Assertion
 * writes union the asserting sources with those already stored. Edge writes whose endpoints
 * are absent are no-ops. The sweep operations remove at most {@code batchSize} records per
 * call and return how many they removed, so callers iterate until a short batch.</p>
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Creates the indexes and constraints the keyed upserts rely on. Safe to call repeatedly.
     */
    void ensureConstraints();

    boolean conceptExists(String cui);

    Optional<Concept> findConcept(String cui);

    /**
     * Removes the given concepts and every edge attached to them. Absent CUIs are ignored.
     *
     * @return number of concepts removed
     */
    long deleteConcepts(List<String> cuis);

    /**
     * Creates or refreshes concepts: name, categories and version are overwritten.
     */
    void upsertConcepts(List<Concept> concepts, String version);

    void upsertCodes(List<Code> codes, String version);

    /**
     * Creates or refreshes memberships, stamping them with {@code version}.
     */
    void upsertMemberships(List<CodeMembership> memberships, String version);

    /**
     * Creates memberships that do not exist yet, carrying each membership's own version.
     * Existing memberships are left as they are.
     */
    void mergeMemberships(List<CodeMembership> memberships);

    /**
     * Creates or refreshes assertion edges: asserting sources are unioned with the stored ones
     * and the edge is stamped with {@code version}.
     */
    void upsertAssertions(List<AssertionEdge> edges, String version);

    /**
     * Merges assertion edges: asserting sources are unioned with the stored ones; a stored edge
     * keeps its version, a new edge carries the version of the incoming edge.
     */
    void mergeAssertions(List<AssertionEdge> edges);

    List<CodeMembership> findMemberships(String cui);

    /**
     * Assertion edges starting or ending at {@code cui}. A self-loop is returned once.
     */
    List<AssertionEdge> findAssertions(String cui);

    long deleteStaleAssertions(String version, int batchSize);

    long deleteStaleMemberships(String version, int batchSize);

    long deleteStaleCodes(String version, int batchSize);

    /**
     * The committed release version, empty before the first commit.
     */
    Optional<String> currentVersion();

    void commitVersion(String version);

    GraphStats stats();

    @Override
    void close();
}
