package com.umls.sync.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Typed, provenance-bearing relationship between two concepts.
 *
 * <p>Identity is {@link #key()}: source, target, relationship type and the relation label
 * the assertion came from. Two assertions with different labels never collapse, even when
 * both map to the same predicate.</p>
 *
 * @param sourceCui       start concept
 * @param targetCui       end concept
 * @param relationLabel   RELA, or REL when RELA is empty
 * @param predicate       relationship type in the graph
 * @param assertedBy      source vocabularies asserting the relationship
 * @param lastSeenVersion release version that last refreshed the edge, {@code null} until stamped
 */
public record AssertionEdge(
        String sourceCui,
        String targetCui,
        String relationLabel,
        Predicate predicate,
        SortedSet<String> assertedBy,
        String lastSeenVersion
) {
    public AssertionEdge {
        Objects.requireNonNull(sourceCui, "sourceCui is required");
        Objects.requireNonNull(targetCui, "targetCui is required");
        Objects.requireNonNull(relationLabel, "relationLabel is required");
        Objects.requireNonNull(predicate, "predicate is required");
        assertedBy = assertedBy == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(assertedBy));
    }

    public static AssertionEdge of(String sourceCui, String targetCui, String relationLabel,
                                   Predicate predicate, Collection<String> assertedBy) {
        return new AssertionEdge(sourceCui, targetCui, relationLabel, predicate,
                assertedBy == null ? null : new TreeSet<>(assertedBy), null);
    }

    public Key key() {
        return new Key(sourceCui, targetCui, predicate.typeName(), relationLabel);
    }

    public AssertionEdge withVersion(String version) {
        return new AssertionEdge(sourceCui, targetCui, relationLabel, predicate, assertedBy, version);
    }

    public AssertionEdge withAssertedBy(Collection<String> sources) {
        return new AssertionEdge(sourceCui, targetCui, relationLabel, predicate,
                new TreeSet<>(sources), lastSeenVersion);
    }

    /**
     * Replaces every occurrence of {@code from} as an endpoint with {@code to}.
     */
    public AssertionEdge repoint(String from, String to) {
        String newSource = sourceCui.equals(from) ? to : sourceCui;
        String newTarget = targetCui.equals(from) ? to : targetCui;
        return new AssertionEdge(newSource, newTarget, relationLabel, predicate, assertedBy, lastSeenVersion);
    }

    public record Key(String sourceCui, String targetCui, String typeName, String relationLabel) {}
}
