package com.umls.sync.core.model;

import java.util.List;

/**
 * Full set of nodes and edges extracted from one release, not yet stamped with a version.
 */
public record ExtractedSnapshot(
        List<Concept> concepts,
        List<Code> codes,
        List<CodeMembership> memberships,
        List<AssertionEdge> assertions
) {
    public ExtractedSnapshot {
        concepts = concepts != null ? List.copyOf(concepts) : List.of();
        codes = codes != null ? List.copyOf(codes) : List.of();
        memberships = memberships != null ? List.copyOf(memberships) : List.of();
        assertions = assertions != null ? List.copyOf(assertions) : List.of();
    }

    public static ExtractedSnapshot empty() {
        return new ExtractedSnapshot(List.of(), List.of(), List.of(), List.of());
    }

    @Override
    public String toString() {
        return "ExtractedSnapshot{concepts=" + concepts.size() +
                ", codes=" + codes.size() +
                ", memberships=" + memberships.size() +
                ", assertions=" + assertions.size() + '}';
    }
}
