package com.umls.sync.reconcile;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkPredicate;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.ExtractedSnapshot;
import com.umls.sync.core.model.Predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Small fluent builder for snapshots used by reconciliation tests.
 */
public final class SnapshotFixtures {

    private final List<Concept> concepts = new ArrayList<>();
    private final List<Code> codes = new ArrayList<>();
    private final List<CodeMembership> memberships = new ArrayList<>();
    private final List<AssertionEdge> assertions = new ArrayList<>();

    public static SnapshotFixtures snapshot() {
        return new SnapshotFixtures();
    }

    public SnapshotFixtures concept(String cui) {
        concepts.add(new Concept(cui, "Name of " + cui, Set.of()));
        return this;
    }

    /**
     * Adds a code {@code MSH:<code>} and its membership in {@code cui}.
     */
    public SnapshotFixtures code(String cui, String code) {
        String codeId = Code.idOf("MSH", code);
        if (codes.stream().noneMatch(c -> c.codeId().equals(codeId))) {
            codes.add(new Code(codeId, "MSH", "Code " + code));
        }
        memberships.add(new CodeMembership(cui, codeId));
        return this;
    }

    public SnapshotFixtures treats(String source, String target, String... sabs) {
        assertions.add(AssertionEdge.of(source, target, "treats", Predicate.of(BiolinkPredicate.TREATS),
                List.of(sabs)));
        return this;
    }

    public ExtractedSnapshot build() {
        return new ExtractedSnapshot(concepts, codes, memberships, assertions);
    }
}
