package com.umls.sync.extract;

import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Output of {@link EntityReducer}: one concept per surviving CUI plus its codes and memberships.
 */
public record ReducedConcepts(List<Concept> concepts, List<Code> codes, List<CodeMembership> memberships) {

    public ReducedConcepts {
        concepts = List.copyOf(concepts);
        codes = List.copyOf(codes);
        memberships = List.copyOf(memberships);
    }

    public Set<String> cuis() {
        return concepts.stream().map(Concept::cui).collect(Collectors.toUnmodifiableSet());
    }
}
