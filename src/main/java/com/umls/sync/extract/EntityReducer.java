package com.umls.sync.extract;

import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.TermCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups accepted name rows by CUI and resolves one preferred name per concept.
 *
 * <p>Runs single-threaded over the rows of every chunk, in plan order, so that all rows of a
 * concept are present before ranking and ties resolve to the first row in the file.</p>
 *
 * <p>Preferred-name rule:</p>
 * <ol>
 *   <li>walk the source priority list; the first source with at least one candidate wins and
 *       the best-ranked of its candidates is selected</li>
 *   <li>when no candidate comes from a listed source, the best-ranked candidate overall is selected</li>
 * </ol>
 * Rank is {@link TermCandidate#rank()}; ties keep the earliest candidate.
 */
public class EntityReducer {
    private static final Logger log = LoggerFactory.getLogger(EntityReducer.class);

    private final List<String> sourcePriority;

    public EntityReducer(SyncSettings settings) {
        this.sourcePriority = settings.getSourcePriority();
    }

    public ReducedConcepts reduce(List<TermCandidate> candidates,
                                  Map<String, Set<BiolinkCategory>> categoriesByCui) {
        Map<String, List<TermCandidate>> byCui = new LinkedHashMap<>();
        for (TermCandidate candidate : candidates) {
            byCui.computeIfAbsent(candidate.cui(), k -> new ArrayList<>()).add(candidate);
        }

        List<Concept> concepts = new ArrayList<>(byCui.size());
        Map<String, Code> codes = new LinkedHashMap<>();
        Set<CodeMembership> memberships = new LinkedHashSet<>();

        for (Map.Entry<String, List<TermCandidate>> entry : byCui.entrySet()) {
            String cui = entry.getKey();
            List<TermCandidate> terms = entry.getValue();

            for (TermCandidate term : terms) {
                String codeId = term.codeId();
                codes.putIfAbsent(codeId, new Code(codeId, term.source(), term.name()));
                memberships.add(new CodeMembership(cui, codeId));
            }

            TermCandidate preferred = selectPreferred(terms);
            Set<BiolinkCategory> categories = categoriesByCui.getOrDefault(cui, Set.of());
            concepts.add(new Concept(cui, preferred.name(), categories));
        }

        log.info("reduce.completed concepts={} codes={} memberships={}",
                concepts.size(), codes.size(), memberships.size());
        return new ReducedConcepts(concepts, new ArrayList<>(codes.values()), new ArrayList<>(memberships));
    }

    /**
     * Applies the preferred-name rule to the candidates of one concept.
     *
     * @throws IllegalArgumentException if there are no candidates
     */
    public TermCandidate selectPreferred(List<TermCandidate> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("No candidates to select from");
        }
        for (String source : sourcePriority) {
            TermCandidate best = null;
            for (TermCandidate term : terms) {
                if (source.equals(term.source()) && (best == null || term.rank() > best.rank())) {
                    best = term;
                }
            }
            if (best != null) {
                return best;
            }
        }
        TermCandidate best = terms.get(0);
        for (TermCandidate term : terms) {
            if (term.rank() > best.rank()) {
                best = term;
            }
        }
        return best;
    }
}
