package com.umls.sync.core.model;

import java.util.Optional;

/**
 * Closed vocabulary of Biolink predicates used as relationship types between concepts.
 */
public enum BiolinkPredicate {
    RELATED_TO("biolink:related_to"),
    TREATS("biolink:treats"),
    TREATED_BY("biolink:treated_by"),
    SUBCLASS_OF("biolink:subclass_of"),
    PART_OF("biolink:part_of"),
    HAS_PART("biolink:has_part"),
    CAUSES("biolink:causes"),
    CAUSED_BY("biolink:caused_by"),
    LOCATION_OF("biolink:location_of"),
    LOCATED_IN("biolink:located_in"),
    DIAGNOSES("biolink:diagnoses"),
    BIOMARKER_FOR("biolink:biomarker_for"),
    PREVENTS("biolink:prevents"),
    PREVENTED_BY("biolink:prevented_by"),
    PRODUCES("biolink:produces"),
    PRODUCED_BY("biolink:produced_by"),
    CONTRAINDICATED_IN("biolink:contraindicated_in");

    private final String curie;

    BiolinkPredicate(String curie) {
        this.curie = curie;
    }

    public String curie() {
        return curie;
    }

    public static Optional<BiolinkPredicate> fromCurie(String curie) {
        for (BiolinkPredicate predicate : values()) {
            if (predicate.curie.equals(curie)) {
                return Optional.of(predicate);
            }
        }
        return Optional.empty();
    }
}
