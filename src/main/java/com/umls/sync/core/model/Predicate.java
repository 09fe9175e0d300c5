package com.umls.sync.core.model;

import java.util.Objects;

/**
 * Relationship type of an {@link AssertionEdge}.
 *
 * <p>Either a member of the closed {@link BiolinkPredicate} vocabulary, or a pass-through
 * carrying a raw type name found in the store (for example an edge written by an older
 * mapping table). Both render to the relationship type name used in the graph.</p>
 */
public sealed interface Predicate permits Predicate.Known, Predicate.PassThrough {

    /**
     * Relationship type name as stored in the graph.
     */
    String typeName();

    boolean isKnown();

    static Predicate of(BiolinkPredicate predicate) {
        return new Known(predicate);
    }

    static Predicate passThrough(String typeName) {
        return new PassThrough(typeName);
    }

    /**
     * Resolves a stored relationship type name, preferring the closed vocabulary.
     */
    static Predicate fromTypeName(String typeName) {
        return BiolinkPredicate.fromCurie(typeName)
                .<Predicate>map(Known::new)
                .orElseGet(() -> new PassThrough(typeName));
    }

    record Known(BiolinkPredicate predicate) implements Predicate {
        public Known {
            Objects.requireNonNull(predicate, "predicate is required");
        }

        @Override
        public String typeName() {
            return predicate.curie();
        }

        @Override
        public boolean isKnown() {
            return true;
        }
    }

    record PassThrough(String raw) implements Predicate {
        public PassThrough {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Pass-through predicate must carry a type name");
            }
        }

        @Override
        public String typeName() {
            return raw;
        }

        @Override
        public boolean isKnown() {
            return false;
        }
    }
}
