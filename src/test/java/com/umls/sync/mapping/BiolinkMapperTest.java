package com.umls.sync.mapping;

import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.BiolinkPredicate;
import com.umls.sync.core.model.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BiolinkMapper Tests")
class BiolinkMapperTest {

    @Nested
    @DisplayName("Categories")
    class Categories {

        @Test
        @DisplayName("Known semantic types should map to their category")
        void knownTypes() {
            assertEquals(BiolinkCategory.DISEASE, BiolinkMapper.categoryFor("T047"));
            assertEquals(BiolinkCategory.DRUG, BiolinkMapper.categoryFor("T121"));
            assertEquals(BiolinkCategory.GENE, BiolinkMapper.categoryFor("T028"));
            assertEquals(BiolinkCategory.SIGN_OR_SYMPTOM, BiolinkMapper.categoryFor("T184"));
        }

        @Test
        @DisplayName("Unknown or missing semantic types should map to NamedThing")
        void unknownTypes() {
            assertEquals(BiolinkCategory.NAMED_THING, BiolinkMapper.categoryFor("T999"));
            assertEquals(BiolinkCategory.NAMED_THING, BiolinkMapper.categoryFor(null));
        }
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("Exact labels should match case-insensitively")
        void exactMatch() {
            assertEquals(Predicate.of(BiolinkPredicate.TREATS), BiolinkMapper.predicateFor("treats"));
            assertEquals(Predicate.of(BiolinkPredicate.SUBCLASS_OF), BiolinkMapper.predicateFor("ISA"));
            assertEquals(Predicate.of(BiolinkPredicate.CONTRAINDICATED_IN),
                    BiolinkMapper.predicateFor("contraindicated_with"));
        }

        @Test
        @DisplayName("Labels containing a known key should use the first matching key")
        void keywordMatch() {
            assertEquals(Predicate.of(BiolinkPredicate.PART_OF), BiolinkMapper.predicateFor("regional_part_of"));
            assertEquals(Predicate.of(BiolinkPredicate.PREVENTED_BY),
                    BiolinkMapper.predicateFor("may_be_prevented_by"));
            assertEquals(Predicate.of(BiolinkPredicate.RELATED_TO),
                    BiolinkMapper.predicateFor("clinically_associated_with"));
        }

        @Test
        @DisplayName("Unmapped, empty or missing labels should fall back to related_to")
        void fallback() {
            assertEquals(Predicate.of(BiolinkPredicate.RELATED_TO), BiolinkMapper.predicateFor("RO"));
            assertEquals(Predicate.of(BiolinkPredicate.RELATED_TO), BiolinkMapper.predicateFor(""));
            assertEquals(Predicate.of(BiolinkPredicate.RELATED_TO), BiolinkMapper.predicateFor(null));
        }

        @Test
        @DisplayName("Every mapped predicate should be usable as a relationship type")
        void typeNames() {
            for (BiolinkPredicate predicate : BiolinkMapper.predicateTable().values()) {
                assertTrue(predicate.curie().startsWith("biolink:"));
            }
        }
    }
}
