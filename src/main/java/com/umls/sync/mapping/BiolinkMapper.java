package com.umls.sync.mapping;

import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.BiolinkPredicate;
import com.umls.sync.core.model.Predicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup tables from UMLS vocabulary to the Biolink model.
 *
 * <p>Semantic types (TUI) map to a category, defaulting to {@link BiolinkCategory#NAMED_THING}.
 * Relationship labels map to a predicate by exact lowercase key first, then by the first key
 * (in table order) contained in the label, then to {@link BiolinkPredicate#RELATED_TO}.</p>
 */
public final class BiolinkMapper {

    public static final BiolinkCategory DEFAULT_CATEGORY = BiolinkCategory.NAMED_THING;
    public static final BiolinkPredicate DEFAULT_PREDICATE = BiolinkPredicate.RELATED_TO;

    private static final Map<String, BiolinkCategory> TUI_TO_CATEGORY;
    private static final Map<String, BiolinkPredicate> LABEL_TO_PREDICATE;

    static {
        Map<String, BiolinkCategory> tui = new LinkedHashMap<>();
        // Disorders
        tui.put("T019", BiolinkCategory.DISEASE);
        tui.put("T020", BiolinkCategory.DISEASE);
        tui.put("T037", BiolinkCategory.DISEASE);
        tui.put("T047", BiolinkCategory.DISEASE);
        tui.put("T048", BiolinkCategory.DISEASE);
        tui.put("T049", BiolinkCategory.DISEASE);
        tui.put("T190", BiolinkCategory.DISEASE);
        tui.put("T191", BiolinkCategory.DISEASE);
        // Chemicals and drugs
        tui.put("T109", BiolinkCategory.CHEMICAL_ENTITY);
        tui.put("T116", BiolinkCategory.AMINO_ACID_SEQUENCE);
        tui.put("T121", BiolinkCategory.DRUG);
        tui.put("T123", BiolinkCategory.CHEMICAL_ENTITY);
        tui.put("T197", BiolinkCategory.CHEMICAL_ENTITY);
        tui.put("T200", BiolinkCategory.DRUG);
        // Genes
        tui.put("T028", BiolinkCategory.GENE);
        tui.put("T114", BiolinkCategory.NUCLEIC_ACID_SEQUENCE);
        // Anatomy
        tui.put("T017", BiolinkCategory.ANATOMICAL_ENTITY);
        tui.put("T023", BiolinkCategory.ANATOMICAL_ENTITY);
        tui.put("T024", BiolinkCategory.TISSUE);
        tui.put("T025", BiolinkCategory.CELL);
        tui.put("T026", BiolinkCategory.CELLULAR_COMPONENT);
        // Findings
        tui.put("T033", BiolinkCategory.PHENOTYPIC_FEATURE);
        tui.put("T034", BiolinkCategory.LABORATORY_FINDING);
        tui.put("T184", BiolinkCategory.SIGN_OR_SYMPTOM);
        // Procedures
        tui.put("T061", BiolinkCategory.PROCEDURE);
        // Processes
        tui.put("T039", BiolinkCategory.PHYSIOLOGICAL_PROCESS);
        tui.put("T040", BiolinkCategory.ORGANISMAL_PROCESS);
        tui.put("T041", BiolinkCategory.PATHOLOGICAL_PROCESS);
        tui.put("T043", BiolinkCategory.BIOLOGICAL_PROCESS);
        TUI_TO_CATEGORY = Collections.unmodifiableMap(tui);

        // Order matters for the keyword fallback.
        Map<String, BiolinkPredicate> rela = new LinkedHashMap<>();
        rela.put("treats", BiolinkPredicate.TREATS);
        rela.put("treated_by", BiolinkPredicate.TREATED_BY);
        rela.put("isa", BiolinkPredicate.SUBCLASS_OF);
        rela.put("part_of", BiolinkPredicate.PART_OF);
        rela.put("has_part", BiolinkPredicate.HAS_PART);
        rela.put("associated_with", BiolinkPredicate.RELATED_TO);
        rela.put("causes", BiolinkPredicate.CAUSES);
        rela.put("caused_by", BiolinkPredicate.CAUSED_BY);
        rela.put("location_of", BiolinkPredicate.LOCATION_OF);
        rela.put("has_location", BiolinkPredicate.LOCATED_IN);
        rela.put("diagnoses", BiolinkPredicate.DIAGNOSES);
        rela.put("diagnosed_by", BiolinkPredicate.BIOMARKER_FOR);
        rela.put("prevents", BiolinkPredicate.PREVENTS);
        rela.put("prevented_by", BiolinkPredicate.PREVENTED_BY);
        rela.put("produces", BiolinkPredicate.PRODUCES);
        rela.put("produced_by", BiolinkPredicate.PRODUCED_BY);
        rela.put("contraindicated_with", BiolinkPredicate.CONTRAINDICATED_IN);
        LABEL_TO_PREDICATE = Collections.unmodifiableMap(rela);
    }

    private BiolinkMapper() {
        // utility class
    }

    public static BiolinkCategory categoryFor(String tui) {
        if (tui == null) {
            return DEFAULT_CATEGORY;
        }
        return TUI_TO_CATEGORY.getOrDefault(tui, DEFAULT_CATEGORY);
    }

    /**
     * Maps a relationship label (RELA, or REL as fallback) to a predicate.
     */
    public static Predicate predicateFor(String label) {
        if (label == null || label.isEmpty()) {
            return Predicate.of(DEFAULT_PREDICATE);
        }
        String lower = label.toLowerCase(Locale.ROOT);
        BiolinkPredicate exact = LABEL_TO_PREDICATE.get(lower);
        if (exact != null) {
            return Predicate.of(exact);
        }
        for (Map.Entry<String, BiolinkPredicate> entry : LABEL_TO_PREDICATE.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return Predicate.of(entry.getValue());
            }
        }
        return Predicate.of(DEFAULT_PREDICATE);
    }

    public static Map<String, BiolinkCategory> categoryTable() {
        return TUI_TO_CATEGORY;
    }

    public static Map<String, BiolinkPredicate> predicateTable() {
        return LABEL_TO_PREDICATE;
    }
}
