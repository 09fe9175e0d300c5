package com.umls.sync.core.model;

import java.util.Optional;

/**
 * Closed vocabulary of Biolink categories a concept can be labelled with.
 * The CURIE doubles as the graph label and the {@code :LABEL} value in snapshot files.
 */
public enum BiolinkCategory {
    NAMED_THING("biolink:NamedThing"),
    DISEASE("biolink:Disease"),
    CHEMICAL_ENTITY("biolink:ChemicalEntity"),
    AMINO_ACID_SEQUENCE("biolink:AminoAcidSequence"),
    DRUG("biolink:Drug"),
    GENE("biolink:Gene"),
    NUCLEIC_ACID_SEQUENCE("biolink:NucleicAcidSequence"),
    ANATOMICAL_ENTITY("biolink:AnatomicalEntity"),
    TISSUE("biolink:Tissue"),
    CELL("biolink:Cell"),
    CELLULAR_COMPONENT("biolink:CellularComponent"),
    PHENOTYPIC_FEATURE("biolink:PhenotypicFeature"),
    LABORATORY_FINDING("biolink:LaboratoryFinding"),
    SIGN_OR_SYMPTOM("biolink:SignOrSymptom"),
    PROCEDURE("biolink:Procedure"),
    PHYSIOLOGICAL_PROCESS("biolink:PhysiologicalProcess"),
    ORGANISMAL_PROCESS("biolink:OrganismalProcess"),
    PATHOLOGICAL_PROCESS("biolink:PathologicalProcess"),
    BIOLOGICAL_PROCESS("biolink:BiologicalProcess");

    private final String curie;

    BiolinkCategory(String curie) {
        this.curie = curie;
    }

    public String curie() {
        return curie;
    }

    public static Optional<BiolinkCategory> fromCurie(String curie) {
        for (BiolinkCategory category : values()) {
            if (category.curie.equals(curie)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
