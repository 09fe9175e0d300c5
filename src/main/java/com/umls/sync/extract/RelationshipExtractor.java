package com.umls.sync.extract;

import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.RelationshipAssertion;

import java.util.Set;

/**
 * Turns MRREL rows into relationship assertions.
 * The label is RELA when present, otherwise REL. A row carrying neither keeps an empty label,
 * which maps to the default predicate.
 */
public class RelationshipExtractor implements RowMapper<RelationshipAssertion> {

    private final Set<String> includedSources;

    public RelationshipExtractor(SyncSettings settings) {
        this.includedSources = settings.getIncludedSources();
    }

    @Override
    public int width() {
        return RrfColumns.Rel.WIDTH;
    }

    @Override
    public boolean isWellFormed(String[] fields) {
        return fields.length == width()
                && !fields[RrfColumns.Rel.CUI1].isEmpty()
                && !fields[RrfColumns.Rel.CUI2].isEmpty();
    }

    @Override
    public RelationshipAssertion map(String[] fields) {
        if (!includedSources.contains(fields[RrfColumns.Rel.SAB])) {
            return null;
        }
        return new RelationshipAssertion(
                fields[RrfColumns.Rel.CUI1],
                fields[RrfColumns.Rel.CUI2],
                labelOf(fields),
                fields[RrfColumns.Rel.SAB]);
    }

    static String labelOf(String[] fields) {
        String rela = fields[RrfColumns.Rel.RELA];
        return rela.isEmpty() ? fields[RrfColumns.Rel.REL] : rela;
    }
}
