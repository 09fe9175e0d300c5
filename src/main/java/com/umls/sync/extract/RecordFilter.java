package com.umls.sync.extract;

import com.umls.sync.config.SyncSettings;
import com.umls.sync.core.model.TermCandidate;

import java.util.Set;

/**
 * Acceptance predicate for MRCONSO name rows.
 *
 * <p>A row is accepted when its language equals the target language, its source is in the
 * inclusion set and its suppression flag is not in the exclusion set.</p>
 */
public class RecordFilter implements RowMapper<TermCandidate> {

    private final String targetLanguage;
    private final Set<String> includedSources;
    private final Set<String> excludedSuppressions;

    public RecordFilter(SyncSettings settings) {
        this.targetLanguage = settings.getTargetLanguage();
        this.includedSources = settings.getIncludedSources();
        this.excludedSuppressions = settings.getExcludedSuppressions();
    }

    @Override
    public int width() {
        return RrfColumns.Conso.WIDTH;
    }

    @Override
    public boolean isWellFormed(String[] fields) {
        return fields.length == width() && !fields[RrfColumns.Conso.CUI].isEmpty();
    }

    public boolean accepts(String[] fields) {
        return targetLanguage.equals(fields[RrfColumns.Conso.LAT])
                && includedSources.contains(fields[RrfColumns.Conso.SAB])
                && !excludedSuppressions.contains(fields[RrfColumns.Conso.SUPPRESS]);
    }

    @Override
    public TermCandidate map(String[] fields) {
        if (!accepts(fields)) {
            return null;
        }
        return new TermCandidate(
                fields[RrfColumns.Conso.CUI],
                fields[RrfColumns.Conso.SAB],
                fields[RrfColumns.Conso.CODE],
                fields[RrfColumns.Conso.STR],
                fields[RrfColumns.Conso.TS],
                fields[RrfColumns.Conso.STT],
                fields[RrfColumns.Conso.ISPREF]);
    }
}
