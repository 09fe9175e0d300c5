package com.umls.sync.extract;

import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.mapping.BiolinkMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads MRSTY.RRF into the Biolink categories of each CUI.
 */
public class SemanticTypeReader {
    private static final Logger log = LoggerFactory.getLogger(SemanticTypeReader.class);

    public Map<String, Set<BiolinkCategory>> read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SourceUnavailableException(file);
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);

        Map<String, Set<BiolinkCategory>> categories = new HashMap<>();
        long malformed = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                String[] fields = RrfChunkReader.split(line);
                if (fields.length != RrfColumns.Sty.WIDTH
                        || fields[RrfColumns.Sty.CUI].isEmpty()
                        || fields[RrfColumns.Sty.TUI].isEmpty()) {
                    malformed++;
                    continue;
                }
                categories.computeIfAbsent(fields[RrfColumns.Sty.CUI], k -> EnumSet.noneOf(BiolinkCategory.class))
                        .add(BiolinkMapper.categoryFor(fields[RrfColumns.Sty.TUI]));
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(file, e);
        }

        log.info("semanticTypes.read file={} cuis={} malformed={}", file.getFileName(), categories.size(), malformed);
        return categories;
    }
}
