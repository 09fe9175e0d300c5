package com.umls.sync.extract;

import com.umls.sync.core.model.MergeInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharsetDecoder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the DELETEDCUI and MERGEDCUI change lists.
 *
 * <p>Both lists are optional in a release: a missing file yields an empty list. Malformed rows
 * are skipped with a warning, including rows that are not valid UTF-8. Row order is preserved since merges are applied in list order.</p>
 */
public class ChangeListReader {
    private static final Logger log = LoggerFactory.getLogger(ChangeListReader.class);

    public List<String> readDeletions(Path file) {
        List<String> cuis = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            log.warn("changeList.missing file={} action=skipDeletions", file);
            return cuis;
        }
        int lineNumber = 0;
        for (String line : readLines(file)) {
            lineNumber++;
            if (line == null) {
                log.warn("changeList.malformedRow file={} line={} reason=encoding", file.getFileName(), lineNumber);
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            String cui = RrfChunkReader.split(line)[RrfColumns.Deleted.CUI].trim();
            if (cui.isEmpty()) {
                log.warn("changeList.malformedRow file={} line={}", file.getFileName(), lineNumber);
                continue;
            }
            cuis.add(cui);
        }
        log.info("changeList.read file={} deletions={}", file.getFileName(), cuis.size());
        return cuis;
    }

    public List<MergeInstruction> readMerges(Path file) {
        List<MergeInstruction> merges = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            log.warn("changeList.missing file={} action=skipMerges", file);
            return merges;
        }
        int lineNumber = 0;
        for (String line : readLines(file)) {
            lineNumber++;
            if (line == null) {
                log.warn("changeList.malformedRow file={} line={} reason=encoding", file.getFileName(), lineNumber);
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            String[] fields = RrfChunkReader.split(line);
            boolean wellFormed = (fields.length == 2 || (fields.length == 3 && fields[2].isEmpty()))
                    && !fields[RrfColumns.Merged.OLD_CUI].isBlank()
                    && !fields[RrfColumns.Merged.NEW_CUI].isBlank();
            if (!wellFormed) {
                log.warn("changeList.malformedRow file={} line={}", file.getFileName(), lineNumber);
                continue;
            }
            merges.add(new MergeInstruction(
                    fields[RrfColumns.Merged.OLD_CUI].trim(),
                    fields[RrfColumns.Merged.NEW_CUI].trim()));
        }
        log.info("changeList.read file={} merges={}", file.getFileName(), merges.size());
        return merges;
    }

    /**
     * Splits the file into lines, decoding each one on its own. A line that is not valid UTF-8
     * comes back as {@code null} so the rest of the list is still read.
     */
    private List<String> readLines(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new SourceUnavailableException(file, e);
        }

        CharsetDecoder decoder = RrfChunkReader.strictDecoder();
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= bytes.length; i++) {
            if (i < bytes.length && bytes[i] != '\n') {
                continue;
            }
            if (i == bytes.length && start == i) {
                break;
            }
            int end = i > start && bytes[i - 1] == '\r' ? i - 1 : i;
            lines.add(RrfChunkReader.decode(decoder, bytes, start, end - start));
            start = i + 1;
        }
        return lines;
    }
}
