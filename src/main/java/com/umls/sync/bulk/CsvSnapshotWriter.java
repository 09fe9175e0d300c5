package com.umls.sync.bulk;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.ExtractedSnapshot;
import com.umls.sync.graph.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes an {@link ExtractedSnapshot} as bulk-import CSV files with typed headers.
 *
 * <p>Output files:</p>
 * <pre>
 * nodes_concepts.csv      cui:ID(Concept-ID),preferred_name:string,last_seen_version:string,:LABEL
 * nodes_codes.csv         code_id:ID(Code-ID),sab:string,name:string,last_seen_version:string
 * rels_has_code.csv       :START_ID(Concept-ID),:END_ID(Code-ID),last_seen_version:string,:TYPE
 * rels_inter_concept.csv  :START_ID(Concept-ID),:END_ID(Concept-ID),source_rela:string,
 *                         asserted_by_sabs:string[],last_seen_version:string,:TYPE
 * </pre>
 * Labels and list values are joined with {@code ;}. Every row is stamped with the run version.
 */
public class CsvSnapshotWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvSnapshotWriter.class);

    public static final String CONCEPTS_FILE = "nodes_concepts.csv";
    public static final String CODES_FILE = "nodes_codes.csv";
    public static final String HAS_CODE_FILE = "rels_has_code.csv";
    public static final String INTER_CONCEPT_FILE = "rels_inter_concept.csv";

    static final String CONCEPT_LABEL = "Concept";
    static final String ARRAY_DELIMITER = ";";

    private final String databaseName;

    public CsvSnapshotWriter(String databaseName) {
        this.databaseName = databaseName;
    }

    public SnapshotWriteResult write(ExtractedSnapshot snapshot, String version, Path directory) {
        return write(snapshot, version, directory, ProgressCallback.NOOP);
    }

    public SnapshotWriteResult write(ExtractedSnapshot snapshot, String version, Path directory,
                                     ProgressCallback callback) {
        InputSanitizer.validateVersion(version);
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        log.info("snapshot.writing directory={} version={} snapshot={}", directory, version, snapshot);

        try {
            Files.createDirectories(directory);
            long concepts = writeConcepts(directory.resolve(CONCEPTS_FILE), snapshot.concepts(), version);
            cb.onProgress(1, 4, CONCEPTS_FILE);
            long codes = writeCodes(directory.resolve(CODES_FILE), snapshot.codes(), version);
            cb.onProgress(2, 4, CODES_FILE);
            long memberships = writeMemberships(directory.resolve(HAS_CODE_FILE), snapshot.memberships(), version);
            cb.onProgress(3, 4, HAS_CODE_FILE);
            long assertions = writeAssertions(directory.resolve(INTER_CONCEPT_FILE), snapshot.assertions(), version);
            cb.onProgress(4, 4, INTER_CONCEPT_FILE);

            Map<String, Long> rowCounts = new LinkedHashMap<>();
            rowCounts.put(CONCEPTS_FILE, concepts);
            rowCounts.put(CODES_FILE, codes);
            rowCounts.put(HAS_CODE_FILE, memberships);
            rowCounts.put(INTER_CONCEPT_FILE, assertions);
            SnapshotManifest manifest = new SnapshotManifest(version, Instant.now().toString(), rowCounts,
                    importCommand(databaseName));
            manifest.writeTo(directory);

            SnapshotWriteResult result = new SnapshotWriteResult(directory, concepts, codes, memberships,
                    assertions, manifest);
            log.info("snapshot.written result={}", result);
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write snapshot to " + directory, e);
        }
    }

    private long writeConcepts(Path file, List<Concept> concepts, String version) throws IOException {
        try (PrintWriter pw = open(file)) {
            pw.println("cui:ID(Concept-ID),preferred_name:string,last_seen_version:string,:LABEL");
            for (Concept concept : concepts) {
                pw.println(String.join(",",
                        csvEscape(concept.cui()),
                        csvEscape(concept.preferredName()),
                        csvEscape(version),
                        csvEscape(labels(concept))));
            }
            checkWritten(pw, file);
            return concepts.size();
        }
    }

    private long writeCodes(Path file, List<Code> codes, String version) throws IOException {
        try (PrintWriter pw = open(file)) {
            pw.println("code_id:ID(Code-ID),sab:string,name:string,last_seen_version:string");
            for (Code code : codes) {
                pw.println(String.join(",",
                        csvEscape(code.codeId()),
                        csvEscape(code.source()),
                        csvEscape(code.name()),
                        csvEscape(version)));
            }
            checkWritten(pw, file);
            return codes.size();
        }
    }

    private long writeMemberships(Path file, List<CodeMembership> memberships, String version) throws IOException {
        try (PrintWriter pw = open(file)) {
            pw.println(":START_ID(Concept-ID),:END_ID(Code-ID),last_seen_version:string,:TYPE");
            for (CodeMembership membership : memberships) {
                pw.println(String.join(",",
                        csvEscape(membership.cui()),
                        csvEscape(membership.codeId()),
                        csvEscape(version),
                        CodeMembership.TYPE));
            }
            checkWritten(pw, file);
            return memberships.size();
        }
    }

    private long writeAssertions(Path file, List<AssertionEdge> edges, String version) throws IOException {
        try (PrintWriter pw = open(file)) {
            pw.println(":START_ID(Concept-ID),:END_ID(Concept-ID),source_rela:string,"
                    + "asserted_by_sabs:string[],last_seen_version:string,:TYPE");
            for (AssertionEdge edge : edges) {
                pw.println(String.join(",",
                        csvEscape(edge.sourceCui()),
                        csvEscape(edge.targetCui()),
                        csvEscape(edge.relationLabel()),
                        csvEscape(String.join(ARRAY_DELIMITER, edge.assertedBy())),
                        csvEscape(version),
                        csvEscape(edge.predicate().typeName())));
            }
            checkWritten(pw, file);
            return edges.size();
        }
    }

    /**
     * {@code Concept} followed by the sorted category labels.
     */
    static String labels(Concept concept) {
        String categories = concept.categories().stream()
                .map(BiolinkCategory::curie)
                .sorted()
                .collect(Collectors.joining(ARRAY_DELIMITER));
        return categories.isEmpty() ? CONCEPT_LABEL : CONCEPT_LABEL + ARRAY_DELIMITER + categories;
    }

    /**
     * Bulk-load command for the files written to an import directory. File names are relative
     * because the import tool resolves them against its import directory.
     */
    public static String importCommand(String databaseName) {
        return "neo4j-admin database import full \\\n"
                + "    --nodes=Concept=\"" + CONCEPTS_FILE + "\" \\\n"
                + "    --nodes=Code=\"" + CODES_FILE + "\" \\\n"
                + "    --relationships=" + CodeMembership.TYPE + "=\"" + HAS_CODE_FILE + "\" \\\n"
                + "    --relationships=\"" + INTER_CONCEPT_FILE + "\" \\\n"
                + "    --array-delimiter=\"" + ARRAY_DELIMITER + "\" \\\n"
                + "    --overwrite-destination=true \\\n"
                + "    " + databaseName;
    }

    private static PrintWriter open(Path file) throws IOException {
        return new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
    }

    private static void checkWritten(PrintWriter pw, Path file) throws IOException {
        pw.flush();
        if (pw.checkError()) {
            throw new IOException("Write failed: " + file);
        }
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
