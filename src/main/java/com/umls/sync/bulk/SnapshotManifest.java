package com.umls.sync.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Description of a written snapshot, stored as {@value #FILE_NAME} next to the CSV files.
 *
 * @param version       release version the rows are stamped with
 * @param createdAt     ISO-8601 instant the snapshot was written
 * @param rowCounts     data rows per file, keyed by file name
 * @param importCommand bulk-load command for the written files
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotManifest(
        @JsonProperty("version") String version,
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("rowCounts") Map<String, Long> rowCounts,
        @JsonProperty("importCommand") String importCommand
) {
    public static final String FILE_NAME = "snapshot-manifest.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public SnapshotManifest {
        rowCounts = rowCounts != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(rowCounts))
                : Map.of();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize snapshot manifest", e);
        }
    }

    public static SnapshotManifest fromJson(String json) {
        try {
            return MAPPER.readValue(json, SnapshotManifest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid snapshot manifest: " + e.getOriginalMessage(), e);
        }
    }

    public void writeTo(Path directory) {
        try {
            Files.writeString(directory.resolve(FILE_NAME), toJson());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + FILE_NAME + " to " + directory, e);
        }
    }

    /**
     * Reads the manifest of {@code directory}.
     *
     * @throws UncheckedIOException if the manifest is missing or unreadable
     */
    public static SnapshotManifest readFrom(Path directory) {
        try {
            return fromJson(Files.readString(directory.resolve(FILE_NAME)));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + FILE_NAME + " from " + directory, e);
        }
    }
}
