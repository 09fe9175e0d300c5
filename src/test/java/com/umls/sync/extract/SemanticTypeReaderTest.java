package com.umls.sync.extract;

import com.umls.sync.core.model.BiolinkCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SemanticTypeReader Tests")
class SemanticTypeReaderTest {

    @TempDir
    Path tempDir;

    private final SemanticTypeReader reader = new SemanticTypeReader();

    @Test
    @DisplayName("Should collect the categories of every semantic type of a concept")
    void collectsCategories() throws IOException {
        Path file = RrfFixtures.write(tempDir.resolve("MRSTY.RRF"), List.of(
                RrfFixtures.sty("C0000001", "T047"),
                RrfFixtures.sty("C0000001", "T184"),
                RrfFixtures.sty("C0000002", "T121"),
                RrfFixtures.sty("C0000003", "T999")));

        Map<String, Set<BiolinkCategory>> categories = reader.read(file);

        assertEquals(Set.of(BiolinkCategory.DISEASE, BiolinkCategory.SIGN_OR_SYMPTOM), categories.get("C0000001"));
        assertEquals(Set.of(BiolinkCategory.DRUG), categories.get("C0000002"));
        assertEquals(Set.of(BiolinkCategory.NAMED_THING), categories.get("C0000003"));
    }

    @Test
    @DisplayName("Malformed rows should be skipped")
    void skipsMalformedRows() throws IOException {
        Path file = RrfFixtures.write(tempDir.resolve("MRSTY.RRF"), List.of(
                "C0000001|T047|",
                RrfFixtures.sty("", "T047"),
                RrfFixtures.sty("C0000002", "T047")));

        Map<String, Set<BiolinkCategory>> categories = reader.read(file);

        assertEquals(Set.of("C0000002"), categories.keySet());
    }

    @Test
    @DisplayName("Missing file should be reported as unavailable source")
    void missingFile() {
        assertThrows(SourceUnavailableException.class, () -> reader.read(tempDir.resolve("MRSTY.RRF")));
    }
}
