package com.umls.sync.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkPlanner Tests")
class ChunkPlannerTest {

    @TempDir
    Path tempDir;

    private final ChunkPlanner planner = new ChunkPlanner();

    @Test
    @DisplayName("Ranges should cover the file contiguously and end on record boundaries")
    void rangesCoverFileOnRecordBoundaries() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            lines.add("C" + i + "|row with some variable length " + "x".repeat(i % 17) + "|");
        }
        Path file = RrfFixtures.write(tempDir.resolve("MRCONSO.RRF"), lines);
        byte[] bytes = Files.readAllBytes(file);

        List<ByteRange> ranges = planner.plan(file, 7);

        assertFalse(ranges.isEmpty());
        long expectedOffset = 0;
        for (ByteRange range : ranges) {
            assertEquals(expectedOffset, range.offset(), "ranges must not leave gaps or overlap");
            assertTrue(range.length() > 0);
            assertEquals('\n', bytes[(int) range.end() - 1], "every range ends just past a newline");
            expectedOffset = range.end();
        }
        assertEquals(bytes.length, expectedOffset);
    }

    @Test
    @DisplayName("Last range should reach end of file without trailing newline")
    void lastRangeWithoutTrailingNewline() throws IOException {
        Path file = tempDir.resolve("MRREL.RRF");
        Files.writeString(file, "a|b|\nc|d|\ne|f|");

        List<ByteRange> ranges = planner.plan(file, 3);

        assertEquals(Files.size(file), ranges.get(ranges.size() - 1).end());
    }

    @Test
    @DisplayName("A single long line should yield a single range")
    void singleLongLine() throws IOException {
        Path file = tempDir.resolve("long.RRF");
        Files.writeString(file, "x".repeat(1000) + "\n");

        List<ByteRange> ranges = planner.plan(file, 10);

        assertEquals(1, ranges.size());
        assertEquals(new ByteRange(0, 1001), ranges.get(0));
    }

    @Test
    @DisplayName("Empty file should yield no ranges")
    void emptyFile() throws IOException {
        Path file = Files.createFile(tempDir.resolve("empty.RRF"));

        assertTrue(planner.plan(file, 4).isEmpty());
    }

    @Test
    @DisplayName("Missing file should be reported as unavailable source")
    void missingFile() {
        Path missing = tempDir.resolve("MRCONSO.RRF");

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> planner.plan(missing, 4));
        assertEquals(missing, e.getPath());
    }

    @Test
    @DisplayName("Non-positive part count should be rejected")
    void rejectsNonPositiveParts() throws IOException {
        Path file = RrfFixtures.write(tempDir.resolve("x.RRF"), List.of("a|"));

        assertThrows(IllegalArgumentException.class, () -> planner.plan(file, 0));
    }
}
