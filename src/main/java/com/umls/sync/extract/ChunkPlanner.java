package com.umls.sync.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a newline-terminated file into contiguous byte ranges that never cut a record.
 *
 * <p>The file is divided into {@code size / parts} spans; every boundary except the end of
 * the file is moved forward to just past the next {@code '\n'}. The ranges are returned in
 * file order, cover the whole file and never overlap. A file smaller than {@code parts}
 * bytes, or one with few long lines, yields fewer ranges. An empty file yields none.</p>
 */
public class ChunkPlanner {
    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    private static final int SCAN_BUFFER_SIZE = 8192;

    public List<ByteRange> plan(Path file, int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be > 0");
        }
        if (!Files.isRegularFile(file)) {
            throw new SourceUnavailableException(file);
        }

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            List<ByteRange> ranges = new ArrayList<>();
            if (size == 0) {
                log.debug("chunk.plan file={} size=0 ranges=0", file.getFileName());
                return ranges;
            }

            long span = Math.max(1, size / parts);
            ByteBuffer buffer = ByteBuffer.allocate(SCAN_BUFFER_SIZE);
            long start = 0;
            while (start < size) {
                long end = Math.min(start + span, size);
                if (end < size) {
                    end = alignToRecordEnd(channel, end, size, buffer);
                }
                ranges.add(new ByteRange(start, end - start));
                start = end;
            }

            log.debug("chunk.plan file={} size={} parts={} ranges={}",
                    file.getFileName(), size, parts, ranges.size());
            return ranges;
        } catch (IOException e) {
            throw new SourceUnavailableException(file, e);
        }
    }

    /**
     * Returns the offset just past the first {@code '\n'} at or after {@code position - 1},
     * or {@code size} if there is none.
     */
    private long alignToRecordEnd(FileChannel channel, long position, long size, ByteBuffer buffer)
            throws IOException {
        long cursor = position - 1;
        while (cursor < size) {
            buffer.clear();
            int read = channel.read(buffer, cursor);
            if (read <= 0) {
                break;
            }
            for (int i = 0; i < read; i++) {
                if (buffer.get(i) == '\n') {
                    return cursor + i + 1;
                }
            }
            cursor += read;
        }
        return size;
    }
}
