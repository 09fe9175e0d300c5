package com.umls.sync.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the records of one byte range and applies a {@link RowMapper} to each.
 * Holds no state between calls and is safe to share between workers.
 */
public class RrfChunkReader {
    private static final Logger log = LoggerFactory.getLogger(RrfChunkReader.class);

    private static final Pattern FIELD_SPLITTER = Pattern.compile(Pattern.quote(RrfColumns.DELIMITER));
    private static final int INITIAL_LINE_CAPACITY = 512;
    private static final int BLOCK_SIZE = 64 * 1024;

    public <T> ChunkResult<T> read(Path file, int index, ByteRange range, RowMapper<T> mapper) throws IOException {
        CharsetDecoder decoder = strictDecoder();

        List<T> rows = new ArrayList<>();
        long rejected = 0;
        long malformed = 0;

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            channel.position(range.offset());
            ByteBuffer block = ByteBuffer.allocate(BLOCK_SIZE);
            byte[] data = block.array();

            byte[] line = new byte[INITIAL_LINE_CAPACITY];
            int lineLength = 0;
            long remaining = range.length();
            while (remaining > 0) {
                block.clear();
                if (remaining < BLOCK_SIZE) {
                    block.limit((int) remaining);
                }
                int read = channel.read(block);
                if (read < 0) {
                    break;
                }
                remaining -= read;

                int start = 0;
                for (int i = 0; i < read; i++) {
                    if (data[i] != '\n') {
                        continue;
                    }
                    line = append(line, lineLength, data, start, i - start);
                    lineLength += i - start;
                    LineOutcome outcome = process(line, lineLength, decoder, mapper, rows);
                    if (outcome == LineOutcome.REJECTED) rejected++;
                    if (outcome == LineOutcome.MALFORMED) malformed++;
                    lineLength = 0;
                    start = i + 1;
                }
                line = append(line, lineLength, data, start, read - start);
                lineLength += read - start;
            }
            if (lineLength > 0) {
                LineOutcome outcome = process(line, lineLength, decoder, mapper, rows);
                if (outcome == LineOutcome.REJECTED) rejected++;
                if (outcome == LineOutcome.MALFORMED) malformed++;
            }
        }

        if (malformed > 0) {
            log.debug("chunk.malformedRows file={} chunk={} malformed={}", file.getFileName(), index, malformed);
        }
        return new ChunkResult<>(index, range, rows, rejected, malformed);
    }

    private static byte[] append(byte[] line, int lineLength, byte[] data, int from, int count) {
        if (count == 0) {
            return line;
        }
        if (lineLength + count > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + count));
        }
        System.arraycopy(data, from, line, lineLength, count);
        return line;
    }

    private <T> LineOutcome process(byte[] bytes, int length, CharsetDecoder decoder,
                                    RowMapper<T> mapper, List<T> rows) {
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        if (length == 0) {
            return LineOutcome.SKIPPED;
        }

        String line = decode(decoder, bytes, 0, length);
        if (line == null) {
            return LineOutcome.MALFORMED;
        }

        String[] fields = split(line);
        if (!mapper.isWellFormed(fields)) {
            return LineOutcome.MALFORMED;
        }
        T mapped = mapper.map(fields);
        if (mapped == null) {
            return LineOutcome.REJECTED;
        }
        rows.add(mapped);
        return LineOutcome.ACCEPTED;
    }

    /**
     * UTF-8 decoder that reports malformed input instead of replacing it.
     */
    static CharsetDecoder strictDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    /**
     * Decodes {@code length} bytes from {@code offset}, or returns {@code null} if they are not valid UTF-8.
     */
    static String decode(CharsetDecoder decoder, byte[] bytes, int offset, int length) {
        try {
            decoder.reset();
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, offset, length));
            return chars.toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    /**
     * Splits an RRF line on {@code |}, keeping trailing empty fields.
     */
    public static String[] split(String line) {
        return FIELD_SPLITTER.split(line, -1);
    }

    private enum LineOutcome {
        ACCEPTED, REJECTED, MALFORMED, SKIPPED
    }
}
