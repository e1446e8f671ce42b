package io.walkie.runtime;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a byte stream into newline-terminated UTF-8 records. Blank records are
 * skipped. A record longer than the limit, finished or not, is an overflow.
 */
public final class LineFramer {
    private final int maxRecordBytes;
    private byte[] buffer;
    private int length;

    public LineFramer(int maxRecordBytes) {
        this.maxRecordBytes = maxRecordBytes;
        this.buffer = new byte[Math.min(maxRecordBytes, 4096)];
    }

    public List<String> append(byte[] chunk) throws FrameOverflowException {
        List<String> records = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] != '\n') {
                continue;
            }
            int partLength = i - start;
            if (length + partLength > maxRecordBytes) {
                throw new FrameOverflowException(length + partLength, maxRecordBytes);
            }
            String record;
            if (length == 0) {
                record = new String(chunk, start, partLength, StandardCharsets.UTF_8);
            } else {
                put(chunk, start, partLength);
                record = new String(buffer, 0, length, StandardCharsets.UTF_8);
                length = 0;
            }
            if (!record.isBlank()) {
                records.add(record);
            }
            start = i + 1;
        }
        int rest = chunk.length - start;
        if (length + rest > maxRecordBytes) {
            throw new FrameOverflowException(length + rest, maxRecordBytes);
        }
        put(chunk, start, rest);
        return records;
    }

    public int bufferedBytes() {
        return length;
    }

    private void put(byte[] src, int offset, int count) {
        if (count == 0) {
            return;
        }
        if (length + count > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.min(maxRecordBytes, Math.max(buffer.length * 2, length + count)));
        }
        System.arraycopy(src, offset, buffer, length, count);
        length += count;
    }

    public static final class FrameOverflowException extends Exception {
        public FrameOverflowException(int size, int limit) {
            super("record of " + size + " bytes exceeds limit of " + limit);
        }
    }
}
