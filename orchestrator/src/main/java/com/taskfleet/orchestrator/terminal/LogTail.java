package com.taskfleet.orchestrator.terminal;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the tail of a text file without loading the whole file.
 */
public final class LogTail {

    /** Only this many trailing bytes are ever read. */
    static final int MAX_TAIL_BYTES = 256 * 1024;

    private LogTail() {}

    /**
     * Return up to {@code lines} trailing lines of {@code file}, newline-joined.
     * A trailing newline does not produce an empty last line.
     */
    public static String lastLines(Path file, int lines) throws IOException {
        if (lines <= 0) return "";

        byte[] tail;
        boolean truncated;
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long length = raf.length();
            int  size   = (int) Math.min(length, MAX_TAIL_BYTES);
            tail = new byte[size];
            raf.seek(length - size);
            raf.readFully(tail);
            truncated = size < length;
        }

        List<String> all = Arrays.asList(new String(tail, StandardCharsets.UTF_8).split("\r?\n", -1));
        int end = all.size();
        if (end > 0 && all.get(end - 1).isEmpty()) end--;
        // the first line of a truncated read is almost always partial
        int start = Math.min(end, Math.max(truncated ? 1 : 0, end - lines));
        return String.join("\n", all.subList(start, end));
    }
}
