package com.example.fastercsv.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * A readable source of characters that can report end-of-stream, remember a
 * position and return to it, and (where the backing data allows) rewind to the start.
 */
public interface CsvSource extends Closeable {

    /**
     * Reads a single character, or returns -1 at end of stream.
     */
    int read() throws IOException;

    boolean isEof() throws IOException;

    /**
     * Remembers the current position. Only one mark is kept; marking again replaces it.
     */
    void mark();

    /**
     * Returns to the last mark. Characters read since the mark are read again.
     */
    void reset() throws IOException;

    void rewind() throws IOException;

    /**
     * Reads up to {@code len} characters, returning -1 if none were available.
     */
    default int read(char[] buf, int off, int len) throws IOException {
        int count = 0;
        while (count < len) {
            int c = read();
            if (c < 0) {
                break;
            }
            buf[off + count++] = (char) c;
        }
        return count == 0 && len > 0 ? -1 : count;
    }

    /**
     * Reads one physical line: everything up to and including the next occurrence of
     * {@code separator}, or up to end of stream. Returns null if no data is left.
     */
    default String readLine(String separator) throws IOException {
        StringBuilder line = new StringBuilder();
        char last = separator.charAt(separator.length() - 1);
        int c;
        while ((c = read()) >= 0) {
            line.append((char) c);
            if (c == last && line.length() >= separator.length()
                    && line.indexOf(separator, line.length() - separator.length()) >= 0) {
                break;
            }
        }
        return line.length() == 0 ? null : line.toString();
    }
}
