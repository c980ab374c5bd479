package com.example.fastercsv.io;

import java.util.Objects;

/**
 * Source over an in-memory character sequence.
 */
public class StringCsvSource implements CsvSource {

    private final String data;
    private int position = 0;
    private int mark = 0;

    public StringCsvSource(CharSequence data) {
        this.data = Objects.requireNonNull(data, "data").toString();
    }

    @Override
    public int read() {
        return position < data.length() ? data.charAt(position++) : -1;
    }

    @Override
    public int read(char[] buf, int off, int len) {
        if (len == 0) {
            return 0;
        }
        if (position >= data.length()) {
            return -1;
        }
        int count = Math.min(len, data.length() - position);
        data.getChars(position, position + count, buf, off);
        position += count;
        return count;
    }

    @Override
    public String readLine(String separator) {
        if (position >= data.length()) {
            return null;
        }
        int found = data.indexOf(separator, position);
        int end = found < 0 ? data.length() : found + separator.length();
        String line = data.substring(position, end);
        position = end;
        return line;
    }

    @Override
    public boolean isEof() {
        return position >= data.length();
    }

    @Override
    public void mark() {
        mark = position;
    }

    @Override
    public void reset() {
        position = mark;
    }

    @Override
    public void rewind() {
        position = 0;
        mark = 0;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public void close() {
    }
}
