package com.example.fastercsv.io;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Source over a {@link Reader}. Characters read after {@link #mark()} are retained
 * in memory until {@link #reset()} replays them or a new mark replaces the old one,
 * so a mark should only span a bounded look-ahead.
 * <p>
 * Rewinding requires an {@link Opener} that can produce a fresh reader positioned
 * at the start of the data.
 */
@Slf4j
public class ReaderCsvSource implements CsvSource {

    /**
     * Opens a new reader over the same data.
     */
    @FunctionalInterface
    public interface Opener {
        Reader open() throws IOException;
    }

    private final Opener opener;
    private Reader in;

    // characters to hand out before reading from {@code in} again
    private StringBuilder replay = new StringBuilder();
    private int replayPos = 0;

    // characters consumed since the mark, null when no mark is set
    private StringBuilder retained;

    public ReaderCsvSource(Reader reader) {
        this.opener = null;
        this.in = buffered(Objects.requireNonNull(reader, "reader"));
    }

    public ReaderCsvSource(Opener opener) throws IOException {
        this.opener = Objects.requireNonNull(opener, "opener");
        this.in = buffered(opener.open());
    }

    private static Reader buffered(Reader reader) {
        return reader instanceof BufferedReader ? reader : new BufferedReader(reader);
    }

    @Override
    public int read() throws IOException {
        int c;
        if (replayPos < replay.length()) {
            c = replay.charAt(replayPos++);
            if (replayPos == replay.length()) {
                replay.setLength(0);
                replayPos = 0;
            }
        } else {
            c = in.read();
        }
        if (c >= 0 && retained != null) {
            retained.append((char) c);
        }
        return c;
    }

    @Override
    public boolean isEof() throws IOException {
        if (replayPos < replay.length()) {
            return false;
        }
        int c = in.read();
        if (c < 0) {
            return true;
        }
        // peeked, not consumed
        replay.append((char) c);
        return false;
    }

    @Override
    public void mark() {
        retained = new StringBuilder();
    }

    @Override
    public void reset() {
        if (retained == null) {
            return;
        }
        StringBuilder pending = new StringBuilder(retained.length() + replay.length() - replayPos);
        pending.append(retained).append(replay, replayPos, replay.length());
        replay = pending;
        replayPos = 0;
        retained = null;
    }

    @Override
    public void rewind() throws IOException {
        if (opener == null) {
            throw new UnsupportedOperationException("This reader cannot be rewound");
        }
        in.close();
        in = buffered(opener.open());
        replay = new StringBuilder();
        replayPos = 0;
        retained = null;
        log.debug("Rewound reader source");
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
