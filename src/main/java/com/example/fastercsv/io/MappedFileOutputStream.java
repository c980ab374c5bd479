package com.example.fastercsv.io;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * OutputStream backed by chunked memory-mapped file regions. The file is grown a
 * chunk at a time while writing and truncated to the bytes actually written on close.
 */
@Slf4j
public class MappedFileOutputStream extends OutputStream {

    public static final long DEFAULT_CHUNK_SIZE = 16L * 1024 * 1024;

    private final FileChannel channel;
    private final long chunkSize;

    // absolute file position where the current mapping starts
    private long mappingStart = 0L;

    private MappedByteBuffer mapped;

    public MappedFileOutputStream(File file) throws IOException {
        this(file, DEFAULT_CHUNK_SIZE);
    }

    public MappedFileOutputStream(File file, long chunkSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.channel = FileChannel.open(file.toPath(),
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);
    }

    private void mapNext(long minSize) throws IOException {
        if (mapped != null) {
            mappingStart += mapped.position();
            UnmapUtil.unmap(mapped);
            mapped = null;
        }

        // mapping past the end grows the file
        long mapSize = Math.max(minSize, chunkSize);
        mapped = channel.map(FileChannel.MapMode.READ_WRITE, mappingStart, mapSize);
        log.debug("Mapped output chunk: start={}, size={}", mappingStart, mapped.capacity());
    }

    @Override
    public synchronized void write(int b) throws IOException {
        if (mapped == null || !mapped.hasRemaining()) {
            mapNext(1);
        }
        mapped.put((byte) b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        int remaining = len;
        int srcPos = off;
        while (remaining > 0) {
            if (mapped == null || !mapped.hasRemaining()) {
                mapNext(remaining);
            }
            int toWrite = Math.min(mapped.remaining(), remaining);
            mapped.put(b, srcPos, toWrite);
            srcPos += toWrite;
            remaining -= toWrite;
        }
    }

    @Override
    public synchronized void flush() {
        if (mapped != null) {
            mapped.force();
        }
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            if (mapped != null) {
                mapped.force();
                mappingStart += mapped.position();
                UnmapUtil.unmap(mapped);
                mapped = null;
            }
            if (channel.size() > mappingStart) {
                channel.truncate(mappingStart);
            }
        } finally {
            channel.close();
        }
    }
}
