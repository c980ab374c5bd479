package com.example.fastercsv.io;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * InputStream over a file mapped a chunk at a time. Each chunk is unmapped as
 * soon as the next one is mapped, so at most one chunk is resident.
 */
@Slf4j
public class MappedFileInputStream extends InputStream {

    public static final long DEFAULT_CHUNK_SIZE = 64L * 1024 * 1024;

    private final FileChannel channel;
    private final long fileSize;
    private final long chunkSize;
    private long position = 0;

    private MappedByteBuffer mapped;

    public MappedFileInputStream(File file) throws IOException {
        this(file, DEFAULT_CHUNK_SIZE);
    }

    public MappedFileInputStream(File file, long chunkSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.channel = FileChannel.open(file.toPath(), StandardOpenOption.READ);
        this.fileSize = channel.size();
        this.chunkSize = chunkSize;
        mapNext();
    }

    private void mapNext() throws IOException {
        UnmapUtil.unmap(mapped);
        if (position >= fileSize) {
            mapped = null;
            return;
        }
        long size = Math.min(chunkSize, fileSize - position);
        mapped = channel.map(FileChannel.MapMode.READ_ONLY, position, size);
        position += size;
        log.debug("Mapped input chunk: start={}, size={}", position - size, size);
    }

    @Override
    public int read() throws IOException {
        while (mapped != null) {
            if (mapped.hasRemaining()) {
                return mapped.get() & 0xFF;
            }
            mapNext();
        }
        return -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        int totalRead = 0;
        while (len > 0 && mapped != null) {
            if (!mapped.hasRemaining()) {
                mapNext();
                continue;
            }
            int toRead = Math.min(len, mapped.remaining());
            mapped.get(b, off, toRead);
            off += toRead;
            len -= toRead;
            totalRead += toRead;
        }
        return totalRead == 0 ? -1 : totalRead;
    }

    @Override
    public void close() throws IOException {
        try {
            UnmapUtil.unmap(mapped);
            mapped = null;
        } finally {
            channel.close();
        }
    }
}
