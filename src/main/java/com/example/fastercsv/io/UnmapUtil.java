package com.example.fastercsv.io;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;

/**
 * Releases the mapping behind a {@link MappedByteBuffer} before the garbage
 * collector gets to it (best-effort).
 */
@Slf4j
final class UnmapUtil {

    private UnmapUtil() {}

    static void unmap(MappedByteBuffer buffer) {
        if (buffer == null) return;
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field f = unsafeClass.getDeclaredField("theUnsafe");
            f.setAccessible(true);
            Object theUnsafe = f.get(null);
            Method invokeCleaner = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
            invokeCleaner.invoke(theUnsafe, buffer);
            log.debug("Unmapped buffer of {} bytes", buffer.capacity());
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.warn("Unable to unmap buffer, leaving it to the garbage collector: {}", e.toString());
        }
    }
}
