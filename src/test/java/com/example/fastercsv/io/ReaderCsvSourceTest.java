package com.example.fastercsv.io;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;

public class ReaderCsvSourceTest extends Assert {

    @Test
    public void testReadLine() throws IOException {
        ReaderCsvSource source = new ReaderCsvSource(new StringReader("a,b\r\nc\r\n\r\nd"));
        assertEquals("a,b\r\n", source.readLine("\r\n"));
        assertEquals("c\r\n", source.readLine("\r\n"));
        assertEquals("\r\n", source.readLine("\r\n"));
        assertEquals("d", source.readLine("\r\n"));
        assertNull(source.readLine("\r\n"));
        assertTrue(source.isEof());
    }

    @Test
    public void testLoneCarriageReturnIsNotACrLf() throws IOException {
        ReaderCsvSource source = new ReaderCsvSource(new StringReader("a\rb\r\nc"));
        assertEquals("a\rb\r\n", source.readLine("\r\n"));
        assertEquals("c", source.readLine("\r\n"));
    }

    @Test
    public void testResetReplaysFromMark() throws IOException {
        ReaderCsvSource source = new ReaderCsvSource(new StringReader("abcdef"));
        assertEquals('a', source.read());
        source.mark();
        char[] buf = new char[3];
        assertEquals(3, source.read(buf, 0, 3));
        assertEquals("bcd", new String(buf));
        source.reset();
        assertEquals("bcdef", source.readLine("\n"));
        assertEquals(-1, source.read());
    }

    @Test
    public void testPeekDoesNotConsume() throws IOException {
        ReaderCsvSource source = new ReaderCsvSource(new StringReader("xy"));
        assertFalse(source.isEof());
        assertFalse(source.isEof());
        source.mark();
        assertEquals('x', source.read());
        assertFalse(source.isEof());
        source.reset();
        assertEquals("xy", source.readLine("\n"));
        assertTrue(source.isEof());
    }

    @Test
    public void testResetWithoutMarkDoesNothing() throws IOException {
        ReaderCsvSource source = new ReaderCsvSource(new StringReader("abc"));
        source.read();
        source.reset();
        assertEquals('b', source.read());
    }

    @Test
    public void testRewindReopens() throws IOException {
        int[] opened = {0};
        ReaderCsvSource source = new ReaderCsvSource(() -> {
            opened[0]++;
            return new StringReader("one\ntwo\n");
        });
        assertEquals("one\n", source.readLine("\n"));
        source.mark();
        source.rewind();
        assertEquals(2, opened[0]);
        assertEquals("one\n", source.readLine("\n"));
        assertEquals("two\n", source.readLine("\n"));
        source.reset();
        assertNull(source.readLine("\n"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRewindWithoutOpener() throws IOException {
        new ReaderCsvSource(new StringReader("abc")).rewind();
    }

    @Test
    public void testStringSourceMatchesReaderSource() throws IOException {
        String data = "1,2\n\"3\n4\",5\n";
        StringCsvSource strings = new StringCsvSource(data);
        ReaderCsvSource reader = new ReaderCsvSource(new StringReader(data));
        String line;
        while ((line = strings.readLine("\n")) != null) {
            assertEquals(line, reader.readLine("\n"));
        }
        assertNull(reader.readLine("\n"));
        strings.rewind();
        assertEquals(0, strings.getPosition());
        assertFalse(strings.isEof());
    }
}
