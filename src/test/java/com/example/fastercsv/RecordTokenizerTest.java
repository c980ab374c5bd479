package com.example.fastercsv;

import com.example.fastercsv.io.StringCsvSource;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class RecordTokenizerTest extends Assert {

    private static final Object[][] CASES = {
            {"a,b", Arrays.asList("a", "b")},
            {"a,\"\"\"b\"\"\"", Arrays.asList("a", "\"b\"")},
            {"a,\"\"\"b\"", Arrays.asList("a", "\"b")},
            {"a,\"b\"\"\"", Arrays.asList("a", "b\"")},
            {"a,\"\nb\"\"\"", Arrays.asList("a", "\nb\"")},
            {"a,\"\"\"\nb\"", Arrays.asList("a", "\"\nb")},
            {"a,\"\"\"\nb\n\"\"\"", Arrays.asList("a", "\"\nb\n\"")},
            {"a,\"\"\"\nb\n\"\"\",\nc", Arrays.asList("a", "\"\nb\n\"", null)},
            {"a,,,", Arrays.asList("a", null, null, null)},
            {",", Arrays.asList(null, null)},
            {"\"\",\"\"", Arrays.asList("", "")},
            {"\"\"\"\"", Arrays.asList("\"")},
            {"\"\"\"\",\"\"", Arrays.asList("\"", "")},
            {",\"\"", Arrays.asList(null, "")},
            {",\"\r\"", Arrays.asList(null, "\r")},
            {"\"\r\n,\"", Arrays.asList("\r\n,")},
            {"\"\r\n,\",", Arrays.asList("\r\n,", null)},
    };

    @Test
    public void testParsesQuotingCases() throws IOException {
        for (Object[] c : CASES) {
            assertEquals("parsing " + c[0], c[1], parseLine((String) c[0], ","));
        }
    }

    @Test
    public void testOtherColumnSeparators() throws IOException {
        for (String sep : Arrays.asList(";", "\t", "||")) {
            for (Object[] c : CASES) {
                List<String> expected = new ArrayList<>();
                for (Object field : (List<?>) c[1]) {
                    expected.add(field == null ? null : ((String) field).replace(",", sep));
                }
                String line = ((String) c[0]).replace(",", sep);
                assertEquals("parsing " + line, expected, parseLine(line, sep));
            }
        }
        assertEquals(Arrays.asList(",,,", null), parseLine(",,,;", ";"));
    }

    @Test
    public void testEmptyFieldsAreNullButEmptyQuotedFieldsAreEmptyStrings() throws IOException {
        assertEquals(Arrays.asList(null, null, null, null), parseLine(",,,", ","));
        assertEquals(Arrays.asList("", ""), parseLine("\"\",\"\"", ","));
    }

    @Test
    public void testBlankLineIsARecordWithoutFields() throws IOException {
        RecordTokenizer tokenizer = tokenizer("a\n\nb\n", ",", "\n");
        assertEquals(Collections.singletonList("a"), tokenizer.next(1));
        assertEquals(Collections.emptyList(), tokenizer.next(2));
        assertEquals(Collections.singletonList("b"), tokenizer.next(3));
        assertNull(tokenizer.next(4));
    }

    @Test
    public void testEndOfStreamIsRepeatable() throws IOException {
        RecordTokenizer tokenizer = tokenizer("1,2\n3,4\n\n", ",", "\n");
        assertEquals(Arrays.asList("1", "2"), tokenizer.next(1));
        assertEquals(Arrays.asList("3", "4"), tokenizer.next(2));
        assertEquals(Collections.emptyList(), tokenizer.next(3));
        assertNull(tokenizer.next(4));
        assertNull(tokenizer.next(4));
    }

    @Test
    public void testLastLineWithoutTerminator() throws IOException {
        RecordTokenizer tokenizer = tokenizer("1,2\n3,4", ",", "\n");
        assertEquals(Arrays.asList("1", "2"), tokenizer.next(1));
        assertEquals(Arrays.asList("3", "4"), tokenizer.next(2));
        assertNull(tokenizer.next(3));
    }

    @Test
    public void testMultiCharacterRowSeparator() throws IOException {
        assertEquals(Arrays.asList("1", "2", "3\n", "4", "5"),
                tokenizer("1,2,\"3\n\",4,5\r\n", ",", "\r\n").next(1));
        RecordTokenizer tokenizer = tokenizer("a|b<EOL>c|d<EOL>", "|", "<EOL>");
        assertEquals(Arrays.asList("a", "b"), tokenizer.next(1));
        assertEquals(Arrays.asList("c", "d"), tokenizer.next(2));
        assertNull(tokenizer.next(3));
    }

    @Test
    public void testQuotedFieldSpanningLines() throws IOException {
        RecordTokenizer tokenizer = tokenizer("1,\"multi\nline\nfield\",3\n4,5,6\n", ",", "\n");
        assertEquals(Arrays.asList("1", "multi\nline\nfield", "3"), tokenizer.next(1));
        assertEquals(Arrays.asList("4", "5", "6"), tokenizer.next(2));
    }

    @Test
    public void testLineBreakInUnquotedField() throws IOException {
        try {
            tokenizer("1,2,3\n,4,5\r\n", ",", "\r\n").next(1);
            fail();
        } catch (MalformedCsvException e) {
            assertTrue(e.getMessage().startsWith("Unquoted fields do not allow"));
            assertEquals(1, e.getLineNumber());
        }
    }

    @Test
    public void testUnclosedQuotedField() throws IOException {
        RecordTokenizer tokenizer = tokenizer("ok\n1,\"open\nstill open\n", ",", "\n");
        assertEquals(Collections.singletonList("ok"), tokenizer.next(1));
        try {
            tokenizer.next(2);
            fail();
        } catch (MalformedCsvException e) {
            assertTrue(e.getMessage().startsWith("Unclosed quoted field"));
            assertEquals(2, e.getLineNumber());
        }
    }

    @Test(expected = MalformedCsvException.class)
    public void testQuoteInsideUnquotedField() throws IOException {
        parseLine("a,b\"c\",d", ",");
    }

    @Test(expected = MalformedCsvException.class)
    public void testTextAfterClosingQuote() throws IOException {
        parseLine("a,\"b\"c,d", ",");
    }

    @Test(timeout = 2000)
    public void testFailsFastOnStrayQuoteBeforeLargePayload() throws IOException {
        StringBuilder data = new StringBuilder("valid,fields,bad start\"");
        appendBigData(data);
        RecordTokenizer tokenizer = tokenizer(data.toString(), ",", "\n");
        try {
            tokenizer.next(1);
            fail();
        } catch (MalformedCsvException e) {
            assertTrue(e.getMessage().startsWith("Illegal quoting"));
        }
    }

    @Test(timeout = 2000)
    public void testFailsFastOnUnescapedQuoteBeforeLargePayload() throws IOException {
        StringBuilder data = new StringBuilder("valid,fields,\"bad start\"unescaped");
        appendBigData(data);
        StringCsvSource source = new StringCsvSource(data.toString());
        try {
            new RecordTokenizer(",", "\n", source).next(1);
            fail();
        } catch (MalformedCsvException e) {
            assertTrue(e.getMessage().startsWith("Illegal quoting"));
        }
        // only the first physical line was consumed
        assertEquals("valid,fields,\"bad start\"unescaped123456789\n".length(), source.getPosition());
    }

    private static void appendBigData(StringBuilder data) {
        for (int i = 0; i < 200_000; i++) {
            data.append("123456789\n");
        }
    }

    private static RecordTokenizer tokenizer(String data, String colSep, String rowSep) {
        return new RecordTokenizer(colSep, rowSep, new StringCsvSource(data));
    }

    private static List<Object> parseLine(String line, String colSep) throws IOException {
        return FasterCsv.parseLine(line, CsvOptions.defaults().withColSep(colSep));
    }
}
