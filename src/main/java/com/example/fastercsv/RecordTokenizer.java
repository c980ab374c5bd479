package com.example.fastercsv;

import com.example.fastercsv.io.CsvSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits the source into records. A record is read one physical line at a time; when
 * a quoted field is still open at the end of the line, the next line is appended and
 * the whole buffer is tokenized again.
 * <p>
 * Empty unquoted fields come back as {@code null} and an empty quoted field
 * ({@code ""}) as the empty string. A blank line is a record with no fields.
 * <p>
 * Quoting errors that can be seen within the buffer (a quote inside an unquoted
 * field, anything other than a separator after a closing quote, a line break in an
 * unquoted field) fail immediately rather than reading on.
 */
@Slf4j
class RecordTokenizer {

    private static final char QUOTE = '"';

    private final String colSep;
    private final String rowSep;
    private final CsvSource source;

    RecordTokenizer(String colSep, String rowSep, CsvSource source) {
        this.colSep = Objects.requireNonNull(colSep, "colSep");
        this.rowSep = Objects.requireNonNull(rowSep, "rowSep");
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Reads the next record.
     *
     * @param lineNumber number of the record about to be read, reported in errors
     * @return the raw fields, or null at end of stream
     * @throws MalformedCsvException if the data breaks the quoting rules
     */
    List<String> next(long lineNumber) throws IOException {
        StringBuilder buffer = new StringBuilder();
        int physicalLines = 0;
        while (true) {
            String line = source.readLine(rowSep);
            if (line == null) {
                return null;
            }
            buffer.append(line);
            physicalLines++;

            String parse = buffer.toString();
            if (parse.endsWith(rowSep)) {
                parse = parse.substring(0, parse.length() - rowSep.length());
            }
            if (parse.isEmpty()) {
                return Collections.emptyList();
            }

            List<String> fields = tokenize(parse, lineNumber);
            if (fields != null) {
                if (physicalLines > 1) {
                    log.debug("Record {} spans {} physical lines", lineNumber, physicalLines);
                }
                return fields;
            }
            if (source.isEof()) {
                throw new MalformedCsvException("Unclosed quoted field", lineNumber);
            }
        }
    }

    /**
     * Tokenizes one buffered record.
     *
     * @return the fields, or null when the last field is a quoted field that is still open
     */
    private List<String> tokenize(String parse, long lineNumber) {
        List<String> fields = new ArrayList<>();
        int length = parse.length();
        int pos = 0;

        while (parse.startsWith(colSep, pos)) {
            fields.add(null);
            pos += colSep.length();
        }

        while (true) {
            if (pos < length && parse.charAt(pos) == QUOTE) {
                StringBuilder value = new StringBuilder();
                int from = pos + 1;
                while (true) {
                    int quote = parse.indexOf(QUOTE, from);
                    if (quote < 0) {
                        return null;
                    }
                    value.append(parse, from, quote);
                    if (quote + 1 < length && parse.charAt(quote + 1) == QUOTE) {
                        value.append(QUOTE);
                        from = quote + 2;
                    } else {
                        pos = quote + 1;
                        break;
                    }
                }
                fields.add(value.toString());
            } else {
                int end = parse.indexOf(colSep, pos);
                if (end < 0) {
                    end = length;
                }
                if (end == pos) {
                    fields.add(null);
                } else {
                    String value = parse.substring(pos, end);
                    if (value.indexOf(QUOTE) >= 0) {
                        throw new MalformedCsvException("Illegal quoting", lineNumber);
                    }
                    if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
                        throw new MalformedCsvException("Unquoted fields do not allow \\r or \\n", lineNumber);
                    }
                    fields.add(value);
                }
                pos = end;
            }

            if (pos == length) {
                return fields;
            }
            if (!parse.startsWith(colSep, pos)) {
                throw new MalformedCsvException("Illegal quoting", lineNumber);
            }
            pos += colSep.length();
        }
    }
}
