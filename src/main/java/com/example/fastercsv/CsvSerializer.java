package com.example.fastercsv;

import java.util.List;
import java.util.Objects;

/**
 * Renders records as text that {@link RecordTokenizer} reads back unchanged.
 * <p>
 * {@code null} is written as nothing, unquoted. Any other field is written through
 * {@link String#valueOf(Object)} and quoted, with inner quotes doubled, when it is
 * empty or holds a quote, a carriage return, a line feed or a character of the
 * column separator. A field holding a custom row separator does not read back.
 */
class CsvSerializer {

    private static final char QUOTE = '"';

    private final String colSep;
    private final String rowSep;
    private final String specials;

    CsvSerializer(String colSep, String rowSep) {
        this.colSep = Objects.requireNonNull(colSep, "colSep");
        this.rowSep = Objects.requireNonNull(rowSep, "rowSep");
        this.specials = "\"\r\n" + colSep;
    }

    String render(List<?> fields) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                line.append(colSep);
            }
            appendField(line, fields.get(i));
        }
        return line.append(rowSep).toString();
    }

    private void appendField(StringBuilder line, Object field) {
        if (field == null) {
            return;
        }
        String text = String.valueOf(field);
        if (needsQuotes(text)) {
            line.append(QUOTE);
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == QUOTE) {
                    line.append(QUOTE);
                }
                line.append(c);
            }
            line.append(QUOTE);
        } else {
            line.append(text);
        }
    }

    private boolean needsQuotes(String text) {
        if (text.isEmpty()) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            if (specials.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
