package com.example.fastercsv;

import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for reading and writing. They are fixed once a {@link FasterCsv} is built.
 *
 * <table>
 *   <caption>Option table keys</caption>
 *   <tr><td>{@code col_sep}</td><td>column separator, {@code ","}</td></tr>
 *   <tr><td>{@code row_sep}</td><td>row separator, or {@link #AUTO} to discover it from the data</td></tr>
 *   <tr><td>{@code converters}</td><td>converter names and/or converters for data fields</td></tr>
 *   <tr><td>{@code headers}</td><td>false, true / {@link Headers#FIRST_ROW}, a list of names, or a line of names</td></tr>
 *   <tr><td>{@code return_headers}</td><td>also return the header row</td></tr>
 *   <tr><td>{@code header_converters}</td><td>converter names and/or converters for headers</td></tr>
 *   <tr><td>{@code skip_blanks}</td><td>skip blank lines</td></tr>
 * </table>
 */
@Data
public class CsvOptions {

    public static final String AUTO = "auto";

    public enum Headers {
        /** Read the headers from the first record. */
        FIRST_ROW
    }

    private String colSep = ",";
    private String rowSep = AUTO;
    private List<Object> converters = new ArrayList<>();
    private Object headers = Boolean.FALSE;
    private boolean returnHeaders = false;
    private List<Object> headerConverters = new ArrayList<>();
    private boolean skipBlanks = false;

    public static CsvOptions defaults() {
        return new CsvOptions();
    }

    /**
     * Builds options from an option table.
     *
     * @throws IllegalArgumentException for unknown keys or values of the wrong type
     */
    public static CsvOptions fromMap(Map<String, ?> table) {
        Map<String, Object> remaining = new LinkedHashMap<>(table);
        CsvOptions options = new CsvOptions();
        if (remaining.containsKey("col_sep")) {
            options.setColSep(asString("col_sep", remaining.remove("col_sep")));
        }
        if (remaining.containsKey("row_sep")) {
            options.setRowSep(asString("row_sep", remaining.remove("row_sep")));
        }
        if (remaining.containsKey("converters")) {
            options.setConverters(asList(remaining.remove("converters")));
        }
        if (remaining.containsKey("headers")) {
            options.setHeaders(remaining.remove("headers"));
        }
        if (remaining.containsKey("return_headers")) {
            options.setReturnHeaders(asBoolean("return_headers", remaining.remove("return_headers")));
        }
        if (remaining.containsKey("header_converters")) {
            options.setHeaderConverters(asList(remaining.remove("header_converters")));
        }
        if (remaining.containsKey("skip_blanks")) {
            options.setSkipBlanks(asBoolean("skip_blanks", remaining.remove("skip_blanks")));
        }
        if (!remaining.isEmpty()) {
            throw new IllegalArgumentException("Unknown options: " + String.join(", ", remaining.keySet()));
        }
        options.validate();
        return options;
    }

    public CsvOptions withColSep(String colSep) {
        setColSep(colSep);
        return this;
    }

    public CsvOptions withRowSep(String rowSep) {
        setRowSep(rowSep);
        return this;
    }

    public CsvOptions withConverters(Object... converters) {
        setConverters(new ArrayList<>(Arrays.asList(converters)));
        return this;
    }

    public CsvOptions withHeaders(Object headers) {
        setHeaders(headers);
        return this;
    }

    public CsvOptions withReturnHeaders(boolean returnHeaders) {
        setReturnHeaders(returnHeaders);
        return this;
    }

    public CsvOptions withHeaderConverters(Object... headerConverters) {
        setHeaderConverters(new ArrayList<>(Arrays.asList(headerConverters)));
        return this;
    }

    public CsvOptions withSkipBlanks(boolean skipBlanks) {
        setSkipBlanks(skipBlanks);
        return this;
    }

    /**
     * Checks the values set through the setters.
     *
     * @throws IllegalArgumentException if a value cannot be used
     */
    public void validate() {
        if (colSep == null || colSep.isEmpty()) {
            throw new IllegalArgumentException("col_sep must not be empty");
        }
        if (rowSep == null || rowSep.isEmpty()) {
            throw new IllegalArgumentException("row_sep must not be empty");
        }
        if (colSep.indexOf('"') >= 0) {
            throw new IllegalArgumentException("col_sep must not contain a quote");
        }
        if (converters == null || headerConverters == null) {
            throw new IllegalArgumentException("converter lists must not be null");
        }
        if (headers != null && !(headers instanceof Boolean) && !(headers instanceof Headers)
                && !(headers instanceof List) && !(headers instanceof String)) {
            throw new IllegalArgumentException("Unsupported headers value: " + headers);
        }
    }

    private static String asString(String key, Object value) {
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(key + " must be a String: " + value);
        }
        return (String) value;
    }

    private static boolean asBoolean(String key, Object value) {
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException(key + " must be a Boolean: " + value);
        }
        return (Boolean) value;
    }

    private static List<Object> asList(Object value) {
        List<Object> list = new ArrayList<>();
        if (value instanceof Collection) {
            list.addAll((Collection<?>) value);
        } else if (value != null) {
            list.add(value);
        }
        return list;
    }
}
