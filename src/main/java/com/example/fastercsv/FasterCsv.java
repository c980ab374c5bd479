package com.example.fastercsv;

import com.example.fastercsv.io.CsvSource;
import com.example.fastercsv.io.MappedFileInputStream;
import com.example.fastercsv.io.MappedFileOutputStream;
import com.example.fastercsv.io.ReaderCsvSource;
import com.example.fastercsv.io.StringCsvSource;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Reads and writes delimiter separated text one record at a time.
 * <p>
 * Reading:
 * <pre>
 * try (FasterCsv csv = new FasterCsv("first,second\nA,B\n", CsvOptions.defaults().withHeaders(true))) {
 *     for (Row row : csv) {
 *         row.field("second");
 *     }
 * }
 * </pre>
 * Writing:
 * <pre>
 * String text = FasterCsv.generate(CsvOptions.defaults(), csv -&gt; csv.append(List.of("a", "b")));
 * </pre>
 * Separators are resolved once, when the object is built; with row separator
 * {@link CsvOptions#AUTO} the source is read ahead to find the first line ending
 * and then returned to where it was.
 * <p>
 * Instances are not thread-safe.
 */
@Slf4j
public class FasterCsv implements Iterable<Row>, Closeable {

    /**
     * Callback that may fail with an {@link IOException}.
     */
    @FunctionalInterface
    public interface CsvConsumer<T> {
        void accept(T value) throws IOException;
    }

    private final CsvSource source;
    private final Writer sink;
    private final String colSep;
    private final String rowSep;
    private final RecordTokenizer tokenizer;
    private final CsvSerializer serializer;
    private final ConverterPipeline converters;
    private final ConverterPipeline headerConverters;

    private final boolean useHeaders;
    private final boolean returnHeaders;
    private final boolean skipBlanks;
    // headers given as options rather than read from the data
    private final List<Object> literalHeaders;

    private List<Object> headers;
    private boolean headerRowPending;
    private long lineNumber = 0;

    public FasterCsv(String data, CsvOptions options) throws IOException {
        this(new StringCsvSource(data), null, options);
    }

    public FasterCsv(Reader reader, CsvOptions options) throws IOException {
        this(new ReaderCsvSource(reader), null, options);
    }

    public FasterCsv(Writer writer, CsvOptions options) throws IOException {
        this(null, writer, options);
    }

    /**
     * @param source where records are read from, or null for a write-only stream
     * @param sink   where records are written to, or null for a read-only stream
     * @throws IllegalArgumentException if the options are invalid
     */
    public FasterCsv(CsvSource source, Writer sink, CsvOptions options) throws IOException {
        options.validate();
        this.source = source;
        this.sink = sink;
        this.colSep = options.getColSep();
        this.rowSep = SeparatorResolver.resolveRowSeparator(options.getRowSep(), source);
        this.tokenizer = source == null ? null : new RecordTokenizer(colSep, rowSep, source);
        this.serializer = new CsvSerializer(colSep, rowSep);

        this.converters = new ConverterPipeline(ConverterRegistry.fieldConverters());
        converters.addAll(options.getConverters());
        this.headerConverters = new ConverterPipeline(ConverterRegistry.headerConverters());
        headerConverters.addAll(options.getHeaderConverters());

        Object headersOption = options.getHeaders();
        this.returnHeaders = options.isReturnHeaders();
        this.skipBlanks = options.isSkipBlanks();
        if (headersOption instanceof List) {
            this.literalHeaders = new ArrayList<>((List<?>) headersOption);
        } else if (headersOption instanceof String) {
            List<String> parsed = new RecordTokenizer(colSep, rowSep, new StringCsvSource((String) headersOption)).next(0);
            this.literalHeaders = parsed == null ? new ArrayList<>() : new ArrayList<>(parsed);
        } else {
            this.literalHeaders = null;
        }
        this.useHeaders = literalHeaders != null
                || Boolean.TRUE.equals(headersOption)
                || headersOption == CsvOptions.Headers.FIRST_ROW;
        resetHeaders();
        log.debug("Opened with col_sep={}, row_sep={}, headers={}",
                SeparatorResolver.escape(colSep), SeparatorResolver.escape(rowSep), useHeaders);
    }

    private void resetHeaders() {
        if (literalHeaders != null) {
            headers = Collections.unmodifiableList(headerConverters.apply(literalHeaders, 0));
            headerRowPending = returnHeaders;
        } else {
            headers = null;
            headerRowPending = false;
        }
    }

    // --- reading ---

    /**
     * Reads the next row.
     * <p>
     * Without headers the row has no header names and holds the converted fields.
     * With headers read from the data, the first record supplies the headers and is
     * returned as a header row only when {@code return_headers} is set. A blank line
     * is a row with neither headers nor fields, unless {@code skip_blanks} drops it.
     *
     * @return the row, or null at end of stream
     * @throws MalformedCsvException if the data breaks the quoting rules
     */
    public Row shift() throws IOException {
        requireSource();
        if (headerRowPending) {
            headerRowPending = false;
            return new Row(headers, headers, true);
        }
        while (true) {
            List<String> record = tokenizer.next(lineNumber + 1);
            if (record == null) {
                return null;
            }
            lineNumber++;
            if (record.isEmpty()) {
                if (skipBlanks) {
                    continue;
                }
                // blank lines never supply headers
                return new Row(Collections.emptyList(), Collections.emptyList(), false);
            }
            if (useHeaders && headers == null) {
                headers = Collections.unmodifiableList(headerConverters.apply(record, lineNumber));
                if (returnHeaders) {
                    return new Row(headers, headers, true);
                }
                continue;
            }
            List<Object> fields = converters.isEmpty() ? new ArrayList<>(record) : converters.apply(record, lineNumber);
            return new Row(useHeaders ? headers : Collections.emptyList(), fields, false);
        }
    }

    /**
     * Reads the next row and returns just its fields, or null at end of stream.
     */
    public List<Object> shiftFields() throws IOException {
        Row row = shift();
        return row == null ? null : row.fields();
    }

    public List<Row> readAll() throws IOException {
        List<Row> rows = new ArrayList<>();
        Row row;
        while ((row = shift()) != null) {
            rows.add(row);
        }
        return rows;
    }

    /**
     * Iterates over the remaining rows. I/O failures surface as {@link UncheckedIOException}.
     */
    @Override
    public Iterator<Row> iterator() {
        return new Iterator<Row>() {
            private Row next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = shift();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
                return next != null;
            }

            @Override
            public Row next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Row row = next;
                next = null;
                return row;
            }
        };
    }

    /**
     * Returns to the start of the data. Headers read from the data are read again.
     *
     * @throws UnsupportedOperationException if the source cannot be rewound
     */
    public void rewind() throws IOException {
        requireSource();
        source.rewind();
        lineNumber = 0;
        resetHeaders();
    }

    // --- writing ---

    public FasterCsv append(List<?> fields) throws IOException {
        if (sink == null) {
            throw new IllegalStateException("Not open for writing");
        }
        sink.write(serializer.render(fields));
        return this;
    }

    public FasterCsv append(Row row) throws IOException {
        return append(row.fields());
    }

    public void flush() throws IOException {
        if (sink != null) {
            sink.flush();
        }
    }

    // --- converters ---

    public void convert(String name) {
        converters.add(name);
    }

    public void convert(FieldConverter converter) {
        converters.add(converter);
    }

    public void convert(FieldInfoConverter converter) {
        converters.add(converter);
    }

    public void headerConvert(String name) {
        headerConverters.add(name);
    }

    public void headerConvert(FieldConverter converter) {
        headerConverters.add(converter);
    }

    public void headerConvert(FieldInfoConverter converter) {
        headerConverters.add(converter);
    }

    // --- state ---

    /**
     * The headers in use, or null when they come from a first row that has not been
     * read yet.
     */
    public List<Object> getHeaders() {
        return headers;
    }

    public boolean isUsingHeaders() {
        return useHeaders;
    }

    /**
     * Number of records read so far, counting the header record.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    public String getColSep() {
        return colSep;
    }

    public String getRowSep() {
        return rowSep;
    }

    @Override
    public void close() throws IOException {
        try {
            if (sink != null) {
                sink.close();
            }
        } finally {
            if (source != null) {
                source.close();
            }
        }
    }

    private void requireSource() {
        if (source == null) {
            throw new IllegalStateException("Not open for reading");
        }
    }

    // --- conveniences ---

    public static List<Row> parse(String data, CsvOptions options) throws IOException {
        try (FasterCsv csv = new FasterCsv(data, options)) {
            return csv.readAll();
        }
    }

    /**
     * Parses the first record of {@code line}; anything after it is ignored.
     *
     * @return the fields, or null when {@code line} is empty
     */
    public static List<Object> parseLine(String line, CsvOptions options) throws IOException {
        try (FasterCsv csv = new FasterCsv(line, options)) {
            return csv.shiftFields();
        }
    }

    public static String generateLine(List<?> fields, CsvOptions options) throws IOException {
        return generate(options, csv -> csv.append(fields));
    }

    /**
     * Hands a write-only instance to {@code block} and returns what it wrote.
     */
    public static String generate(CsvOptions options, CsvConsumer<FasterCsv> block) throws IOException {
        StringWriter out = new StringWriter();
        try (FasterCsv csv = new FasterCsv(out, options)) {
            block.accept(csv);
        }
        return out.toString();
    }

    /**
     * Opens {@code file} for reading. The file is memory mapped a chunk at a time and
     * can be rewound.
     */
    public static FasterCsv open(File file, Charset charset, CsvOptions options) throws IOException {
        ReaderCsvSource source = new ReaderCsvSource(
                () -> new InputStreamReader(new MappedFileInputStream(file), charset));
        try {
            return new FasterCsv(source, null, options);
        } catch (IOException | RuntimeException e) {
            source.close();
            throw e;
        }
    }

    /**
     * Creates (or truncates) {@code file} for writing.
     */
    public static FasterCsv create(File file, Charset charset, CsvOptions options) throws IOException {
        Writer writer = new BufferedWriter(new OutputStreamWriter(new MappedFileOutputStream(file), charset));
        try {
            return new FasterCsv(writer, options);
        } catch (RuntimeException e) {
            writer.close();
            throw e;
        }
    }

    public static void foreach(File file, Charset charset, CsvOptions options, CsvConsumer<Row> block)
            throws IOException {
        try (FasterCsv csv = open(file, charset, options)) {
            Row row;
            while ((row = csv.shift()) != null) {
                block.accept(row);
            }
        }
    }

    /**
     * Copies rows from {@code input} to {@code output}, passing each through
     * {@code function}, whose result is what gets written.
     * <p>
     * Option keys starting with {@code in_} or {@code input_} apply only to the input,
     * keys starting with {@code out_} or {@code output_} only to the output, and all
     * other keys to both.
     *
     * @return the number of rows copied
     */
    public static long filter(Reader input, Writer output, Map<String, ?> options,
                              Function<Row, ? extends List<?>> function) throws IOException {
        Map<String, Object> inputOptions = new LinkedHashMap<>();
        Map<String, Object> outputOptions = new LinkedHashMap<>();
        for (Map.Entry<String, ?> option : options.entrySet()) {
            String key = option.getKey();
            if (key.startsWith("input_")) {
                inputOptions.put(key.substring("input_".length()), option.getValue());
            } else if (key.startsWith("in_")) {
                inputOptions.put(key.substring("in_".length()), option.getValue());
            } else if (key.startsWith("output_")) {
                outputOptions.put(key.substring("output_".length()), option.getValue());
            } else if (key.startsWith("out_")) {
                outputOptions.put(key.substring("out_".length()), option.getValue());
            } else {
                inputOptions.put(key, option.getValue());
                outputOptions.put(key, option.getValue());
            }
        }
        FasterCsv in = new FasterCsv(input, CsvOptions.fromMap(inputOptions));
        FasterCsv out = new FasterCsv(output, CsvOptions.fromMap(outputOptions));
        long count = 0;
        Row row;
        while ((row = in.shift()) != null) {
            out.append(function.apply(row));
            count++;
        }
        out.flush();
        return count;
    }
}
