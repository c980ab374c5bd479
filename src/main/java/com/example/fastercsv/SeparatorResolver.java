package com.example.fastercsv;

import com.example.fastercsv.io.CsvSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the requested row separator into a literal one, discovering it from the data
 * when {@link CsvOptions#AUTO} was requested.
 * <p>
 * Discovery takes the first {@code "\r\n"}, {@code "\n"} or {@code "\r"} in the data,
 * even inside a quoted field, on the assumption that line endings are uniform. When
 * the data holds no line ending at all the platform line separator is used. The
 * source is returned to where it was before discovery.
 */
@Slf4j
final class SeparatorResolver {

    static final int SAMPLE_SIZE = 1024;

    private static final Pattern LINE_END = Pattern.compile("\r\n?|\n");

    private SeparatorResolver() {
    }

    static String resolveRowSeparator(String requested, CsvSource source) throws IOException {
        if (!CsvOptions.AUTO.equals(requested)) {
            return requested;
        }
        if (source == null) {
            return System.lineSeparator();
        }
        String separator = null;
        source.mark();
        try {
            char[] chunk = new char[SAMPLE_SIZE];
            while (separator == null && !source.isEof()) {
                int read = source.read(chunk, 0, chunk.length);
                StringBuilder sample = new StringBuilder(read + 1).append(chunk, 0, read);
                // keep a "\r\n" from being split across two samples
                if (sample.charAt(read - 1) == '\r' && !source.isEof()) {
                    sample.append((char) source.read());
                }
                Matcher m = LINE_END.matcher(sample);
                if (m.find()) {
                    separator = m.group();
                }
            }
        } finally {
            source.reset();
        }
        if (separator == null) {
            separator = System.lineSeparator();
            log.debug("No line ending found in the data, using the platform line separator");
        } else {
            log.debug("Discovered row separator {}", escape(separator));
        }
        return separator;
    }

    static String escape(String separator) {
        return separator.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
    }
}
