package com.example.fastercsv.cli;

import com.example.fastercsv.CsvOptions;
import com.example.fastercsv.FasterCsv;
import com.example.fastercsv.Row;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Re-writes a delimited file through the library, normalizing its quoting and
 * optionally changing the column separator and charset.
 *
 * Example usage:
 * java -jar faster-csv.jar input.csv output.csv auto UTF-8 ; , true
 */
@Slf4j
public class CsvFilterMain {

    static final long PROGRESS_INTERVAL = 100_000;

    @Data
    public static class Options {
        private File inputFile;
        private File outputFile;
        private String inputCharset = CharsetResolver.AUTO;
        private String outputCharset = "UTF-8";
        private String colSep = ",";
        private String outColSep;
        private boolean headers = false;

        public String getOutColSep() {
            return outColSep == null ? colSep : outColSep;
        }
    }

    public static void main(String[] args) throws Exception {
        Options options = parseArgs(args);
        if (options == null) {
            System.out.println("Usage: java -jar faster-csv.jar <inputFile> <outputFile> [inputCharset|auto] [outputCharset] [colSep] [outColSep] [headers=true|false]");
            System.out.println("Example: java -jar faster-csv.jar in.csv out.csv auto UTF-8 ; , true");
            return;
        }
        log.info("Options: {}", options);
        try {
            long start = System.currentTimeMillis();
            long records = run(options);
            long elapsed = Math.max(1, System.currentTimeMillis() - start);
            log.info("Completed. Records: {}, Time(s): {}, RPS: {}", records, elapsed / 1000.0, records * 1000 / elapsed);
        } catch (IOException | RuntimeException e) {
            log.error("Filtering failed: {}", e.getMessage(), e);
            throw e;
        }
    }

    static Options parseArgs(String[] args) {
        if (args.length < 2) {
            return null;
        }
        Options options = new Options();
        options.setInputFile(new File(args[0]));
        options.setOutputFile(new File(args[1]));
        if (args.length > 2) options.setInputCharset(args[2]);
        if (args.length > 3) options.setOutputCharset(args[3]);
        if (args.length > 4) options.setColSep(unescape(args[4]));
        if (args.length > 5) options.setOutColSep(unescape(args[5]));
        if (args.length > 6) options.setHeaders(Boolean.parseBoolean(args[6]));
        return options;
    }

    /**
     * Copies every record from the input file to the output file.
     *
     * @return the number of rows written, the header row included
     */
    static long run(Options options) throws IOException {
        Charset inCharset = CharsetResolver.resolve(options.getInputCharset(), options.getInputFile());
        Charset outCharset = CharsetResolver.resolve(options.getOutputCharset(), null);

        CsvOptions readOptions = CsvOptions.defaults()
                .withColSep(options.getColSep())
                .withHeaders(options.isHeaders())
                .withReturnHeaders(options.isHeaders());
        CsvOptions writeOptions = CsvOptions.defaults()
                .withColSep(options.getOutColSep())
                .withRowSep("\n");

        long count = 0;
        try (FasterCsv in = FasterCsv.open(options.getInputFile(), inCharset, readOptions);
             FasterCsv out = FasterCsv.create(options.getOutputFile(), outCharset, writeOptions)) {
            Row row;
            while ((row = in.shift()) != null) {
                out.append(row);
                count++;
                if (count % PROGRESS_INTERVAL == 0) {
                    log.info("Filtered {} rows", count);
                    out.flush();
                }
            }
        }
        return count;
    }

    private static String unescape(String separator) {
        return "\\t".equals(separator) ? "\t" : separator;
    }
}
