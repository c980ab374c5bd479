package com.example.fastercsv.cli;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolves charset names given on the command line. Besides the names Java knows,
 * it tries the usual IBM code page spellings ({@code Cp1047}, {@code IBM1047},
 * {@code ibm-1047}) and, for {@code auto}, detects the charset of a file with ICU4J.
 */
@Slf4j
public final class CharsetResolver {

    public static final String AUTO = "auto";

    static final int DETECTION_SAMPLE_SIZE = 64 * 1024;

    private CharsetResolver() {}

    /**
     * @param name charset name, {@code auto}, or null/empty for the platform default
     * @param file file to sample when the name is {@code auto}, may be null otherwise
     */
    public static Charset resolve(String name, File file) throws IOException {
        if (name == null || name.trim().isEmpty()) return Charset.defaultCharset();
        if (AUTO.equalsIgnoreCase(name.trim())) {
            if (file == null) {
                throw new IllegalArgumentException("Charset detection needs a file to sample");
            }
            return detect(file);
        }
        return resolve(name);
    }

    static Charset resolve(String name) {
        for (String candidate : candidates(name.trim())) {
            Charset charset = forName(candidate);
            if (charset != null) {
                if (!candidate.equals(name.trim())) {
                    log.info("Resolved charset '{}' -> '{}'", name, charset.name());
                }
                return charset;
            }
        }
        log.warn("Failed to resolve charset '{}', falling back to UTF-8", name);
        return StandardCharsets.UTF_8;
    }

    static Charset detect(File file) throws IOException {
        byte[] sample;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file.toPath()))) {
            sample = in.readNBytes(DETECTION_SAMPLE_SIZE);
        }
        CharsetDetector detector = new CharsetDetector();
        detector.setText(sample);
        CharsetMatch match = detector.detect();
        if (match != null) {
            Charset charset = forName(match.getName());
            if (charset != null) {
                log.info("Detected charset {} (confidence {}) for {}", charset.name(), match.getConfidence(), file);
                return charset;
            }
        }
        log.warn("Could not detect the charset of {}, falling back to UTF-8", file);
        return StandardCharsets.UTF_8;
    }

    static List<String> candidates(String name) {
        List<String> candidates = new ArrayList<>();
        candidates.add(name);
        String digits = name.replaceAll("\\D+", "");
        if (!digits.isEmpty()) {
            candidates.add("Cp" + digits);
            candidates.add("IBM" + digits);
            candidates.add("ibm-" + digits);
            candidates.add("x-IBM" + digits);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        Charset.availableCharsets().forEach((k, v) -> {
            String key = k.toLowerCase(Locale.ROOT);
            if (key.contains(lower) || (!digits.isEmpty() && key.contains(digits))) {
                candidates.add(k);
            }
        });
        return candidates;
    }

    private static Charset forName(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("No charset named '{}'", name);
            return null;
        }
    }
}
