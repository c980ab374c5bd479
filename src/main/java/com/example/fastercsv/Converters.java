package com.example.fastercsv;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Built-in converters. None of them throws: a field that cannot be converted, or
 * that is not a String, is returned unchanged.
 */
public final class Converters {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("[+-]?(\\d+(\\.\\d+)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\s\\w]+");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.BASIC_ISO_DATE);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

    /** Whole numbers to {@link Long}, or {@link BigInteger} when they do not fit. */
    public static final FieldConverter INTEGER = Converters::toInteger;

    /** Decimal numbers to {@link Double}. */
    public static final FieldConverter FLOAT = Converters::toFloat;

    /** Dates to {@link LocalDate}. */
    public static final FieldConverter DATE = Converters::toDate;

    /**
     * Dates with a time to {@link OffsetDateTime} when an offset is given, otherwise
     * to {@link LocalDateTime}. Plain dates become midnight of that day.
     */
    public static final FieldConverter DATE_TIME = Converters::toDateTime;

    /** Header converter: lower case. */
    public static final FieldConverter DOWNCASE = field ->
            field instanceof String ? ((String) field).toLowerCase(Locale.ROOT) : field;

    /** Header converter: lower case words joined by underscores, punctuation dropped. */
    public static final FieldConverter SYMBOL = Converters::toSymbol;

    private Converters() {
    }

    private static Object toInteger(Object field) {
        if (!(field instanceof String)) {
            return field;
        }
        String text = ((String) field).trim();
        if (!INTEGER_PATTERN.matcher(text).matches()) {
            return field;
        }
        BigInteger value = new BigInteger(text);
        return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
    }

    private static Object toFloat(Object field) {
        if (!(field instanceof String)) {
            return field;
        }
        String text = ((String) field).trim();
        if (!FLOAT_PATTERN.matcher(text).matches()) {
            return field;
        }
        return Double.parseDouble(text);
    }

    private static Object toDate(Object field) {
        if (!(field instanceof String)) {
            return field;
        }
        String text = ((String) field).trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return field;
    }

    private static Object toDateTime(Object field) {
        if (!(field instanceof String)) {
            return field;
        }
        String text = ((String) field).trim();
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            // no offset
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        Object date = toDate(text);
        return date instanceof LocalDate ? ((LocalDate) date).atStartOfDay() : field;
    }

    private static Object toSymbol(Object field) {
        if (!(field instanceof String)) {
            return field;
        }
        String text = ((String) field).toLowerCase(Locale.ROOT);
        text = PUNCTUATION.matcher(text).replaceAll("").trim();
        return WHITESPACE.matcher(text).replaceAll("_");
    }
}
