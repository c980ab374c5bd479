package com.example.fastercsv;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A record paired with its headers. Fields can be looked up by position or by header;
 * headers need not be unique, and a minimum index selects among repeated ones.
 * <p>
 * Headers and fields are paired by position. Whichever list is shorter is padded
 * with {@code null}, so a row always has as many pairs as its longer list.
 * <p>
 * Rows are immutable.
 */
public class Row implements Iterable<Map.Entry<Object, Object>> {

    private final List<Map.Entry<Object, Object>> pairs;
    private final boolean headerRow;

    public Row(List<?> headers, List<?> fields) {
        this(headers, fields, false);
    }

    public Row(List<?> headers, List<?> fields, boolean headerRow) {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(fields, "fields");
        int size = Math.max(headers.size(), fields.size());
        List<Map.Entry<Object, Object>> zipped = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Object header = i < headers.size() ? headers.get(i) : null;
            Object field = i < fields.size() ? fields.get(i) : null;
            zipped.add(new SimpleImmutableEntry<>(header, field));
        }
        this.pairs = Collections.unmodifiableList(zipped);
        this.headerRow = headerRow;
    }

    /**
     * True for the row that carries the headers themselves.
     */
    public boolean isHeaderRow() {
        return headerRow;
    }

    public boolean isFieldRow() {
        return !headerRow;
    }

    public int size() {
        return pairs.size();
    }

    public List<Object> headers() {
        List<Object> headers = new ArrayList<>(pairs.size());
        for (Map.Entry<Object, Object> pair : pairs) {
            headers.add(pair.getKey());
        }
        return Collections.unmodifiableList(headers);
    }

    public Object field(int index) {
        return index >= 0 && index < pairs.size() ? pairs.get(index).getValue() : null;
    }

    public Object field(Object headerOrIndex) {
        return field(headerOrIndex, 0);
    }

    /**
     * Looks up a field. An {@link Integer} is taken as a position and
     * {@code minimumIndex} is ignored; anything else is a header, matched against
     * the headers at or after {@code minimumIndex}.
     *
     * @return the field, or null when there is no such position or header
     */
    public Object field(Object headerOrIndex, int minimumIndex) {
        if (headerOrIndex instanceof Integer) {
            return field(((Integer) headerOrIndex).intValue());
        }
        Integer index = index(headerOrIndex, minimumIndex);
        return index == null ? null : pairs.get(index).getValue();
    }

    /**
     * With no selectors, returns every field in order. Otherwise returns one value per
     * selector, each a header, an {@link Integer} position, or a two-element
     * {@code List} of header and minimum index.
     */
    public List<Object> fields(Object... selectors) {
        List<Object> values = new ArrayList<>(selectors.length == 0 ? pairs.size() : selectors.length);
        if (selectors.length == 0) {
            for (Map.Entry<Object, Object> pair : pairs) {
                values.add(pair.getValue());
            }
        } else {
            for (Object selector : selectors) {
                if (selector instanceof List && ((List<?>) selector).size() == 2
                        && ((List<?>) selector).get(1) instanceof Integer) {
                    List<?> withMinimum = (List<?>) selector;
                    values.add(field(withMinimum.get(0), (Integer) withMinimum.get(1)));
                } else {
                    values.add(field(selector));
                }
            }
        }
        return values;
    }

    public Integer index(Object header) {
        return index(header, 0);
    }

    /**
     * Position of the first occurrence of {@code header} at or after {@code minimumIndex},
     * or null.
     */
    public Integer index(Object header, int minimumIndex) {
        for (int i = Math.max(0, minimumIndex); i < pairs.size(); i++) {
            if (Objects.equals(pairs.get(i).getKey(), header)) {
                return i;
            }
        }
        return null;
    }

    public boolean hasHeader(Object header) {
        return index(header) != null;
    }

    public boolean hasField(Object value) {
        for (Map.Entry<Object, Object> pair : pairs) {
            if (Objects.equals(pair.getValue(), value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<Map.Entry<Object, Object>> iterator() {
        return pairs.iterator();
    }

    public Stream<Map.Entry<Object, Object>> stream() {
        return pairs.stream();
    }

    /**
     * Header and field pairs in order.
     */
    public List<Map.Entry<Object, Object>> toList() {
        return pairs;
    }

    /**
     * Header to field map. A repeated header maps to the field of its last occurrence.
     */
    public Map<Object, Object> toMap() {
        Map<Object, Object> map = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> pair : pairs) {
            map.put(pair.getKey(), pair.getValue());
        }
        return map;
    }

    /**
     * The fields as one line of comma separated text.
     */
    /**
     * Renders the fields with a comma and the platform line separator.
     */
    public String toCsv() {
        return toCsv(CsvOptions.defaults());
    }

    /**
     * Renders the fields with the separators of {@code options}. A row separator of
     * {@link CsvOptions#AUTO} means the platform line separator.
     */
    public String toCsv(CsvOptions options) {
        options.validate();
        String rowSep = CsvOptions.AUTO.equals(options.getRowSep()) ? System.lineSeparator() : options.getRowSep();
        return new CsvSerializer(options.getColSep(), rowSep).render(fields());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        Row other = (Row) o;
        return headerRow == other.headerRow && pairs.equals(other.pairs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pairs, headerRow);
    }

    @Override
    public String toString() {
        return (headerRow ? "HeaderRow" : "Row") + Arrays.toString(pairs.toArray());
    }
}
