package com.example.fastercsv;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of converters applied to every field of a record. A field leaves the
 * pipeline as soon as a converter turns it into something other than a String.
 */
public class ConverterPipeline {

    private final ConverterRegistry registry;
    private final List<FieldInfoConverter> converters = new ArrayList<>();

    public ConverterPipeline(ConverterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public void add(String name) {
        converters.addAll(registry.resolve(name));
    }

    public void add(FieldConverter converter) {
        Objects.requireNonNull(converter, "converter");
        converters.add((field, info) -> converter.convert(field));
    }

    public void add(FieldInfoConverter converter) {
        converters.add(Objects.requireNonNull(converter, "converter"));
    }

    /**
     * Adds a converter given as a name, a {@link FieldConverter} or a {@link FieldInfoConverter}.
     */
    public void addEntry(Object entry) {
        if (entry instanceof String) {
            add((String) entry);
        } else if (entry instanceof FieldConverter) {
            add((FieldConverter) entry);
        } else if (entry instanceof FieldInfoConverter) {
            add((FieldInfoConverter) entry);
        } else {
            throw new IllegalArgumentException("Not a converter: " + entry);
        }
    }

    public void addAll(Collection<?> entries) {
        for (Object entry : entries) {
            addEntry(entry);
        }
    }

    public boolean isEmpty() {
        return converters.isEmpty();
    }

    public int size() {
        return converters.size();
    }

    /**
     * Converts each field of {@code fields}; {@code lineNumber} is reported to
     * converters through {@link FieldInfo}.
     */
    public List<Object> apply(List<?> fields, long lineNumber) {
        List<Object> converted = new ArrayList<>(fields.size());
        for (int index = 0; index < fields.size(); index++) {
            Object field = fields.get(index);
            for (FieldInfoConverter converter : converters) {
                field = converter.convert(field, new FieldInfo(index, lineNumber));
                if (!(field instanceof String)) {
                    break;
                }
            }
            converted.add(field);
        }
        return converted;
    }
}
