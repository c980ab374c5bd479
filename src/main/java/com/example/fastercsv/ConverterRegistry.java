package com.example.fastercsv;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps converter names to converters, or to ordered lists of other names. Lists may
 * name other lists; they are expanded when a name is resolved.
 * <p>
 * Two process-wide registries exist, one for field converters and one for header
 * converters. Both are mutable so callers can add their own names, and neither is
 * synchronized: register from one thread, typically during start-up.
 */
public class ConverterRegistry {

    private static final ConverterRegistry FIELD_CONVERTERS = new ConverterRegistry()
            .register("integer", Converters.INTEGER)
            .register("float", Converters.FLOAT)
            .registerCombination("numeric", "integer", "float")
            .register("date", Converters.DATE)
            .register("date_time", Converters.DATE_TIME)
            .registerCombination("all", "date_time", "numeric");

    private static final ConverterRegistry HEADER_CONVERTERS = new ConverterRegistry()
            .register("downcase", Converters.DOWNCASE)
            .register("symbol", Converters.SYMBOL);

    private final Map<String, FieldInfoConverter> converters = new HashMap<>();
    private final Map<String, List<String>> combinations = new HashMap<>();

    public static ConverterRegistry fieldConverters() {
        return FIELD_CONVERTERS;
    }

    public static ConverterRegistry headerConverters() {
        return HEADER_CONVERTERS;
    }

    public ConverterRegistry register(String name, FieldConverter converter) {
        Objects.requireNonNull(converter, "converter");
        return register(name, (field, info) -> converter.convert(field));
    }

    public ConverterRegistry register(String name, FieldInfoConverter converter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(converter, "converter");
        combinations.remove(name);
        converters.put(name, converter);
        return this;
    }

    public ConverterRegistry registerCombination(String name, String... names) {
        Objects.requireNonNull(name, "name");
        converters.remove(name);
        combinations.put(name, List.of(names));
        return this;
    }

    public boolean contains(String name) {
        return converters.containsKey(name) || combinations.containsKey(name);
    }

    /**
     * Expands {@code name} into the converters it stands for, in order.
     *
     * @throws IllegalArgumentException if the name, or a name it refers to, is not registered
     */
    public List<FieldInfoConverter> resolve(String name) {
        List<FieldInfoConverter> resolved = new ArrayList<>();
        resolve(name, resolved, new ArrayList<>());
        return resolved;
    }

    private void resolve(String name, List<FieldInfoConverter> resolved, List<String> expanding) {
        FieldInfoConverter converter = converters.get(name);
        if (converter != null) {
            resolved.add(converter);
            return;
        }
        List<String> names = combinations.get(name);
        if (names == null) {
            throw new IllegalArgumentException("Unknown converter: " + name);
        }
        if (expanding.contains(name)) {
            throw new IllegalArgumentException("Converter combination refers to itself: " + name);
        }
        expanding.add(name);
        for (String each : names) {
            resolve(each, resolved, expanding);
        }
        expanding.remove(expanding.size() - 1);
    }
}
