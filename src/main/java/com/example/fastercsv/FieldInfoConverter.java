package com.example.fastercsv;

/**
 * Converts a field given its position in the data.
 *
 * @see FieldConverter
 */
@FunctionalInterface
public interface FieldInfoConverter {
    Object convert(Object field, FieldInfo info);
}
