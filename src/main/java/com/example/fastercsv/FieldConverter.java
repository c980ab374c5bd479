package com.example.fastercsv;

/**
 * Converts a field on its own. Return the field unchanged when it does not apply.
 */
@FunctionalInterface
public interface FieldConverter {
    Object convert(Object field);
}
