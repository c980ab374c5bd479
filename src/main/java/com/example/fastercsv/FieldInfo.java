package com.example.fastercsv;

import lombok.Value;

/**
 * Position of a field being converted.
 */
@Value
public class FieldInfo {
    /** Zero-based index of the field in its record. */
    int index;
    /** One-based number of the logical record the field belongs to. */
    long line;
}
