package com.example.fastercsv;

import lombok.Getter;

/**
 * Thrown when the input does not follow the quoting rules of the format. The record
 * being read is abandoned; the source stays positioned after the data consumed so far.
 */
@Getter
public class MalformedCsvException extends RuntimeException {

    private final long lineNumber;

    public MalformedCsvException(String message, long lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }
}
