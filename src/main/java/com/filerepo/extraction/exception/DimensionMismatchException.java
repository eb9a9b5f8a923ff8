package com.filerepo.extraction.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends ExtractionException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorKind.DIMENSION_MISMATCH, "Vector dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
