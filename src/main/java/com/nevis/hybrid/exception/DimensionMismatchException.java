package com.nevis.hybrid.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends HybridStoreException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorKind.DIMENSION_MISMATCH, "Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
