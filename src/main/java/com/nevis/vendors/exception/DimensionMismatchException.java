package com.nevis.vendors.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RuntimeException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Vector dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
