package com.insightpulse.kgengine.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends ValidationException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
