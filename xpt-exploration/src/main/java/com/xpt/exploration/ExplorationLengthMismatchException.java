package com.xpt.exploration;

/**
 * Thrown when explored sequences differ in length, or do not match the number of existing runs.
 */
public final class ExplorationLengthMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public ExplorationLengthMismatchException(String parameter, int expected, int actual) {
        super(String.format("Explored length mismatch for `%s`: expected %d, got %d", parameter, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
