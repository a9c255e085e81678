package com.flamingo.ai.legalrag.exception;

/** Exception thrown when a vector does not match the dimensionality of the vector index. */
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(String indexName, int expected, int actual) {
    super(
        String.format(
            "Vector dimension mismatch for index '%s': expected %d but got %d",
            indexName, expected, actual));
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
