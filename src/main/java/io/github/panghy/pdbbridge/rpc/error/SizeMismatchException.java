package io.github.panghy.pdbbridge.rpc.error;

/**
 * Thrown when a byte count disagrees with the size the receiver requires,
 * for instance pixel data that does not exactly fill the current tile.
 */
public class SizeMismatchException extends InvalidArgumentException {

  private final int expectedSize;
  private final int actualSize;

  /**
   * Creates a new size mismatch exception.
   *
   * @param expectedSize The required number of bytes
   * @param actualSize   The number of bytes supplied
   */
  public SizeMismatchException(int expectedSize, int actualSize) {
    super("Sizes don't match: " + actualSize + " != " + expectedSize);
    this.expectedSize = expectedSize;
    this.actualSize = actualSize;
  }

  /**
   * Gets the required size.
   *
   * @return The expected size in bytes
   */
  public int getExpectedSize() {
    return expectedSize;
  }

  /**
   * Gets the supplied size.
   *
   * @return The actual size in bytes
   */
  public int getActualSize() {
    return actualSize;
  }
}
