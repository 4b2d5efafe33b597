package io.github.panghy.pdbbridge.rpc.error;

import io.github.panghy.pdbbridge.rpc.serialization.WireType;

/**
 * Thrown when the runtime type of a wire value differs from the type implied by
 * the formal parameter it is decoded against.
 */
public class TypeMismatchException extends InvalidArgumentException {

  private final WireType expected;
  private final WireType actual;

  /**
   * Creates a new type mismatch exception.
   *
   * @param position The zero-based argument index
   * @param expected The wire type the signature requires
   * @param actual   The wire type that was received
   */
  public TypeMismatchException(int position, WireType expected, WireType actual) {
    super(String.format("expects %s for parameter %d, received %s",
        expected.getSignature(), position, actual.getSignature()), position);
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * Gets the expected wire type.
   *
   * @return The expected type
   */
  public WireType getExpected() {
    return expected;
  }

  /**
   * Gets the received wire type.
   *
   * @return The actual type
   */
  public WireType getActual() {
    return actual;
  }
}
