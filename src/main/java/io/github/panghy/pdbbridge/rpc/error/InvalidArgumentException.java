package io.github.panghy.pdbbridge.rpc.error;

/**
 * Thrown when an argument does not fit what the callee expects.
 *
 * <p>The position is the zero-based index of the offending argument within the
 * call, or {@link #NO_POSITION} when the problem is not tied to a single
 * argument (for example a wrong argument count).</p>
 */
public class InvalidArgumentException extends BridgeException {

  /**
   * Marker for failures that do not refer to one argument.
   */
  public static final int NO_POSITION = -1;

  private final int position;

  /**
   * Creates a new invalid-argument exception that is not tied to a position.
   *
   * @param message The error message
   */
  public InvalidArgumentException(String message) {
    this(message, NO_POSITION);
  }

  /**
   * Creates a new invalid-argument exception for an argument position.
   *
   * @param message  The error message
   * @param position The zero-based argument index
   */
  public InvalidArgumentException(String message, int position) {
    super(ErrorCode.INVALID_ARGUMENT, message);
    this.position = position;
  }

  /**
   * Gets the offending argument position.
   *
   * @return The zero-based position, or {@link #NO_POSITION}
   */
  public int getPosition() {
    return position;
  }
}
