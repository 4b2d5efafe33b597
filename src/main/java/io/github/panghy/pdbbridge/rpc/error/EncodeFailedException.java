package io.github.panghy.pdbbridge.rpc.error;

/**
 * Thrown when a registry return value cannot be turned into a wire value.
 * The whole reply is dropped; partial results never reach the caller.
 */
public class EncodeFailedException extends BridgeException {

  private final int position;

  /**
   * Creates a new encode failure.
   *
   * @param position The zero-based index of the return value
   * @param message  The error message
   */
  public EncodeFailedException(int position, String message) {
    super(ErrorCode.ENCODE_FAILED, message);
    this.position = position;
  }

  /**
   * Gets the index of the value that could not be encoded.
   *
   * @return The zero-based position
   */
  public int getPosition() {
    return position;
  }
}
