package io.github.panghy.pdbbridge.rpc.error;

/**
 * Base exception for every failure the bridge reports back to a remote caller.
 *
 * <p>BridgeException is the root of a small hierarchy. Each instance carries an
 * {@link ErrorCode}, and every code belongs to an {@link ErrorCategory}. The bus
 * only distinguishes argument errors from general errors, so the category is what
 * ends up on the wire next to the human-readable message.</p>
 *
 * <p>None of these exceptions are retried. A call either completes and replies,
 * or fails with exactly one of these.</p>
 */
public class BridgeException extends RuntimeException {

  /**
   * The coarse error kind the bus transport understands.
   */
  public enum ErrorCategory {
    /**
     * The caller sent something wrong: unknown method, bad argument, bad handle.
     */
    ARGUMENT,

    /**
     * The call was well formed but could not be carried out.
     */
    GENERAL
  }

  /**
   * Enumeration of error codes for bridge exceptions.
   */
  public enum ErrorCode {
    /**
     * Unknown or unexpected failure.
     */
    UNKNOWN(2000, ErrorCategory.GENERAL),

    /**
     * No registry entry exists for the requested call name.
     */
    UNKNOWN_PROCEDURE(2001, ErrorCategory.ARGUMENT),

    /**
     * An argument did not match the formal signature.
     */
    INVALID_ARGUMENT(2002, ErrorCategory.ARGUMENT),

    /**
     * Every tile-stream handle is in use.
     */
    POOL_EXHAUSTED(2003, ErrorCategory.GENERAL),

    /**
     * The tile-stream handle does not name a live stream.
     */
    INVALID_HANDLE(2004, ErrorCategory.ARGUMENT),

    /**
     * The drawable reference does not name a live drawable.
     */
    INVALID_DRAWABLE(2005, ErrorCategory.GENERAL),

    /**
     * The tile stream has been advanced past its last tile.
     */
    NO_MORE_TILES(2006, ErrorCategory.GENERAL),

    /**
     * The registry ran the call and reported a failure status.
     */
    CALL_FAILED(2007, ErrorCategory.GENERAL),

    /**
     * A return value could not be converted to the wire format.
     */
    ENCODE_FAILED(2008, ErrorCategory.GENERAL);

    private final int code;
    private final ErrorCategory category;

    ErrorCode(int code, ErrorCategory category) {
      this.code = code;
      this.category = category;
    }

    /**
     * Gets the numeric code for this error.
     *
     * @return The error code
     */
    public int getCode() {
      return code;
    }

    /**
     * Gets the category this error is reported under.
     *
     * @return The error category
     */
    public ErrorCategory getCategory() {
      return category;
    }

    /**
     * Gets an ErrorCode from its numeric value.
     *
     * @param code The numeric error code
     * @return The corresponding ErrorCode, or UNKNOWN if not found
     */
    public static ErrorCode fromCode(int code) {
      for (ErrorCode errorCode : values()) {
        if (errorCode.code == code) {
          return errorCode;
        }
      }
      return UNKNOWN;
    }
  }

  private final ErrorCode errorCode;

  /**
   * Creates a new bridge exception with the specified error code and message.
   *
   * @param errorCode The error code
   * @param message   The error message
   */
  public BridgeException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Creates a new bridge exception with the specified error code, message, and cause.
   *
   * @param errorCode The error code
   * @param message   The error message
   * @param cause     The underlying cause
   */
  public BridgeException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the category the bus reply is sent under.
   *
   * @return The error category
   */
  public ErrorCategory getCategory() {
    return errorCode.getCategory();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" +
        "errorCode=" + errorCode +
        ", message='" + getMessage() + '\'' +
        '}';
  }
}
