package io.github.panghy.pdbbridge.pdb;

/**
 * Status the registry reports as the first element of every result list.
 */
public enum CallStatus {
  EXECUTION_ERROR(0),
  CALLING_ERROR(1),
  PASS_THROUGH(2),
  SUCCESS(3),
  CANCEL(4);

  private final int code;

  CallStatus(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * Gets a CallStatus from its numeric code.
   *
   * @param code The numeric code
   * @return The matching status
   * @throws IllegalArgumentException if no status has that code
   */
  public static CallStatus fromCode(int code) {
    for (CallStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown call status code: " + code);
  }
}
