package io.github.panghy.pdbbridge.rpc.error;

import io.github.panghy.pdbbridge.pdb.CallStatus;

/**
 * Thrown when the registry could not run a procedure or ran it and reported a
 * failure status. Return values are never converted in that case.
 */
public class CallFailedException extends BridgeException {

  private final String procedureName;
  private final CallStatus status;

  /**
   * Creates a new call failure.
   *
   * @param procedureName The registry name of the procedure
   * @param status        The status reported, or null if the call never started
   */
  public CallFailedException(String procedureName, CallStatus status) {
    super(ErrorCode.CALL_FAILED, "call to " + procedureName + " failed " + reasonFor(status));
    this.procedureName = procedureName;
    this.status = status;
  }

  /**
   * Gets the human-readable reason for a status.
   *
   * @param status The status, or null when the registry returned nothing
   * @return The reason phrase
   */
  public static String reasonFor(CallStatus status) {
    if (status == null) {
      return "for an unknown reason";
    }
    switch (status) {
      case EXECUTION_ERROR:
        return "with an execution error";
      case CALLING_ERROR:
        return "with invalid inputs";
      case PASS_THROUGH:
        return "with a pass-through error";
      case CANCEL:
        return "because it was canceled";
      default:
        return "for an unknown reason";
    }
  }

  /**
   * Gets the registry name of the failed procedure.
   *
   * @return The procedure name
   */
  public String getProcedureName() {
    return procedureName;
  }

  /**
   * Gets the failure status.
   *
   * @return The status, or null if the call could not be started
   */
  public CallStatus getStatus() {
    return status;
  }

  /**
   * Gets the reason phrase included in the message.
   *
   * @return The reason
   */
  public String getReason() {
    return reasonFor(status);
  }
}
