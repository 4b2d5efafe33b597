package io.github.panghy.pdbbridge.rpc.error;

/**
 * Thrown when a call name has no entry in the procedure registry.
 * The exception keeps the name exactly as the caller sent it, before any
 * translation to the registry's naming convention.
 */
public class UnknownProcedureException extends BridgeException {

  private final String methodName;

  /**
   * Creates a new exception for an unknown call name.
   *
   * @param methodName The name as received on the wire
   */
  public UnknownProcedureException(String methodName) {
    super(ErrorCode.UNKNOWN_PROCEDURE, "Invalid method: '" + methodName + "'");
    this.methodName = methodName;
  }

  /**
   * Gets the untranslated method name.
   *
   * @return The method name
   */
  public String getMethodName() {
    return methodName;
  }
}
