package io.github.panghy.pdbbridge.pdb;

import java.util.List;

/**
 * The body of a procedure held by an {@link InMemoryProcedureRegistry}.
 */
@FunctionalInterface
public interface Procedure {

  /**
   * Runs the procedure.
   *
   * @param name   The registry name the procedure was called under
   * @param params The arguments
   * @return The result list, status first
   */
  List<Param> run(String name, List<Param> params);

  /**
   * Builds a successful result list.
   *
   * @param values The return values
   * @return The status entry followed by the values
   */
  static List<Param> success(Param... values) {
    Param[] results = new Param[values.length + 1];
    results[0] = Param.status(CallStatus.SUCCESS);
    System.arraycopy(values, 0, results, 1, values.length);
    return List.of(results);
  }

  /**
   * Builds a failed result list carrying only a status.
   *
   * @param status The failure status
   * @return A single-element result list
   */
  static List<Param> failure(CallStatus status) {
    return List.of(Param.status(status));
  }
}
