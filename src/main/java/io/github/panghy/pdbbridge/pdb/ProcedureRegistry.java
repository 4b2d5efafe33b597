package io.github.panghy.pdbbridge.pdb;

import java.util.List;
import java.util.Optional;

/**
 * The host application's catalogue of named, dynamically invocable procedures.
 *
 * <p>The registry is the source of truth for signatures and may change between
 * calls, so callers look procedures up again for every call instead of caching.</p>
 */
public interface ProcedureRegistry {

  /**
   * Looks up a procedure by its registry name.
   *
   * @param name The hyphen-separated procedure name
   * @return The procedure information, or empty if there is no such procedure
   */
  Optional<ProcedureInfo> lookup(String name);

  /**
   * Runs a procedure.
   *
   * @param procedure The procedure, as returned by {@link #lookup(String)}
   * @param params    The arguments, matching the formal signature
   * @return The result list, whose first element is a {@link Param.StatusParam};
   *         empty if the registry could not start the call at all
   */
  Optional<List<Param>> invoke(ProcedureInfo procedure, List<Param> params);

  /**
   * Lists the names of every registered procedure.
   *
   * @return The procedure names
   */
  List<String> enumerateAll();
}
