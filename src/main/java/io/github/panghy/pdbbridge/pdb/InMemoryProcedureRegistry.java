package io.github.panghy.pdbbridge.pdb;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;
import static io.github.panghy.pdbbridge.util.LoggingUtil.warn;

/**
 * A registry kept in process memory. Useful for embedding the bridge without a
 * host application and for tests.
 *
 * <p>Procedures that throw are reported as an {@link CallStatus#EXECUTION_ERROR}
 * result, the same way a host reports a plug-in that crashed.</p>
 */
public class InMemoryProcedureRegistry implements ProcedureRegistry {

  private static final Logger LOGGER = Logger.getLogger(InMemoryProcedureRegistry.class.getName());

  private final Map<String, Entry> procedures = new LinkedHashMap<>();

  private record Entry(ProcedureInfo info, Procedure body) {
  }

  /**
   * Installs or replaces a procedure.
   *
   * @param info The procedure information
   * @param body The implementation
   */
  public void install(ProcedureInfo info, Procedure body) {
    procedures.put(info.name(), new Entry(info, body));
    debug(LOGGER, "Installed procedure " + info.name());
  }

  /**
   * Removes a procedure.
   *
   * @param name The registry name
   * @return true if a procedure was removed
   */
  public boolean uninstall(String name) {
    return procedures.remove(name) != null;
  }

  @Override
  public Optional<ProcedureInfo> lookup(String name) {
    Entry entry = procedures.get(name);
    return entry == null ? Optional.empty() : Optional.of(entry.info());
  }

  @Override
  public Optional<List<Param>> invoke(ProcedureInfo procedure, List<Param> params) {
    Entry entry = procedures.get(procedure.name());
    if (entry == null) {
      return Optional.empty();
    }
    List<Param> results;
    try {
      results = entry.body().run(procedure.name(), params);
    } catch (RuntimeException e) {
      warn(LOGGER, "Procedure " + procedure.name() + " failed", e);
      return Optional.of(Procedure.failure(CallStatus.EXECUTION_ERROR));
    }
    if (results == null || results.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(results);
  }

  @Override
  public List<String> enumerateAll() {
    return new ArrayList<>(procedures.keySet());
  }
}
