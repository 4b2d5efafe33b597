package io.github.panghy.pdbbridge.rpc.dispatch;

import io.github.panghy.pdbbridge.pdb.ProcedureRegistry;
import io.github.panghy.pdbbridge.rpc.error.UnknownProcedureException;

import java.util.Objects;

/**
 * Looks up the registry procedure behind a bus method name. Nothing is cached;
 * every call sees the registry as it is at that moment.
 */
public class SignatureResolver {

  private final ProcedureRegistry registry;

  public SignatureResolver(ProcedureRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
  }

  /**
   * Resolves a bus method name.
   *
   * @param wireName The method name as called, with underscores
   * @return The resolved procedure
   * @throws UnknownProcedureException if the registry has no such procedure;
   *                                   the exception names {@code wireName} unchanged
   */
  public ResolvedProcedure resolve(String wireName) {
    return registry.lookup(ProcedureNames.toRegistryName(wireName))
        .map(info -> new ResolvedProcedure(wireName, info))
        .orElseThrow(() -> new UnknownProcedureException(wireName));
  }
}
