package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.rpc.serialization.WireValue;

import java.util.List;

/**
 * Carries out one bus method. Failures are reported by throwing a
 * {@link io.github.panghy.pdbbridge.rpc.error.BridgeException}.
 */
@FunctionalInterface
public interface MethodHandler {

  /**
   * Handles a call.
   *
   * @param methodName The method name as called
   * @param args       The wire arguments
   * @return The wire return values
   */
  List<WireValue> handle(String methodName, List<WireValue> args);
}
