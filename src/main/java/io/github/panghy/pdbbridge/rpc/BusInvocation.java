package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCategory;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;

import java.util.List;

/**
 * An inbound method call, together with the means to answer it. Exactly one of
 * {@link #returnValues(List)} and {@link #returnError(ErrorCategory, String)}
 * must be called, once.
 */
public interface BusInvocation {

  String getInterfaceName();

  String getMember();

  List<WireValue> getArgs();

  /**
   * Sends a successful reply.
   *
   * @param values The return values
   */
  void returnValues(List<WireValue> values);

  /**
   * Sends an error reply.
   *
   * @param category The failure category
   * @param message  The error message
   */
  void returnError(ErrorCategory category, String message);
}
