package io.github.panghy.pdbbridge.rpc;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A published bus interface and its methods.
 *
 * @param name    The dotted interface name
 * @param methods The methods, in publication order
 */
public record InterfaceInfo(String name, List<MethodInfo> methods) {

  public InterfaceInfo {
    Objects.requireNonNull(name, "Interface name cannot be null");
    methods = List.copyOf(methods);
  }

  public Optional<MethodInfo> method(String methodName) {
    return methods.stream().filter(m -> m.name().equals(methodName)).findFirst();
  }
}
