package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.rpc.serialization.WireType;

import java.util.Objects;

/**
 * One argument or return value of a published bus method.
 *
 * @param name      The argument name, without hyphens
 * @param type      The wire type
 * @param direction Whether the value is sent in or returned
 */
public record ArgInfo(String name, WireType type, Direction direction) {

  /**
   * Which way an argument travels.
   */
  public enum Direction {
    IN("in"),
    OUT("out");

    private final String xmlName;

    Direction(String xmlName) {
      this.xmlName = xmlName;
    }

    public String getXmlName() {
      return xmlName;
    }
  }

  public ArgInfo {
    Objects.requireNonNull(name, "Argument name cannot be null");
    Objects.requireNonNull(type, "Argument type cannot be null");
    Objects.requireNonNull(direction, "Argument direction cannot be null");
  }

  public static ArgInfo in(String name, WireType type) {
    return new ArgInfo(name, type, Direction.IN);
  }

  public static ArgInfo out(String name, WireType type) {
    return new ArgInfo(name, type, Direction.OUT);
  }
}
