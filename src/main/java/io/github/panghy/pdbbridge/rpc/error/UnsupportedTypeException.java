package io.github.panghy.pdbbridge.rpc.error;

import io.github.panghy.pdbbridge.pdb.ParamType;

/**
 * Thrown when a formal parameter uses a registry type that has no wire form.
 */
public class UnsupportedTypeException extends InvalidArgumentException {

  private final ParamType type;

  /**
   * Creates a new unsupported type exception.
   *
   * @param position The zero-based argument index
   * @param type     The registry type that cannot be decoded
   */
  public UnsupportedTypeException(int position, ParamType type) {
    super("parameter " + position + " has unsupported type " + type, position);
    this.type = type;
  }

  /**
   * Gets the unsupported registry type.
   *
   * @return The type
   */
  public ParamType getType() {
    return type;
  }
}
