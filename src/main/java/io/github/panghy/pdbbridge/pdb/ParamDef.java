package io.github.panghy.pdbbridge.pdb;

import java.util.Objects;

/**
 * One formal argument or return value of a registry procedure.
 *
 * @param type        The type tag
 * @param name        The registry name, hyphen separated
 * @param description A short description
 */
public record ParamDef(ParamType type, String name, String description) {

  public ParamDef {
    Objects.requireNonNull(type, "Parameter type cannot be null");
    Objects.requireNonNull(name, "Parameter name cannot be null");
    if (description == null) {
      description = "";
    }
  }

  /**
   * Creates a definition without a description.
   *
   * @param type The type tag
   * @param name The parameter name
   * @return The definition
   */
  public static ParamDef of(ParamType type, String name) {
    return new ParamDef(type, name, "");
  }
}
