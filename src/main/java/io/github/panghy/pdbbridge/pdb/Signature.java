package io.github.panghy.pdbbridge.pdb;

import java.util.Arrays;
import java.util.List;

/**
 * An ordered, immutable list of parameter definitions: either the formal
 * arguments or the return values of a procedure.
 *
 * @param params The definitions in call order
 */
public record Signature(List<ParamDef> params) {

  public Signature {
    params = List.copyOf(params);
  }

  /**
   * Creates a signature from definitions.
   *
   * @param params The definitions in call order
   * @return The signature
   */
  public static Signature of(ParamDef... params) {
    return new Signature(Arrays.asList(params));
  }

  /**
   * An empty signature.
   *
   * @return A signature with no parameters
   */
  public static Signature empty() {
    return new Signature(List.of());
  }

  public int size() {
    return params.size();
  }

  public ParamDef get(int index) {
    return params.get(index);
  }
}
