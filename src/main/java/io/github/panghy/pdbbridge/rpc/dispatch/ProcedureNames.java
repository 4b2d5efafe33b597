package io.github.panghy.pdbbridge.rpc.dispatch;

/**
 * Translates between bus method names and registry procedure names. The bus
 * does not allow hyphens in member names, so {@code gimp-image-new} is called as
 * {@code gimp_image_new}.
 */
public final class ProcedureNames {

  private ProcedureNames() {
  }

  public static String toRegistryName(String wireName) {
    return wireName.replace('_', '-');
  }

  public static String toWireName(String registryName) {
    return registryName.replace('-', '_');
  }
}
