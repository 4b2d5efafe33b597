package io.github.panghy.pdbbridge.pdb;

import java.util.Objects;

/**
 * What the registry knows about one procedure: its name, its formal and return
 * signatures, and descriptive metadata. A ProcedureInfo obtained from
 * {@link ProcedureRegistry#lookup(String)} is also the token passed back to
 * {@link ProcedureRegistry#invoke(ProcedureInfo, java.util.List)}.
 *
 * @param name      The registry name, hyphen separated
 * @param blurb     A one-line description
 * @param author    The author
 * @param formals   The formal argument signature
 * @param returns   The return value signature, excluding the status entry
 */
public record ProcedureInfo(String name, String blurb, String author, Signature formals, Signature returns) {

  public ProcedureInfo {
    Objects.requireNonNull(name, "Procedure name cannot be null");
    Objects.requireNonNull(formals, "Formal signature cannot be null");
    Objects.requireNonNull(returns, "Return signature cannot be null");
    blurb = blurb == null ? "" : blurb;
    author = author == null ? "" : author;
  }

  /**
   * Creates procedure information without descriptive metadata.
   *
   * @param name    The registry name
   * @param formals The formal signature
   * @param returns The return signature
   * @return The procedure information
   */
  public static ProcedureInfo of(String name, Signature formals, Signature returns) {
    return new ProcedureInfo(name, "", "", formals, returns);
  }
}
