package io.github.panghy.pdbbridge.rpc.dispatch;

import io.github.panghy.pdbbridge.pdb.ProcedureInfo;
import io.github.panghy.pdbbridge.pdb.Signature;

/**
 * A registry procedure found for a bus method name.
 *
 * @param wireName  The name the caller used
 * @param procedure The registry's description of the procedure, also used as
 *                  the token for invoking it
 */
public record ResolvedProcedure(String wireName, ProcedureInfo procedure) {

  public String registryName() {
    return procedure.name();
  }

  public Signature formals() {
    return procedure.formals();
  }

  public Signature returns() {
    return procedure.returns();
  }
}
