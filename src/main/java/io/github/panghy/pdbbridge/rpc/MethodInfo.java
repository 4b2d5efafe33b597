package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.pdb.ParamDef;
import io.github.panghy.pdbbridge.pdb.ProcedureInfo;
import io.github.panghy.pdbbridge.rpc.dispatch.ProcedureNames;
import io.github.panghy.pdbbridge.rpc.serialization.WireSignatures;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A published bus method: its name and its arguments, inputs first.
 *
 * @param name The method name, without hyphens
 * @param args The arguments and return values
 */
public record MethodInfo(String name, List<ArgInfo> args) {

  public MethodInfo {
    Objects.requireNonNull(name, "Method name cannot be null");
    args = List.copyOf(args);
  }

  public static MethodInfo of(String name, ArgInfo... args) {
    return new MethodInfo(name, List.of(args));
  }

  /**
   * Describes a registry procedure as a bus method. Parameter types without a
   * wire form are published as 32-bit integers.
   *
   * @param procedure The registry procedure
   * @return The method description
   */
  public static MethodInfo forProcedure(ProcedureInfo procedure) {
    List<ArgInfo> args = new ArrayList<>();
    for (ParamDef def : procedure.formals().params()) {
      args.add(ArgInfo.in(ProcedureNames.toWireName(def.name()), WireSignatures.publishedTypeOf(def.type())));
    }
    for (ParamDef def : procedure.returns().params()) {
      args.add(ArgInfo.out(ProcedureNames.toWireName(def.name()), WireSignatures.publishedTypeOf(def.type())));
    }
    return new MethodInfo(ProcedureNames.toWireName(procedure.name()), args);
  }

  /**
   * Gets the concatenated signature of the input arguments.
   *
   * @return The input signature, for example {@code "iis"}
   */
  public String inSignature() {
    return signature(ArgInfo.Direction.IN);
  }

  public String outSignature() {
    return signature(ArgInfo.Direction.OUT);
  }

  private String signature(ArgInfo.Direction direction) {
    StringBuilder signature = new StringBuilder();
    for (ArgInfo arg : args) {
      if (arg.direction() == direction) {
        signature.append(arg.type().getSignature());
      }
    }
    return signature.toString();
  }
}
