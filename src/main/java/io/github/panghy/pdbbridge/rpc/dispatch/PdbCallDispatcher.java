package io.github.panghy.pdbbridge.rpc.dispatch;

import io.github.panghy.pdbbridge.pdb.CallStatus;
import io.github.panghy.pdbbridge.pdb.Param;
import io.github.panghy.pdbbridge.pdb.ProcedureRegistry;
import io.github.panghy.pdbbridge.rpc.error.CallFailedException;
import io.github.panghy.pdbbridge.rpc.serialization.ParamCodec;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;

/**
 * Performs a registry call on behalf of a bus caller.
 *
 * <p>A dispatch resolves the method name, decodes the arguments against the
 * formal signature, invokes the procedure, checks the status entry and encodes
 * the remaining results against the return signature. Each step either
 * succeeds or throws; nothing is retried and nothing is kept between calls.</p>
 */
public class PdbCallDispatcher {

  private static final Logger LOGGER = Logger.getLogger(PdbCallDispatcher.class.getName());

  private final SignatureResolver resolver;
  private final ProcedureRegistry registry;
  private final ParamCodec codec;

  public PdbCallDispatcher(ProcedureRegistry registry) {
    this(registry, new ParamCodec());
  }

  public PdbCallDispatcher(ProcedureRegistry registry, ParamCodec codec) {
    this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
    this.resolver = new SignatureResolver(registry);
  }

  /**
   * Calls a registry procedure.
   *
   * @param methodName The bus method name
   * @param args       The wire arguments
   * @return The wire return values, without the status entry
   * @throws io.github.panghy.pdbbridge.rpc.error.UnknownProcedureException if no procedure has that name
   * @throws io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException  if the arguments do not match
   * @throws CallFailedException                                            if the call did not succeed
   * @throws io.github.panghy.pdbbridge.rpc.error.EncodeFailedException    if a result cannot be sent
   */
  public List<WireValue> dispatch(String methodName, List<WireValue> args) {
    debug(LOGGER, "Dispatching " + methodName + " with " + args.size() + " arguments");
    ResolvedProcedure resolved = resolver.resolve(methodName);
    String name = resolved.registryName();

    List<Param> params = codec.decodeAll(methodName, resolved.formals(), args);

    Optional<List<Param>> results = registry.invoke(resolved.procedure(), params);
    if (results.isEmpty() || results.get().isEmpty()) {
      throw new CallFailedException(name, null);
    }
    List<Param> values = results.get();
    CallStatus status = statusOf(values.get(0));
    if (status != CallStatus.SUCCESS) {
      throw new CallFailedException(name, status);
    }

    List<WireValue> wireValues = codec.encodeAll(resolved.returns(), values.subList(1, values.size()));
    debug(LOGGER, "Call to " + name + " returned " + wireValues.size() + " values");
    return wireValues;
  }

  // A result list that does not start with a status is treated like an empty one.
  private static CallStatus statusOf(Param first) {
    if (first instanceof Param.StatusParam) {
      return ((Param.StatusParam) first).status();
    }
    return null;
  }
}
