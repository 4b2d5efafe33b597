package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.pdb.RgbColor;
import io.github.panghy.pdbbridge.rpc.dispatch.PdbCallDispatcher;
import io.github.panghy.pdbbridge.rpc.error.BridgeException;
import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCategory;
import io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException;
import io.github.panghy.pdbbridge.rpc.error.TypeMismatchException;
import io.github.panghy.pdbbridge.rpc.serialization.WireType;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;
import io.github.panghy.pdbbridge.rpc.stream.TileStreamManager;
import io.github.panghy.pdbbridge.rpc.stream.TileView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;
import static io.github.panghy.pdbbridge.util.LoggingUtil.warn;

/**
 * Answers bus calls.
 *
 * <p>A call whose name is one of the built-in methods is handled here: the
 * about and quit methods, the red-component helper, and the tile-stream
 * operations backed by a {@link TileStreamManager}. Every other name is
 * forwarded to the {@link PdbCallDispatcher}.</p>
 *
 * <p>Every call gets exactly one reply. A {@link BridgeException} becomes an
 * error reply under the exception's category; any other runtime failure
 * becomes a general error and is logged.</p>
 */
public class BridgeService {

  private static final Logger LOGGER = Logger.getLogger(BridgeService.class.getName());

  private final BridgeConfiguration config;
  private final PdbCallDispatcher dispatcher;
  private final TileStreamManager tileStreams;
  private final Runnable quitAction;
  private final Map<String, MethodHandler> builtIns = new LinkedHashMap<>();
  private final List<MethodInfo> builtInMethods = new ArrayList<>();

  /**
   * Creates the service.
   *
   * @param config      The bridge configuration
   * @param dispatcher  The dispatcher for registry procedures
   * @param tileStreams The tile-stream pool
   * @param quitAction  Run after the reply to a quit call has been sent
   */
  public BridgeService(BridgeConfiguration config, PdbCallDispatcher dispatcher, TileStreamManager tileStreams,
                       Runnable quitAction) {
    this.config = Objects.requireNonNull(config, "Configuration cannot be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
    this.tileStreams = Objects.requireNonNull(tileStreams, "Tile stream manager cannot be null");
    this.quitAction = Objects.requireNonNull(quitAction, "Quit action cannot be null");
    registerBuiltIns();
  }

  private void registerBuiltIns() {
    register(MethodInfo.of("ggimp_about",
            ArgInfo.out("result", WireType.STRING)),
        (name, args) -> List.of(WireValue.string(config.getAboutMessage())));
    register(MethodInfo.of("ggimp_quit"),
        (name, args) -> List.of());
    register(MethodInfo.of("ggimp_rgb_red",
            ArgInfo.in("color", WireType.INT32),
            ArgInfo.out("red", WireType.INT32)),
        (name, args) -> List.of(WireValue.int32(RgbColor.unpack(args.get(0).asInt32()).red())));

    register(MethodInfo.of("drawable_new_tile_stream",
            ArgInfo.in("drawable", WireType.INT32),
            ArgInfo.out("stream", WireType.INT32)),
        (name, args) -> List.of(WireValue.int32(tileStreams.create(args.get(0).asInt32()))));
    register(MethodInfo.of("rectangle_new_tile_stream",
            ArgInfo.in("drawable", WireType.INT32),
            ArgInfo.in("left", WireType.INT32),
            ArgInfo.in("top", WireType.INT32),
            ArgInfo.in("width", WireType.INT32),
            ArgInfo.in("height", WireType.INT32),
            ArgInfo.out("stream", WireType.INT32)),
        (name, args) -> List.of(WireValue.int32(tileStreams.create(args.get(0).asInt32(),
            args.get(1).asInt32(), args.get(2).asInt32(), args.get(3).asInt32(), args.get(4).asInt32()))));
    register(MethodInfo.of("tile_stream_is_valid",
            ArgInfo.in("stream", WireType.INT32),
            ArgInfo.out("valid", WireType.BOOLEAN)),
        (name, args) -> List.of(WireValue.bool(tileStreams.isValid(args.get(0).asInt32()))));
    register(MethodInfo.of("tile_stream_get",
            ArgInfo.in("stream", WireType.INT32),
            ArgInfo.out("x", WireType.INT32),
            ArgInfo.out("y", WireType.INT32),
            ArgInfo.out("width", WireType.INT32),
            ArgInfo.out("height", WireType.INT32),
            ArgInfo.out("rowstride", WireType.INT32),
            ArgInfo.out("bpp", WireType.INT32),
            ArgInfo.out("index", WireType.INT32),
            ArgInfo.out("data", WireType.BYTE_ARRAY)),
        (name, args) -> describeTile(tileStreams.get(args.get(0).asInt32())));
    register(MethodInfo.of("tile_stream_advance",
            ArgInfo.in("stream", WireType.INT32),
            ArgInfo.out("more", WireType.BOOLEAN)),
        (name, args) -> List.of(WireValue.bool(tileStreams.advance(args.get(0).asInt32()))));
    register(MethodInfo.of("tile_update",
            ArgInfo.in("stream", WireType.INT32),
            ArgInfo.in("size", WireType.INT32),
            ArgInfo.in("data", WireType.BYTE_ARRAY)),
        (name, args) -> {
          tileStreams.update(args.get(0).asInt32(), args.get(1).asInt32(), args.get(2).asByteArray());
          return List.of();
        });
    register(MethodInfo.of("tile_stream_close",
            ArgInfo.in("stream", WireType.INT32)),
        (name, args) -> {
          tileStreams.close(args.get(0).asInt32());
          return List.of();
        });
  }

  private void register(MethodInfo method, MethodHandler handler) {
    builtInMethods.add(method);
    builtIns.put(method.name(), (name, args) -> {
      checkArgs(method, args);
      return handler.handle(name, args);
    });
  }

  /**
   * Answers an inbound call. Never throws; failures become error replies.
   *
   * @param invocation The call
   */
  public void handle(BusInvocation invocation) {
    String member = invocation.getMember();
    List<WireValue> values;
    try {
      values = invoke(member, invocation.getArgs());
    } catch (BridgeException e) {
      debug(LOGGER, member + " failed: " + e);
      invocation.returnError(e.getCategory(), e.getMessage());
      return;
    } catch (RuntimeException e) {
      warn(LOGGER, "Unexpected failure in " + member, e);
      invocation.returnError(ErrorCategory.GENERAL, "call to " + member + " failed: " + e.getMessage());
      return;
    }
    invocation.returnValues(values);
    if ("ggimp_quit".equals(member)) {
      quitAction.run();
    }
  }

  /**
   * Runs a call and returns its results.
   *
   * @param member The method name
   * @param args   The wire arguments
   * @return The wire return values
   * @throws BridgeException if the call fails
   */
  public List<WireValue> invoke(String member, List<WireValue> args) {
    MethodHandler handler = builtIns.get(member);
    if (handler != null) {
      return handler.handle(member, args);
    }
    return dispatcher.dispatch(member, args);
  }

  /**
   * Describes the built-in methods as published on the additional interface.
   *
   * @return The interface description
   */
  public InterfaceInfo describeBuiltIns() {
    return new InterfaceInfo(config.getAdditionalInterface(), builtInMethods);
  }

  public boolean isBuiltIn(String member) {
    return builtIns.containsKey(member);
  }

  public List<String> getBuiltInNames() {
    return Collections.unmodifiableList(new ArrayList<>(builtIns.keySet()));
  }

  private static List<WireValue> describeTile(TileView tile) {
    return List.of(
        WireValue.int32(tile.x()),
        WireValue.int32(tile.y()),
        WireValue.int32(tile.width()),
        WireValue.int32(tile.height()),
        WireValue.int32(tile.rowStride()),
        WireValue.int32(tile.bytesPerPixel()),
        WireValue.int32(tile.index()),
        WireValue.byteArray(tile.data()));
  }

  private static void checkArgs(MethodInfo method, List<WireValue> args) {
    List<ArgInfo> inArgs = new ArrayList<>();
    for (ArgInfo arg : method.args()) {
      if (arg.direction() == ArgInfo.Direction.IN) {
        inArgs.add(arg);
      }
    }
    if (args.size() != inArgs.size()) {
      throw new InvalidArgumentException(inArgs.size() == 1
          ? method.name() + " expects 1 parameter, received " + args.size()
          : method.name() + " expects " + inArgs.size() + " parameters, received " + args.size());
    }
    for (int i = 0; i < args.size(); i++) {
      if (args.get(i).getType() != inArgs.get(i).type()) {
        throw new TypeMismatchException(i, inArgs.get(i).type(), args.get(i).getType());
      }
    }
  }
}
