package io.github.panghy.pdbbridge.io.network;

import io.github.panghy.pdbbridge.rpc.BusInvocation;
import io.github.panghy.pdbbridge.rpc.InterfaceInfo;
import io.github.panghy.pdbbridge.rpc.IntrospectionXml;
import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCategory;
import io.github.panghy.pdbbridge.rpc.message.BusMessage;
import io.github.panghy.pdbbridge.rpc.message.BusMessageHeader.MessageType;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;
import static io.github.panghy.pdbbridge.util.LoggingUtil.info;
import static io.github.panghy.pdbbridge.util.LoggingUtil.warn;

/**
 * An in-process bus.
 *
 * <p>Calls made through {@link #call} are serialized to bytes, queued and
 * delivered on a single event-loop thread, so exported handlers see exactly what
 * a remote caller would send and never run concurrently. Replies travel back as
 * bytes as well and complete the future returned by {@link #call}.</p>
 */
public class LoopbackBusTransport implements BusTransport {

  private static final Logger LOGGER = Logger.getLogger(LoopbackBusTransport.class.getName());

  private final ExecutorService loop;
  private final Map<String, ExportedObject> exports = new ConcurrentHashMap<>();
  private final Set<String> ownedNames = ConcurrentHashMap.newKeySet();
  private final AtomicInteger serials = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

  private record ExportedObject(List<InterfaceInfo> interfaces, Consumer<BusInvocation> handler) {

    boolean implementsInterface(String name) {
      return interfaces.stream().anyMatch(i -> i.name().equals(name));
    }
  }

  public LoopbackBusTransport() {
    this.loop = Executors.newSingleThreadExecutor(r -> {
      Thread thread = new Thread(r, "loopback-bus");
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public void ownName(String serviceName) {
    checkOpen();
    if (!ownedNames.add(serviceName)) {
      throw new IllegalStateException("Name already owned: " + serviceName);
    }
    info(LOGGER, "Acquired bus name " + serviceName);
  }

  public boolean isNameOwned(String serviceName) {
    return ownedNames.contains(serviceName);
  }

  @Override
  public void export(String objectPath, List<InterfaceInfo> interfaces, Consumer<BusInvocation> handler) {
    checkOpen();
    if (exports.putIfAbsent(objectPath, new ExportedObject(List.copyOf(interfaces), handler)) != null) {
      throw new IllegalStateException("Object already exported at " + objectPath);
    }
    debug(LOGGER, "Exported " + objectPath + " with " + interfaces.size() + " interfaces");
  }

  /**
   * Calls a method on an exported object.
   *
   * @param objectPath    The object path
   * @param interfaceName The interface
   * @param member        The method name
   * @param args          The arguments
   * @return A future completed with the reply, either a method return or an error.
   *     It completes exceptionally if the transport is closed or the handler never replied.
   */
  public CompletableFuture<BusMessage> call(String objectPath, String interfaceName, String member,
                                            List<WireValue> args) {
    CompletableFuture<BusMessage> reply = new CompletableFuture<>();
    if (closed.get()) {
      reply.completeExceptionally(new IllegalStateException("Transport is closed"));
      return reply;
    }
    BusMessage call = BusMessage.methodCall(serials.incrementAndGet(), objectPath, interfaceName, member, args);
    ByteBuffer bytes = call.serialize();
    try {
      loop.execute(() -> {
        try {
          deliver(bytes, reply);
        } catch (RuntimeException e) {
          warn(LOGGER, "Failed to deliver call to " + member, e);
          reply.completeExceptionally(e);
        }
      });
    } catch (RejectedExecutionException e) {
      reply.completeExceptionally(new IllegalStateException("Transport is closed", e));
    }
    return reply;
  }

  @Override
  public CompletableFuture<Void> submit(Runnable task) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    if (closed.get()) {
      done.completeExceptionally(new RejectedExecutionException("Transport is closed"));
      return done;
    }
    try {
      loop.execute(() -> {
        try {
          task.run();
          done.complete(null);
        } catch (RuntimeException e) {
          done.completeExceptionally(e);
        }
      });
    } catch (RejectedExecutionException e) {
      done.completeExceptionally(e);
    }
    return done;
  }

  private void deliver(ByteBuffer bytes, CompletableFuture<BusMessage> reply) {
    BusMessage call = BusMessage.deserialize(bytes);
    String path = call.getHeader().getObjectPath();
    String interfaceName = call.getHeader().getInterfaceName();
    String member = call.getHeader().getMember();
    ExportedObject target = path == null ? null : exports.get(path);

    if (target == null) {
      send(reply, BusMessage.error(serials.incrementAndGet(), call, ErrorCategory.GENERAL,
          "No such object path '" + path + "'"));
    } else if (INTROSPECTABLE_INTERFACE.equals(interfaceName) && "Introspect".equals(member)) {
      send(reply, BusMessage.methodReturn(serials.incrementAndGet(), call,
          List.of(WireValue.string(IntrospectionXml.render(target.interfaces())))));
    } else if (!target.implementsInterface(interfaceName)) {
      send(reply, BusMessage.error(serials.incrementAndGet(), call, ErrorCategory.ARGUMENT,
          "No such interface '" + interfaceName + "' on object at path " + path));
    } else {
      LoopbackInvocation invocation = new LoopbackInvocation(call, reply);
      try {
        target.handler().accept(invocation);
      } catch (RuntimeException e) {
        warn(LOGGER, "Handler for " + member + " threw", e);
        if (!invocation.replied) {
          invocation.returnError(ErrorCategory.GENERAL, String.valueOf(e.getMessage()));
        }
      }
      if (!invocation.replied) {
        reply.completeExceptionally(new IllegalStateException("No reply to " + member));
      }
    }
  }

  // Replies go through bytes too, like everything else on the bus.
  private static void send(CompletableFuture<BusMessage> reply, BusMessage message) {
    reply.complete(roundTrip(message));
  }

  private static BusMessage roundTrip(BusMessage message) {
    return BusMessage.deserialize(message.serialize());
  }

  @Override
  public CompletableFuture<Void> close() {
    if (closed.compareAndSet(false, true)) {
      try {
        loop.execute(() -> closeFuture.complete(null));
      } catch (RejectedExecutionException e) {
        closeFuture.complete(null);
      }
      loop.shutdown();
      exports.clear();
      ownedNames.clear();
      info(LOGGER, "Loopback bus closed");
    }
    return closeFuture;
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void checkOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Transport is closed");
    }
  }

  private final class LoopbackInvocation implements BusInvocation {
    private final BusMessage call;
    private final CompletableFuture<BusMessage> reply;
    private boolean replied;

    LoopbackInvocation(BusMessage call, CompletableFuture<BusMessage> reply) {
      this.call = call;
      this.reply = reply;
    }

    @Override
    public String getInterfaceName() {
      return call.getHeader().getInterfaceName();
    }

    @Override
    public String getMember() {
      return call.getHeader().getMember();
    }

    @Override
    public List<WireValue> getArgs() {
      return call.getBody();
    }

    @Override
    public void returnValues(List<WireValue> values) {
      checkNotReplied();
      answer(roundTrip(BusMessage.methodReturn(serials.incrementAndGet(), call, values)));
    }

    @Override
    public void returnError(ErrorCategory category, String message) {
      checkNotReplied();
      answer(roundTrip(BusMessage.error(serials.incrementAndGet(), call, category, message)));
    }

    // A reply that fails to serialize leaves the call unanswered, so an error can still be sent.
    private void answer(BusMessage message) {
      replied = true;
      reply.complete(message);
    }

    private void checkNotReplied() {
      if (replied) {
        throw new IllegalStateException("Call " + call.getHeader().getSerial() + " already answered");
      }
    }
  }

  /**
   * Checks whether a reply is an error.
   *
   * @param reply A reply returned through {@link #call}
   * @return true for error replies
   */
  public static boolean isError(BusMessage reply) {
    return reply.getHeader().getType() == MessageType.ERROR;
  }
}
