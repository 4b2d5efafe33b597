package io.github.panghy.pdbbridge.io.network;

import io.github.panghy.pdbbridge.rpc.BusInvocation;
import io.github.panghy.pdbbridge.rpc.InterfaceInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The message bus as seen by the bridge: a place to claim a well-known name and
 * to export an object whose calls are delivered to a handler.
 *
 * <p>Implementations deliver calls one at a time, in arrival order, on a single
 * thread. A handler runs to completion before the next call is delivered.</p>
 */
public interface BusTransport {

  /**
   * Standard interface every exported object answers for introspection.
   */
  String INTROSPECTABLE_INTERFACE = "org.freedesktop.DBus.Introspectable";

  /**
   * Claims a well-known bus name.
   *
   * @param serviceName The dotted name
   * @throws IllegalStateException if the name is already owned or the transport is closed
   */
  void ownName(String serviceName);

  /**
   * Exports an object. Calls to any of the listed interfaces at the path are
   * delivered to {@code handler}; introspection calls are answered by the
   * transport from the interface descriptions.
   *
   * @param objectPath The object path
   * @param interfaces The interfaces the object implements
   * @param handler    Receives every call
   * @throws IllegalStateException if the path is already exported or the transport is closed
   */
  void export(String objectPath, List<InterfaceInfo> interfaces, Consumer<BusInvocation> handler);

  /**
   * Runs a task on the thread that delivers calls, after every call already
   * queued. State that handlers touch can be changed safely from here.
   *
   * @param task The task
   * @return A future that completes when the task has run, or fails with the
   *     task's exception. It fails with {@link java.util.concurrent.RejectedExecutionException}
   *     if the transport is closed.
   */
  CompletableFuture<Void> submit(Runnable task);

  /**
   * Closes the transport. Calls already queued are still answered; later calls
   * fail.
   *
   * @return A future that completes once the transport has stopped delivering calls
   */
  CompletableFuture<Void> close();
}
