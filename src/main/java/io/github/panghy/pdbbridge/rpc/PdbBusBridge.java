package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.io.network.BusTransport;
import io.github.panghy.pdbbridge.pdb.ProcedureInfo;
import io.github.panghy.pdbbridge.pdb.ProcedureRegistry;
import io.github.panghy.pdbbridge.pixel.PixelStore;
import io.github.panghy.pdbbridge.rpc.dispatch.PdbCallDispatcher;
import io.github.panghy.pdbbridge.rpc.stream.TileStreamManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;
import static io.github.panghy.pdbbridge.util.LoggingUtil.info;
import static io.github.panghy.pdbbridge.util.LoggingUtil.warn;

/**
 * Publishes a procedure registry on a message bus.
 *
 * <p>{@link #start()} lists every registry procedure once, publishes the
 * resulting method table on the PDB interface next to the built-in methods on
 * the additional interface, and claims the service name. The table is not
 * refreshed afterwards. The bridge stops when {@link #stop()} is called or a
 * caller invokes {@code ggimp_quit}; stopping closes every open tile stream and
 * then the transport.</p>
 */
public class PdbBusBridge {

  private static final Logger LOGGER = Logger.getLogger(PdbBusBridge.class.getName());

  private final ProcedureRegistry registry;
  private final BusTransport transport;
  private final BridgeConfiguration config;
  private final TileStreamManager tileStreams;
  private final BridgeService service;
  private final CompletableFuture<Void> stopped = new CompletableFuture<>();
  private List<InterfaceInfo> published = List.of();
  private boolean started;
  private boolean stopping;

  public PdbBusBridge(ProcedureRegistry registry, PixelStore pixels, BusTransport transport) {
    this(registry, pixels, transport, BridgeConfiguration.defaultConfig());
  }

  public PdbBusBridge(ProcedureRegistry registry, PixelStore pixels, BusTransport transport,
                      BridgeConfiguration config) {
    this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
    this.config = Objects.requireNonNull(config, "Configuration cannot be null");
    this.tileStreams = new TileStreamManager(pixels, config.getTileStreamCapacity());
    this.service = new BridgeService(config, new PdbCallDispatcher(registry), tileStreams, this::stop);
  }

  /**
   * Publishes the bridge.
   *
   * @throws IllegalStateException if the bridge was already started
   */
  public synchronized void start() {
    if (started || stopping) {
      throw new IllegalStateException("Bridge already started");
    }
    started = true;

    List<MethodInfo> methods = new ArrayList<>();
    for (String name : registry.enumerateAll()) {
      Optional<ProcedureInfo> procedure = registry.lookup(name);
      if (procedure.isPresent()) {
        methods.add(MethodInfo.forProcedure(procedure.get()));
      } else {
        debug(LOGGER, "Procedure " + name + " disappeared before it could be published");
      }
    }
    published = List.of(new InterfaceInfo(config.getPdbInterface(), methods), service.describeBuiltIns());

    transport.export(config.getObjectPath(), published, service::handle);
    transport.ownName(config.getServiceName());
    info(LOGGER, "Published " + methods.size() + " procedures as " + config.getServiceName()
        + " at " + config.getObjectPath());
  }

  /**
   * Closes every tile stream and then the transport. Safe to call more than once.
   * The streams are closed on the transport's delivery thread, after any call
   * already queued.
   *
   * @return A future that completes once the transport has stopped
   */
  public synchronized CompletableFuture<Void> stop() {
    if (stopping) {
      return stopped;
    }
    stopping = true;
    if (!started) {
      stopped.complete(null);
      return stopped;
    }
    transport.submit(tileStreams::closeAll)
        .exceptionally(t -> {
          Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
          if (cause instanceof RejectedExecutionException) {
            // Nothing is delivering calls any more.
            tileStreams.closeAll();
          } else {
            warn(LOGGER, "Failed to close tile streams", cause);
          }
          return null;
        })
        .thenCompose(v -> transport.close())
        .whenComplete((v, t) -> {
          if (t != null) {
            stopped.completeExceptionally(t);
          } else {
            info(LOGGER, "Bridge stopped");
            stopped.complete(null);
          }
        });
    return stopped;
  }

  /**
   * Gets a future that completes when the bridge has stopped.
   *
   * @return The stop future
   */
  public CompletableFuture<Void> onStop() {
    return stopped;
  }

  public List<InterfaceInfo> getPublishedInterfaces() {
    return published;
  }

  public BridgeService getService() {
    return service;
  }

  public TileStreamManager getTileStreams() {
    return tileStreams;
  }

  public BridgeConfiguration getConfig() {
    return config;
  }
}
