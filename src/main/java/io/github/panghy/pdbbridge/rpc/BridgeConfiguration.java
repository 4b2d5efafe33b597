package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.rpc.stream.TileStreamManager;

/**
 * Configuration for {@link PdbBusBridge}.
 *
 * <p>This class holds the names the bridge publishes itself under on the bus
 * and the size of the tile-stream pool.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * BridgeConfiguration config = BridgeConfiguration.builder()
 *     .objectPath("/org/example/editor")
 *     .tileStreamCapacity(4)
 *     .build();
 *
 * PdbBusBridge bridge = new PdbBusBridge(registry, pixels, transport, config);
 * }</pre>
 */
public class BridgeConfiguration {

  /**
   * Default well-known bus name.
   */
  public static final String DEFAULT_SERVICE_NAME = "edu.grinnell.cs.glimmer.GimpDBus";

  /**
   * Default path of the exported object.
   */
  public static final String DEFAULT_OBJECT_PATH = "/edu/grinnell/cs/glimmer/gimp";

  /**
   * Default name of the interface carrying the registry procedures.
   */
  public static final String DEFAULT_PDB_INTERFACE = "edu.grinnell.cs.glimmer.pdb";

  /**
   * Default name of the interface carrying the built-in methods.
   */
  public static final String DEFAULT_ADDITIONAL_INTERFACE = "edu.grinnell.cs.glimmer.gimpplus";

  /**
   * Default reply of the about method.
   */
  public static final String DEFAULT_ABOUT_MESSAGE = "Glimmer Labs' Gimp D-Bus plugin version 0.0.4";

  private final String serviceName;
  private final String objectPath;
  private final String pdbInterface;
  private final String additionalInterface;
  private final String aboutMessage;
  private final int tileStreamCapacity;

  private BridgeConfiguration(Builder builder) {
    this.serviceName = builder.serviceName;
    this.objectPath = builder.objectPath;
    this.pdbInterface = builder.pdbInterface;
    this.additionalInterface = builder.additionalInterface;
    this.aboutMessage = builder.aboutMessage;
    this.tileStreamCapacity = builder.tileStreamCapacity;
  }

  /**
   * Gets the well-known bus name the bridge owns.
   *
   * @return The service name
   */
  public String getServiceName() {
    return serviceName;
  }

  public String getObjectPath() {
    return objectPath;
  }

  public String getPdbInterface() {
    return pdbInterface;
  }

  public String getAdditionalInterface() {
    return additionalInterface;
  }

  public String getAboutMessage() {
    return aboutMessage;
  }

  /**
   * Gets the number of tile streams that may be open at once.
   *
   * @return The pool capacity
   */
  public int getTileStreamCapacity() {
    return tileStreamCapacity;
  }

  /**
   * Creates a new builder for BridgeConfiguration.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a default configuration with the standard bus names.
   *
   * @return A default configuration
   */
  public static BridgeConfiguration defaultConfig() {
    return builder().build();
  }

  /**
   * Builder for BridgeConfiguration.
   */
  public static class Builder {
    private String serviceName = DEFAULT_SERVICE_NAME;
    private String objectPath = DEFAULT_OBJECT_PATH;
    private String pdbInterface = DEFAULT_PDB_INTERFACE;
    private String additionalInterface = DEFAULT_ADDITIONAL_INTERFACE;
    private String aboutMessage = DEFAULT_ABOUT_MESSAGE;
    private int tileStreamCapacity = TileStreamManager.DEFAULT_CAPACITY;

    private Builder() {
    }

    /**
     * Sets the well-known bus name.
     *
     * @param name A dotted name with at least two elements
     * @return This builder for chaining
     * @throws IllegalArgumentException if the name is not a dotted bus name
     */
    public Builder serviceName(String name) {
      this.serviceName = requireDottedName("Service name", name);
      return this;
    }

    /**
     * Sets the path of the exported object.
     *
     * @param path An absolute, slash-separated path
     * @return This builder for chaining
     * @throws IllegalArgumentException if the path does not start with a slash
     */
    public Builder objectPath(String path) {
      if (path == null || !path.startsWith("/")) {
        throw new IllegalArgumentException("Object path must start with '/', got: " + path);
      }
      if (path.length() > 1 && path.endsWith("/")) {
        throw new IllegalArgumentException("Object path must not end with '/', got: " + path);
      }
      this.objectPath = path;
      return this;
    }

    public Builder pdbInterface(String name) {
      this.pdbInterface = requireDottedName("PDB interface", name);
      return this;
    }

    public Builder additionalInterface(String name) {
      this.additionalInterface = requireDottedName("Additional interface", name);
      return this;
    }

    public Builder aboutMessage(String message) {
      if (message == null) {
        throw new IllegalArgumentException("About message cannot be null");
      }
      this.aboutMessage = message;
      return this;
    }

    /**
     * Sets how many tile streams may be open at once.
     *
     * @param capacity The pool capacity (must be positive)
     * @return This builder for chaining
     * @throws IllegalArgumentException if capacity is not positive
     */
    public Builder tileStreamCapacity(int capacity) {
      if (capacity <= 0) {
        throw new IllegalArgumentException("Tile stream capacity must be positive, got: " + capacity);
      }
      this.tileStreamCapacity = capacity;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return The configuration
     * @throws IllegalArgumentException if the two interfaces have the same name
     */
    public BridgeConfiguration build() {
      if (pdbInterface.equals(additionalInterface)) {
        throw new IllegalArgumentException("PDB and additional interfaces must differ, both are: " + pdbInterface);
      }
      return new BridgeConfiguration(this);
    }

    private static String requireDottedName(String what, String name) {
      if (name == null || name.isEmpty() || !name.contains(".") || name.startsWith(".") || name.endsWith(".")) {
        throw new IllegalArgumentException(what + " must be a dotted name, got: " + name);
      }
      return name;
    }
  }

  @Override
  public String toString() {
    return "BridgeConfiguration{" +
        "serviceName='" + serviceName + '\'' +
        ", objectPath='" + objectPath + '\'' +
        ", pdbInterface='" + pdbInterface + '\'' +
        ", additionalInterface='" + additionalInterface + '\'' +
        ", tileStreamCapacity=" + tileStreamCapacity +
        '}';
  }
}
