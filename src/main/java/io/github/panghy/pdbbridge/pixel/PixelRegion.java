package io.github.panghy.pdbbridge.pixel;

import java.util.Objects;

/**
 * A rectangle of an attached drawable opened for reading, or for writing into
 * the drawable's shadow buffer. Writes become visible in the drawable only once
 * the shadow is merged.
 */
public final class PixelRegion {

  private final DrawableBuffer buffer;
  private final Rectangle bounds;
  private final boolean writable;

  public PixelRegion(DrawableBuffer buffer, Rectangle bounds, boolean writable) {
    this.buffer = Objects.requireNonNull(buffer, "Buffer cannot be null");
    this.bounds = Objects.requireNonNull(bounds, "Bounds cannot be null");
    this.writable = writable;
  }

  public DrawableBuffer getBuffer() {
    return buffer;
  }

  public Rectangle getBounds() {
    return bounds;
  }

  public boolean isWritable() {
    return writable;
  }

  @Override
  public String toString() {
    return "PixelRegion{" +
        "drawable=" + buffer.getDrawableId() +
        ", bounds=" + bounds +
        ", writable=" + writable +
        '}';
  }
}
