package io.github.panghy.pdbbridge.pixel;

import java.util.Optional;

/**
 * Pixel-buffer primitives of the host application.
 */
public interface PixelStore {

  /**
   * Attaches a drawable for pixel access.
   *
   * @param drawableId The drawable reference
   * @return The attached buffer, or empty if the drawable does not exist
   */
  Optional<DrawableBuffer> attach(int drawableId);

  /**
   * Opens a region of an attached drawable.
   *
   * @param buffer   The attached buffer
   * @param bounds   The rectangle, inside the drawable
   * @param writable true to write into the drawable's shadow buffer
   * @return The region
   */
  PixelRegion regionInit(DrawableBuffer buffer, Rectangle bounds, boolean writable);

  /**
   * Starts walking a source and a target region of the same shape.
   *
   * @param source The region to read
   * @param target The region to write
   * @return The iterator positioned on the first tile, or null if the regions are empty
   */
  RegionIterator iterate(PixelRegion source, PixelRegion target);

  void detach(DrawableBuffer buffer);

  /**
   * Copies a drawable's shadow buffer into the drawable.
   *
   * @param drawableId The drawable reference
   */
  void mergeShadow(int drawableId);

  /**
   * Marks part of a drawable as needing a redraw.
   *
   * @param drawableId The drawable reference
   * @param bounds     The changed area
   */
  void markDirty(int drawableId, Rectangle bounds);

  /**
   * Redraws every display with pending changes.
   */
  void flushDisplay();
}
