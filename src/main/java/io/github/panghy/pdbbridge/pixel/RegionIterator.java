package io.github.panghy.pdbbridge.pixel;

/**
 * Walks two regions of the same shape tile by tile, in row-major order.
 * Obtained from {@link PixelStore#iterate(PixelRegion, PixelRegion)}.
 */
public interface RegionIterator {

  /**
   * Gets the current tile of the read-only region.
   *
   * @return The tile, or null once the iterator is finished
   */
  Tile source();

  /**
   * Gets the current tile of the writable region.
   *
   * @return The tile, or null once the iterator is finished
   */
  Tile target();

  /**
   * Stores the current target tile and moves both regions to their next tile.
   *
   * @return true if there is a next tile, false if the iterator is now finished
   */
  boolean next();

  boolean isFinished();
}
