package io.github.panghy.pdbbridge.rpc.stream;

import io.github.panghy.pdbbridge.pixel.DrawableBuffer;
import io.github.panghy.pdbbridge.pixel.PixelRegion;
import io.github.panghy.pdbbridge.pixel.PixelStore;
import io.github.panghy.pdbbridge.pixel.Rectangle;
import io.github.panghy.pdbbridge.pixel.Tile;
import io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException;
import io.github.panghy.pdbbridge.rpc.error.SizeMismatchException;
import io.github.panghy.pdbbridge.rpc.error.TileStreamException;

import java.util.Objects;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;

/**
 * Owns the pool of tile streams and hands out integer handles to them.
 *
 * <p>A handle is the index of a slot in a fixed-size pool. New streams take the
 * lowest free slot, and a slot becomes free again only when its stream is
 * closed. A handle is valid exactly while its slot holds a stream.</p>
 *
 * <p>Each stream walks its rectangle one tile at a time. Callers read the
 * current tile with {@link #get(int)}, replace its pixels with
 * {@link #update(int, int, byte[])} and move on with {@link #advance(int)}.
 * Changes are stored when the stream advances past a tile and reach the
 * drawable when the stream is closed.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public class TileStreamManager {

  private static final Logger LOGGER = Logger.getLogger(TileStreamManager.class.getName());

  public static final int DEFAULT_CAPACITY = 16;

  private final PixelStore pixels;
  private final TileStream[] slots;

  public TileStreamManager(PixelStore pixels) {
    this(pixels, DEFAULT_CAPACITY);
  }

  public TileStreamManager(PixelStore pixels, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Tile stream capacity must be positive");
    }
    this.pixels = Objects.requireNonNull(pixels, "Pixel store cannot be null");
    this.slots = new TileStream[capacity];
  }

  /**
   * Opens a stream over a whole drawable.
   *
   * @param drawableId The drawable reference
   * @return The handle
   * @throws TileStreamException if the pool is full or the drawable does not exist
   */
  public int create(int drawableId) {
    int slot = requireFreeSlot();
    DrawableBuffer source = pixels.attach(drawableId)
        .orElseThrow(() -> TileStreamException.invalidDrawable(drawableId));
    return open(slot, drawableId, source, source.getBounds());
  }

  /**
   * Opens a stream over a rectangle of a drawable. The rectangle is clipped to
   * the drawable.
   *
   * @param drawableId The drawable reference
   * @param left       The left edge
   * @param top        The top edge
   * @param width      The width
   * @param height     The height
   * @return The handle
   * @throws InvalidArgumentException if the size is negative
   * @throws TileStreamException      if the pool is full or the drawable does not exist
   */
  public int create(int drawableId, int left, int top, int width, int height) {
    if (width < 0 || height < 0) {
      throw new InvalidArgumentException("Negative rectangle size: " + width + "x" + height);
    }
    return create(drawableId, new Rectangle(left, top, width, height));
  }

  /**
   * Opens a stream over a rectangle of a drawable. The rectangle is clipped to
   * the drawable.
   *
   * @param drawableId The drawable reference
   * @param rectangle  The rectangle
   * @return The handle
   * @throws InvalidArgumentException if the rectangle does not overlap the drawable
   * @throws TileStreamException      if the pool is full or the drawable does not exist
   */
  public int create(int drawableId, Rectangle rectangle) {
    int slot = requireFreeSlot();
    DrawableBuffer source = pixels.attach(drawableId)
        .orElseThrow(() -> TileStreamException.invalidDrawable(drawableId));
    Rectangle bounds = rectangle.intersect(source.getBounds());
    if (bounds.isEmpty()) {
      pixels.detach(source);
      throw new InvalidArgumentException(rectangle + " does not overlap drawable " + drawableId);
    }
    return open(slot, drawableId, source, bounds);
  }

  private int open(int slot, int drawableId, DrawableBuffer source, Rectangle bounds) {
    DrawableBuffer target = pixels.attach(drawableId).orElse(null);
    if (target == null) {
      pixels.detach(source);
      throw TileStreamException.invalidDrawable(drawableId);
    }
    PixelRegion sourceRegion = pixels.regionInit(source, bounds, false);
    PixelRegion targetRegion = pixels.regionInit(target, bounds, true);
    slots[slot] = new TileStream(drawableId, bounds, source, target, pixels.iterate(sourceRegion, targetRegion));
    debug(LOGGER, "Opened tile stream " + slot + " on drawable " + drawableId + " " + bounds);
    return slot;
  }

  /**
   * Checks a handle.
   *
   * @param handle The handle
   * @return true if the handle names an open stream
   */
  public boolean isValid(int handle) {
    return handle >= 0 && handle < slots.length && slots[handle] != null;
  }

  /**
   * Reads the current tile.
   *
   * @param handle The handle
   * @return A snapshot of the current source tile
   * @throws TileStreamException if the handle is invalid or the stream is past its last tile
   */
  public TileView get(int handle) {
    TileStream stream = requireStream(handle);
    if (!stream.hasTile()) {
      throw TileStreamException.noMoreTiles(handle);
    }
    Tile tile = stream.sourceTile();
    return new TileView(tile.getX(), tile.getY(), tile.getWidth(), tile.getHeight(), tile.getRowStride(),
        tile.getBytesPerPixel(), stream.getTileIndex(), tile.getData().clone());
  }

  /**
   * Stores the current tile and moves to the next one.
   *
   * @param handle The handle
   * @return true if the stream now sits on a tile, false if it is past the end
   * @throws TileStreamException if the handle is invalid
   */
  public boolean advance(int handle) {
    return requireStream(handle).advance();
  }

  /**
   * Replaces the pixels of the current tile. The new pixels are stored when the
   * stream advances or closes.
   *
   * @param handle The handle
   * @param size   The number of bytes to use; must be exactly the tile size
   * @param bytes  The pixels, at least {@code size} bytes
   * @throws SizeMismatchException if the size is not the tile size or exceeds the bytes supplied;
   *                               the tile is left unchanged
   * @throws TileStreamException   if the handle is invalid or the stream is past its last tile
   */
  public void update(int handle, int size, byte[] bytes) {
    TileStream stream = requireStream(handle);
    if (!stream.hasTile()) {
      throw TileStreamException.noMoreTiles(handle);
    }
    Tile target = stream.targetTile();
    int expected = target.getSize();
    if (size > bytes.length) {
      throw new SizeMismatchException(expected, bytes.length);
    }
    if (size != expected) {
      throw new SizeMismatchException(expected, size);
    }
    target.write(bytes, size);
  }

  /**
   * Closes a stream: stores every remaining tile, folds the changes into the
   * drawable, marks the rectangle for redraw, flushes displays and frees the
   * handle. Closing an invalid handle does nothing.
   *
   * @param handle The handle
   */
  public void close(int handle) {
    if (!isValid(handle)) {
      return;
    }
    TileStream stream = slots[handle];
    try {
      while (stream.advance()) {
        // drain
      }
      pixels.mergeShadow(stream.getDrawableId());
      pixels.markDirty(stream.getDrawableId(), stream.getBounds());
      pixels.flushDisplay();
    } finally {
      pixels.detach(stream.getSource());
      pixels.detach(stream.getTarget());
      slots[handle] = null;
    }
    debug(LOGGER, "Closed tile stream " + handle + " after " + stream.getTileIndex() + " tiles");
  }

  /**
   * Closes every open stream.
   */
  public void closeAll() {
    for (int handle = 0; handle < slots.length; handle++) {
      close(handle);
    }
  }

  public int getCapacity() {
    return slots.length;
  }

  public int getOpenCount() {
    int count = 0;
    for (TileStream stream : slots) {
      if (stream != null) {
        count++;
      }
    }
    return count;
  }

  private int requireFreeSlot() {
    for (int i = 0; i < slots.length; i++) {
      if (slots[i] == null) {
        return i;
      }
    }
    throw TileStreamException.poolExhausted(slots.length);
  }

  private TileStream requireStream(int handle) {
    if (!isValid(handle)) {
      throw TileStreamException.invalidHandle(handle);
    }
    return slots[handle];
  }
}
