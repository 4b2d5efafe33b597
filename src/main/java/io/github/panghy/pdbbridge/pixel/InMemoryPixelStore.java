package io.github.panghy.pdbbridge.pixel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;

/**
 * A pixel store that keeps drawables in process memory.
 *
 * <p>Drawables are cut into a fixed grid of square tiles anchored at the
 * drawable's origin, {@value #DEFAULT_TILE_SIZE} pixels on a side unless
 * configured otherwise. A region is walked over the grid cells it touches,
 * clipped to the region, in row-major order.</p>
 *
 * <p>Writable regions write into a per-drawable shadow buffer, created from the
 * drawable's pixels the first time a writable region is opened and folded back
 * into the drawable by {@link #mergeShadow(int)}. Dirty rectangles and display
 * flushes are only recorded, so callers can check them.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public class InMemoryPixelStore implements PixelStore {

  private static final Logger LOGGER = Logger.getLogger(InMemoryPixelStore.class.getName());

  public static final int DEFAULT_TILE_SIZE = 64;

  private final int tileSize;
  private final Map<Integer, Drawable> drawables = new HashMap<>();
  private int nextDrawableId = 1;
  private int flushCount;

  public InMemoryPixelStore() {
    this(DEFAULT_TILE_SIZE);
  }

  public InMemoryPixelStore(int tileSize) {
    if (tileSize <= 0) {
      throw new IllegalArgumentException("Tile size must be positive");
    }
    this.tileSize = tileSize;
  }

  private static final class Drawable {
    final int id;
    final int width;
    final int height;
    final int bytesPerPixel;
    final byte[] pixels;
    final List<Rectangle> dirtyRegions = new ArrayList<>();
    byte[] shadow;
    int attachCount;

    Drawable(int id, int width, int height, int bytesPerPixel) {
      this.id = id;
      this.width = width;
      this.height = height;
      this.bytesPerPixel = bytesPerPixel;
      this.pixels = new byte[width * height * bytesPerPixel];
    }
  }

  private final class Attachment implements DrawableBuffer {
    private final Drawable drawable;
    private boolean detached;

    Attachment(Drawable drawable) {
      this.drawable = drawable;
    }

    @Override
    public int getDrawableId() {
      return drawable.id;
    }

    @Override
    public int getWidth() {
      return drawable.width;
    }

    @Override
    public int getHeight() {
      return drawable.height;
    }

    @Override
    public int getBytesPerPixel() {
      return drawable.bytesPerPixel;
    }

    @Override
    public String toString() {
      return "DrawableBuffer{id=" + drawable.id + ", detached=" + detached + '}';
    }
  }

  /**
   * Creates a drawable filled with zero bytes.
   *
   * @param width         The width in pixels
   * @param height        The height in pixels
   * @param bytesPerPixel The number of bytes per pixel
   * @return The new drawable's id
   */
  public int createDrawable(int width, int height, int bytesPerPixel) {
    if (width <= 0 || height <= 0 || bytesPerPixel <= 0) {
      throw new IllegalArgumentException("Invalid drawable shape: " + width + "x" + height + "x" + bytesPerPixel);
    }
    int id = nextDrawableId++;
    drawables.put(id, new Drawable(id, width, height, bytesPerPixel));
    debug(LOGGER, "Created drawable " + id + " (" + width + "x" + height + "x" + bytesPerPixel + ")");
    return id;
  }

  /**
   * Deletes a drawable. Attached buffers stay usable for regions already opened
   * but the drawable can no longer be attached.
   *
   * @param drawableId The drawable id
   * @return true if the drawable existed
   */
  public boolean removeDrawable(int drawableId) {
    return drawables.remove(drawableId) != null;
  }

  /**
   * Gets a copy of a drawable's pixels, row-major, without the shadow buffer.
   *
   * @param drawableId The drawable id
   * @return A copy of the pixels
   */
  public byte[] getPixels(int drawableId) {
    return requireDrawable(drawableId).pixels.clone();
  }

  /**
   * Replaces a drawable's pixels.
   *
   * @param drawableId The drawable id
   * @param pixels     Exactly width * height * bytesPerPixel bytes
   */
  public void setPixels(int drawableId, byte[] pixels) {
    Drawable drawable = requireDrawable(drawableId);
    if (pixels.length != drawable.pixels.length) {
      throw new IllegalArgumentException("Expected " + drawable.pixels.length + " bytes, got " + pixels.length);
    }
    System.arraycopy(pixels, 0, drawable.pixels, 0, pixels.length);
  }

  public List<Rectangle> getDirtyRegions(int drawableId) {
    return List.copyOf(requireDrawable(drawableId).dirtyRegions);
  }

  public boolean hasShadow(int drawableId) {
    return requireDrawable(drawableId).shadow != null;
  }

  public int getAttachCount(int drawableId) {
    return requireDrawable(drawableId).attachCount;
  }

  public int getFlushCount() {
    return flushCount;
  }

  public int getTileSize() {
    return tileSize;
  }

  @Override
  public Optional<DrawableBuffer> attach(int drawableId) {
    Drawable drawable = drawables.get(drawableId);
    if (drawable == null) {
      return Optional.empty();
    }
    drawable.attachCount++;
    return Optional.of(new Attachment(drawable));
  }

  @Override
  public PixelRegion regionInit(DrawableBuffer buffer, Rectangle bounds, boolean writable) {
    Drawable drawable = attached(buffer).drawable;
    if (!buffer.getBounds().contains(bounds)) {
      throw new IllegalArgumentException(bounds + " lies outside drawable " + drawable.id);
    }
    if (writable && drawable.shadow == null) {
      drawable.shadow = drawable.pixels.clone();
    }
    return new PixelRegion(buffer, bounds, writable);
  }

  @Override
  public RegionIterator iterate(PixelRegion source, PixelRegion target) {
    Rectangle sourceBounds = source.getBounds();
    Rectangle targetBounds = target.getBounds();
    if (sourceBounds.width() != targetBounds.width() || sourceBounds.height() != targetBounds.height()) {
      throw new IllegalArgumentException("Regions differ in shape: " + sourceBounds + " and " + targetBounds);
    }
    if (sourceBounds.isEmpty()) {
      return null;
    }
    return new GridIterator(source, target);
  }

  @Override
  public void detach(DrawableBuffer buffer) {
    Attachment attachment = attached(buffer);
    attachment.detached = true;
    attachment.drawable.attachCount--;
  }

  @Override
  public void mergeShadow(int drawableId) {
    Drawable drawable = drawables.get(drawableId);
    if (drawable == null) {
      debug(LOGGER, "Not merging shadow of missing drawable " + drawableId);
      return;
    }
    if (drawable.shadow != null) {
      System.arraycopy(drawable.shadow, 0, drawable.pixels, 0, drawable.pixels.length);
      drawable.shadow = null;
    }
  }

  @Override
  public void markDirty(int drawableId, Rectangle bounds) {
    Drawable drawable = drawables.get(drawableId);
    if (drawable != null) {
      drawable.dirtyRegions.add(bounds);
    }
  }

  @Override
  public void flushDisplay() {
    flushCount++;
  }

  private Drawable requireDrawable(int drawableId) {
    Drawable drawable = drawables.get(drawableId);
    if (drawable == null) {
      throw new IllegalArgumentException("No drawable " + drawableId);
    }
    return drawable;
  }

  private Attachment attached(DrawableBuffer buffer) {
    if (!(buffer instanceof Attachment)) {
      throw new IllegalArgumentException("Buffer was not attached by this store: " + buffer);
    }
    Attachment attachment = (Attachment) buffer;
    if (attachment.detached) {
      throw new IllegalStateException("Buffer already detached: " + buffer);
    }
    return attachment;
  }

  /**
   * Walks the grid cells covered by the source region, carrying the target
   * region along at the same offsets.
   */
  private final class GridIterator implements RegionIterator {
    private final PixelRegion source;
    private final PixelRegion target;
    private final List<Rectangle> cells = new ArrayList<>();
    private int index;
    private Tile sourceTile;
    private Tile targetTile;

    GridIterator(PixelRegion source, PixelRegion target) {
      this.source = source;
      this.target = target;
      Rectangle bounds = source.getBounds();
      int firstRow = Math.floorDiv(bounds.y(), tileSize) * tileSize;
      int firstColumn = Math.floorDiv(bounds.x(), tileSize) * tileSize;
      for (int y = firstRow; y < bounds.bottom(); y += tileSize) {
        for (int x = firstColumn; x < bounds.right(); x += tileSize) {
          Rectangle cell = new Rectangle(x, y, tileSize, tileSize).intersect(bounds);
          if (!cell.isEmpty()) {
            cells.add(cell);
          }
        }
      }
      load();
    }

    @Override
    public Tile source() {
      return sourceTile;
    }

    @Override
    public Tile target() {
      return targetTile;
    }

    @Override
    public boolean next() {
      if (isFinished()) {
        return false;
      }
      store(source, sourceTile);
      store(target, targetTile);
      index++;
      load();
      return !isFinished();
    }

    @Override
    public boolean isFinished() {
      return index >= cells.size();
    }

    private void load() {
      if (isFinished()) {
        sourceTile = null;
        targetTile = null;
        return;
      }
      Rectangle cell = cells.get(index);
      sourceTile = read(source, cell);
      Rectangle sourceBounds = source.getBounds();
      Rectangle targetBounds = target.getBounds();
      targetTile = read(target, new Rectangle(
          cell.x() - sourceBounds.x() + targetBounds.x(),
          cell.y() - sourceBounds.y() + targetBounds.y(),
          cell.width(), cell.height()));
    }

    private Tile read(PixelRegion region, Rectangle cell) {
      Drawable drawable = ((Attachment) region.getBuffer()).drawable;
      byte[] plane = planeOf(region, drawable);
      int bpp = drawable.bytesPerPixel;
      int rowStride = cell.width() * bpp;
      byte[] data = new byte[rowStride * cell.height()];
      for (int row = 0; row < cell.height(); row++) {
        int offset = ((cell.y() + row) * drawable.width + cell.x()) * bpp;
        System.arraycopy(plane, offset, data, row * rowStride, rowStride);
      }
      return new Tile(cell.x(), cell.y(), cell.width(), cell.height(), bpp, data);
    }

    private void store(PixelRegion region, Tile tile) {
      if (!region.isWritable()) {
        return;
      }
      Drawable drawable = ((Attachment) region.getBuffer()).drawable;
      byte[] plane = planeOf(region, drawable);
      int bpp = drawable.bytesPerPixel;
      int rowStride = tile.getRowStride();
      for (int row = 0; row < tile.getHeight(); row++) {
        int offset = ((tile.getY() + row) * drawable.width + tile.getX()) * bpp;
        System.arraycopy(tile.getData(), row * rowStride, plane, offset, rowStride);
      }
    }

    // A writable region whose shadow was merged away gets a fresh one.
    private byte[] planeOf(PixelRegion region, Drawable drawable) {
      if (!region.isWritable()) {
        return drawable.pixels;
      }
      if (drawable.shadow == null) {
        drawable.shadow = drawable.pixels.clone();
      }
      return drawable.shadow;
    }

    @Override
    public String toString() {
      return "GridIterator{cells=" + cells.size() + ", index=" + index + '}';
    }
  }

  @Override
  public String toString() {
    return "InMemoryPixelStore{tileSize=" + tileSize + ", drawables=" + Arrays.toString(
        drawables.keySet().toArray()) + '}';
  }
}
