package io.github.panghy.pdbbridge.pixel;

/**
 * The part of a region that one step of a {@link RegionIterator} exposes.
 *
 * <p>The data array holds {@code height} rows of {@code rowStride} bytes each and
 * is live: bytes written into the tile of a writable region are stored when the
 * iterator moves on.</p>
 */
public final class Tile {

  private final int x;
  private final int y;
  private final int width;
  private final int height;
  private final int bytesPerPixel;
  private final byte[] data;

  public Tile(int x, int y, int width, int height, int bytesPerPixel, byte[] data) {
    if (data.length != width * height * bytesPerPixel) {
      throw new IllegalArgumentException("Tile data holds " + data.length + " bytes, expected "
          + width * height * bytesPerPixel);
    }
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.bytesPerPixel = bytesPerPixel;
    this.data = data;
  }

  public int getX() {
    return x;
  }

  public int getY() {
    return y;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public int getBytesPerPixel() {
    return bytesPerPixel;
  }

  public int getRowStride() {
    return width * bytesPerPixel;
  }

  /**
   * Gets the number of bytes in the tile.
   *
   * @return rowStride times height
   */
  public int getSize() {
    return data.length;
  }

  /**
   * Gets the live pixel data.
   *
   * @return The tile's own array
   */
  public byte[] getData() {
    return data;
  }

  /**
   * Overwrites the first {@code size} bytes of this tile.
   *
   * @param source The bytes to copy
   * @param size   The number of bytes to copy
   */
  public void write(byte[] source, int size) {
    System.arraycopy(source, 0, data, 0, size);
  }

  public Rectangle getBounds() {
    return new Rectangle(x, y, width, height);
  }

  @Override
  public String toString() {
    return "Tile{" + x + "," + y + " " + width + "x" + height + "x" + bytesPerPixel + '}';
  }
}
