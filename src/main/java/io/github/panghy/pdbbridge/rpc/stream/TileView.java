package io.github.panghy.pdbbridge.rpc.stream;

import java.util.Arrays;

/**
 * A snapshot of the current tile of a stream, as handed to callers.
 *
 * @param x             The left edge in drawable coordinates
 * @param y             The top edge in drawable coordinates
 * @param width         The width in pixels
 * @param height        The height in pixels
 * @param rowStride     The number of bytes per row
 * @param bytesPerPixel The number of bytes per pixel
 * @param index         The number of times the stream has been advanced
 * @param data          A copy of the tile's pixels, rowStride * height bytes
 */
public record TileView(int x, int y, int width, int height, int rowStride, int bytesPerPixel, int index,
                       byte[] data) {

  /**
   * Gets the number of bytes an update of this tile must supply.
   *
   * @return rowStride times height
   */
  public int size() {
    return rowStride * height;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TileView)) {
      return false;
    }
    TileView that = (TileView) o;
    return x == that.x && y == that.y && width == that.width && height == that.height
        && rowStride == that.rowStride && bytesPerPixel == that.bytesPerPixel && index == that.index
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    int result = 31 * x + y;
    result = 31 * result + width;
    result = 31 * result + height;
    result = 31 * result + index;
    return 31 * result + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "TileView{" +
        "x=" + x +
        ", y=" + y +
        ", width=" + width +
        ", height=" + height +
        ", rowStride=" + rowStride +
        ", bytesPerPixel=" + bytesPerPixel +
        ", index=" + index +
        ", size=" + data.length +
        '}';
  }
}
