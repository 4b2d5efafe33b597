package io.github.panghy.pdbbridge.pixel;

/**
 * An axis-aligned rectangle in drawable coordinates.
 *
 * @param x      The left edge
 * @param y      The top edge
 * @param width  The width, never negative
 * @param height The height, never negative
 */
public record Rectangle(int x, int y, int width, int height) {

  public Rectangle {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("Negative size: " + width + "x" + height);
    }
  }

  public boolean isEmpty() {
    return width == 0 || height == 0;
  }

  /**
   * Gets the right edge, exclusive. Saturates at {@link Integer#MAX_VALUE}.
   *
   * @return The right edge
   */
  public int right() {
    return saturate((long) x + width);
  }

  /**
   * Gets the bottom edge, exclusive. Saturates at {@link Integer#MAX_VALUE}.
   *
   * @return The bottom edge
   */
  public int bottom() {
    return saturate((long) y + height);
  }

  /**
   * Computes the overlap of two rectangles.
   *
   * @param other The other rectangle
   * @return The overlap; empty (at this rectangle's origin) when they do not overlap
   */
  public Rectangle intersect(Rectangle other) {
    long left = Math.max(x, other.x);
    long top = Math.max(y, other.y);
    long right = Math.min((long) x + width, (long) other.x + other.width);
    long bottom = Math.min((long) y + height, (long) other.y + other.height);
    if (right <= left || bottom <= top) {
      return new Rectangle(x, y, 0, 0);
    }
    return new Rectangle((int) left, (int) top, saturate(right - left), saturate(bottom - top));
  }

  public boolean contains(Rectangle other) {
    return other.x >= x && other.y >= y
        && (long) other.x + other.width <= (long) x + width
        && (long) other.y + other.height <= (long) y + height;
  }

  private static int saturate(long value) {
    return (int) Math.min(Integer.MAX_VALUE, value);
  }
}
