package io.github.panghy.pdbbridge.pixel;

/**
 * A drawable attached for pixel access. Obtained from
 * {@link PixelStore#attach(int)} and released with {@link PixelStore#detach(DrawableBuffer)}.
 */
public interface DrawableBuffer {

  int getDrawableId();

  int getWidth();

  int getHeight();

  int getBytesPerPixel();

  /**
   * Gets the full extent of the drawable.
   *
   * @return A rectangle at the origin covering the drawable
   */
  default Rectangle getBounds() {
    return new Rectangle(0, 0, getWidth(), getHeight());
  }
}
