package io.github.panghy.pdbbridge.pdb;

/**
 * An 8-bit-per-channel RGB color as the registry stores it.
 *
 * <p>On the wire a color is a single 32-bit integer with red in bits 16-23,
 * green in bits 8-15 and blue in bits 0-7; the top byte is always zero.</p>
 *
 * @param red   The red channel
 * @param green The green channel
 * @param blue  The blue channel
 */
public record RgbColor(int red, int green, int blue) {

  /**
   * Packs the three channels into the low 24 bits of an int. Each channel is
   * clamped to [0, 255] first.
   *
   * @return The packed color
   */
  public int pack() {
    return (clamp(red) << 16) | (clamp(green) << 8) | clamp(blue);
  }

  /**
   * Unpacks a color produced by {@link #pack()}. The upper 8 bits are ignored.
   *
   * @param packed The packed color
   * @return The color
   */
  public static RgbColor unpack(int packed) {
    return new RgbColor((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF);
  }

  /**
   * Builds a color from channel intensities in [0, 1], the way color-name
   * tables usually store them.
   *
   * @param red   The red intensity
   * @param green The green intensity
   * @param blue  The blue intensity
   * @return The color
   */
  public static RgbColor fromUnit(double red, double green, double blue) {
    return new RgbColor((int) (red * 255), (int) (green * 255), (int) (blue * 255));
  }

  private static int clamp(int channel) {
    return Math.max(0, Math.min(255, channel));
  }
}
