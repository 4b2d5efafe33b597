package io.github.panghy.pdbbridge.pdb.procedures;

import io.github.panghy.pdbbridge.pdb.RgbColor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The SVG/CSS color keywords, and a parser for color names and hex notations.
 */
public final class NamedColors {

  private static final Map<String, Integer> COLORS = new LinkedHashMap<>();

  static {
    add("aliceblue", 0xF0F8FF);
    add("antiquewhite", 0xFAEBD7);
    add("aqua", 0x00FFFF);
    add("aquamarine", 0x7FFFD4);
    add("azure", 0xF0FFFF);
    add("beige", 0xF5F5DC);
    add("bisque", 0xFFE4C4);
    add("black", 0x000000);
    add("blanchedalmond", 0xFFEBCD);
    add("blue", 0x0000FF);
    add("blueviolet", 0x8A2BE2);
    add("brown", 0xA52A2A);
    add("burlywood", 0xDEB887);
    add("cadetblue", 0x5F9EA0);
    add("chartreuse", 0x7FFF00);
    add("chocolate", 0xD2691E);
    add("coral", 0xFF7F50);
    add("cornflowerblue", 0x6495ED);
    add("cornsilk", 0xFFF8DC);
    add("crimson", 0xDC143C);
    add("cyan", 0x00FFFF);
    add("darkblue", 0x00008B);
    add("darkcyan", 0x008B8B);
    add("darkgoldenrod", 0xB8860B);
    add("darkgray", 0xA9A9A9);
    add("darkgreen", 0x006400);
    add("darkgrey", 0xA9A9A9);
    add("darkkhaki", 0xBDB76B);
    add("darkmagenta", 0x8B008B);
    add("darkolivegreen", 0x556B2F);
    add("darkorange", 0xFF8C00);
    add("darkorchid", 0x9932CC);
    add("darkred", 0x8B0000);
    add("darksalmon", 0xE9967A);
    add("darkseagreen", 0x8FBC8F);
    add("darkslateblue", 0x483D8B);
    add("darkslategray", 0x2F4F4F);
    add("darkslategrey", 0x2F4F4F);
    add("darkturquoise", 0x00CED1);
    add("darkviolet", 0x9400D3);
    add("deeppink", 0xFF1493);
    add("deepskyblue", 0x00BFFF);
    add("dimgray", 0x696969);
    add("dimgrey", 0x696969);
    add("dodgerblue", 0x1E90FF);
    add("firebrick", 0xB22222);
    add("floralwhite", 0xFFFAF0);
    add("forestgreen", 0x228B22);
    add("fuchsia", 0xFF00FF);
    add("gainsboro", 0xDCDCDC);
    add("ghostwhite", 0xF8F8FF);
    add("gold", 0xFFD700);
    add("goldenrod", 0xDAA520);
    add("gray", 0x808080);
    add("green", 0x008000);
    add("greenyellow", 0xADFF2F);
    add("grey", 0x808080);
    add("honeydew", 0xF0FFF0);
    add("hotpink", 0xFF69B4);
    add("indianred", 0xCD5C5C);
    add("indigo", 0x4B0082);
    add("ivory", 0xFFFFF0);
    add("khaki", 0xF0E68C);
    add("lavender", 0xE6E6FA);
    add("lavenderblush", 0xFFF0F5);
    add("lawngreen", 0x7CFC00);
    add("lemonchiffon", 0xFFFACD);
    add("lightblue", 0xADD8E6);
    add("lightcoral", 0xF08080);
    add("lightcyan", 0xE0FFFF);
    add("lightgoldenrodyellow", 0xFAFAD2);
    add("lightgray", 0xD3D3D3);
    add("lightgreen", 0x90EE90);
    add("lightgrey", 0xD3D3D3);
    add("lightpink", 0xFFB6C1);
    add("lightsalmon", 0xFFA07A);
    add("lightseagreen", 0x20B2AA);
    add("lightskyblue", 0x87CEFA);
    add("lightslategray", 0x778899);
    add("lightslategrey", 0x778899);
    add("lightsteelblue", 0xB0C4DE);
    add("lightyellow", 0xFFFFE0);
    add("lime", 0x00FF00);
    add("limegreen", 0x32CD32);
    add("linen", 0xFAF0E6);
    add("magenta", 0xFF00FF);
    add("maroon", 0x800000);
    add("mediumaquamarine", 0x66CDAA);
    add("mediumblue", 0x0000CD);
    add("mediumorchid", 0xBA55D3);
    add("mediumpurple", 0x9370DB);
    add("mediumseagreen", 0x3CB371);
    add("mediumslateblue", 0x7B68EE);
    add("mediumspringgreen", 0x00FA9A);
    add("mediumturquoise", 0x48D1CC);
    add("mediumvioletred", 0xC71585);
    add("midnightblue", 0x191970);
    add("mintcream", 0xF5FFFA);
    add("mistyrose", 0xFFE4E1);
    add("moccasin", 0xFFE4B5);
    add("navajowhite", 0xFFDEAD);
    add("navy", 0x000080);
    add("oldlace", 0xFDF5E6);
    add("olive", 0x808000);
    add("olivedrab", 0x6B8E23);
    add("orange", 0xFFA500);
    add("orangered", 0xFF4500);
    add("orchid", 0xDA70D6);
    add("palegoldenrod", 0xEEE8AA);
    add("palegreen", 0x98FB98);
    add("paleturquoise", 0xAFEEEE);
    add("palevioletred", 0xDB7093);
    add("papayawhip", 0xFFEFD5);
    add("peachpuff", 0xFFDAB9);
    add("peru", 0xCD853F);
    add("pink", 0xFFC0CB);
    add("plum", 0xDDA0DD);
    add("powderblue", 0xB0E0E6);
    add("purple", 0x800080);
    add("red", 0xFF0000);
    add("rosybrown", 0xBC8F8F);
    add("royalblue", 0x4169E1);
    add("saddlebrown", 0x8B4513);
    add("salmon", 0xFA8072);
    add("sandybrown", 0xF4A460);
    add("seagreen", 0x2E8B57);
    add("seashell", 0xFFF5EE);
    add("sienna", 0xA0522D);
    add("silver", 0xC0C0C0);
    add("skyblue", 0x87CEEB);
    add("slateblue", 0x6A5ACD);
    add("slategray", 0x708090);
    add("slategrey", 0x708090);
    add("snow", 0xFFFAFA);
    add("springgreen", 0x00FF7F);
    add("steelblue", 0x4682B4);
    add("tan", 0xD2B48C);
    add("teal", 0x008080);
    add("thistle", 0xD8BFD8);
    add("tomato", 0xFF6347);
    add("turquoise", 0x40E0D0);
    add("violet", 0xEE82EE);
    add("wheat", 0xF5DEB3);
    add("white", 0xFFFFFF);
    add("whitesmoke", 0xF5F5F5);
    add("yellow", 0xFFFF00);
    add("yellowgreen", 0x9ACD32);
  }

  private NamedColors() {
  }

  private static void add(String name, int packed) {
    COLORS.put(name, packed);
  }

  /**
   * Gets every known color name, in alphabetical order.
   *
   * @return The names
   */
  public static String[] names() {
    return COLORS.keySet().toArray(new String[0]);
  }

  public static Map<String, Integer> asMap() {
    return Collections.unmodifiableMap(COLORS);
  }

  /**
   * Parses a color. Accepts a color keyword in any case, {@code #rgb} and
   * {@code #rrggbb}. Surrounding whitespace is ignored.
   *
   * @param text The color text
   * @return The color, or empty if the text is not a color
   */
  public static Optional<RgbColor> parse(String text) {
    String trimmed = text.trim().toLowerCase(Locale.ROOT);
    if (trimmed.startsWith("#")) {
      return parseHex(trimmed.substring(1));
    }
    Integer packed = COLORS.get(trimmed);
    return packed == null ? Optional.empty() : Optional.of(RgbColor.unpack(packed));
  }

  private static Optional<RgbColor> parseHex(String digits) {
    for (int i = 0; i < digits.length(); i++) {
      if (Character.digit(digits.charAt(i), 16) < 0) {
        return Optional.empty();
      }
    }
    if (digits.length() == 3) {
      int r = Character.digit(digits.charAt(0), 16);
      int g = Character.digit(digits.charAt(1), 16);
      int b = Character.digit(digits.charAt(2), 16);
      return Optional.of(new RgbColor(r * 17, g * 17, b * 17));
    }
    if (digits.length() == 6) {
      return Optional.of(RgbColor.unpack(Integer.parseInt(digits, 16)));
    }
    return Optional.empty();
  }
}
