package io.github.panghy.pdbbridge.pdb;

/**
 * The closed set of type tags the procedure registry uses for arguments and
 * return values. Numeric codes follow the registry's own enumeration.
 */
public enum ParamType {
  INT32(0),
  INT16(1),
  INT8(2),
  FLOAT(3),
  STRING(4),
  INT32ARRAY(5),
  INT16ARRAY(6),
  INT8ARRAY(7),
  FLOATARRAY(8),
  STRINGARRAY(9),
  COLOR(10),
  REGION(11),
  DISPLAY(12),
  IMAGE(13),
  LAYER(14),
  CHANNEL(15),
  DRAWABLE(16),
  SELECTION(17),
  BOUNDARY(18),
  VECTORS(19),
  PARASITE(20),
  STATUS(21);

  private final int code;

  ParamType(int code) {
    this.code = code;
  }

  /**
   * Gets the registry's numeric code for this tag.
   *
   * @return The code
   */
  public int getCode() {
    return code;
  }

  /**
   * Whether values of this tag are arrays whose length travels in the
   * preceding entry of a parameter list.
   *
   * @return true for the five array tags
   */
  public boolean isArray() {
    return this == INT32ARRAY || this == INT16ARRAY || this == INT8ARRAY
        || this == FLOATARRAY || this == STRINGARRAY;
  }

  /**
   * Whether values of this tag are host object ids carried as 32-bit integers.
   *
   * @return true for display, image, layer, channel, drawable, selection,
   *         boundary and vectors
   */
  public boolean isObjectId() {
    switch (this) {
      case DISPLAY:
      case IMAGE:
      case LAYER:
      case CHANNEL:
      case DRAWABLE:
      case SELECTION:
      case BOUNDARY:
      case VECTORS:
        return true;
      default:
        return false;
    }
  }

  /**
   * Gets a ParamType from its numeric code.
   *
   * @param code The numeric code
   * @return The matching tag
   * @throws IllegalArgumentException if no tag has that code
   */
  public static ParamType fromCode(int code) {
    for (ParamType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown parameter type code: " + code);
  }
}
