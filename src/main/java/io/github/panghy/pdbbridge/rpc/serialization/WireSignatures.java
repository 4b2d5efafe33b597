package io.github.panghy.pdbbridge.rpc.serialization;

import io.github.panghy.pdbbridge.pdb.ParamType;

import java.util.Optional;

/**
 * Maps registry type tags to the wire types that carry them.
 *
 * <p>Colors travel as packed 32-bit integers and host object ids as plain 32-bit
 * integers. 8-bit and 16-bit arrays travel in 32-bit slots and are narrowed on
 * the way in.</p>
 */
public final class WireSignatures {

  private WireSignatures() {
  }

  /**
   * Gets the wire type that carries values of a registry tag.
   *
   * @param type The registry tag
   * @return The wire type, or empty for tags the bridge cannot marshal
   */
  public static Optional<WireType> wireTypeOf(ParamType type) {
    WireType wireType = switch (type) {
      case INT32, DISPLAY, IMAGE, LAYER, CHANNEL, DRAWABLE, SELECTION, BOUNDARY, VECTORS, COLOR ->
          WireType.INT32;
      case INT16 -> WireType.INT16;
      case INT8 -> WireType.BYTE;
      case FLOAT -> WireType.DOUBLE;
      case STRING -> WireType.STRING;
      case INT32ARRAY, INT16ARRAY, INT8ARRAY -> WireType.INT32_ARRAY;
      case FLOATARRAY -> WireType.DOUBLE_ARRAY;
      case STRINGARRAY -> WireType.STRING_ARRAY;
      case REGION, PARASITE, STATUS -> null;
    };
    return Optional.ofNullable(wireType);
  }

  /**
   * Gets the wire type advertised for a registry tag in a published method
   * table. Tags without a wire form are advertised as 32-bit integers so that
   * every registry procedure can still be listed; calling such a procedure
   * fails in {@link ParamCodec}.
   *
   * @param type The registry tag
   * @return The advertised wire type
   */
  public static WireType publishedTypeOf(ParamType type) {
    return wireTypeOf(type).orElse(WireType.INT32);
  }
}
