package io.github.panghy.pdbbridge.rpc.serialization;

import io.github.panghy.pdbbridge.pdb.Param;
import io.github.panghy.pdbbridge.pdb.ParamDef;
import io.github.panghy.pdbbridge.pdb.ParamType;
import io.github.panghy.pdbbridge.pdb.RgbColor;
import io.github.panghy.pdbbridge.pdb.Signature;
import io.github.panghy.pdbbridge.rpc.error.EncodeFailedException;
import io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException;
import io.github.panghy.pdbbridge.rpc.error.TypeMismatchException;
import io.github.panghy.pdbbridge.rpc.error.UnsupportedTypeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

import static io.github.panghy.pdbbridge.util.LoggingUtil.debug;

/**
 * Converts between wire values and registry params.
 *
 * <p>Single values are converted by {@link #decode} and {@link #encode}. Whole
 * parameter lists are converted by {@link #decodeAll} and {@link #encodeAll},
 * which walk a {@link Signature} and the values side by side and apply the
 * registry's array convention: the entry right before an array holds the
 * array's element count. An array in position 0 has no count and is rejected
 * in both directions.</p>
 *
 * <p>Every conversion is all-or-nothing. A failure throws before any result
 * list is handed back, and the codec never allocates anything but fresh
 * parameter arrays, so there is nothing to clean up.</p>
 *
 * <p>The codec keeps no state and may be shared.</p>
 */
public class ParamCodec {

  private static final Logger LOGGER = Logger.getLogger(ParamCodec.class.getName());

  /**
   * Decodes one wire value against its formal parameter.
   *
   * @param value    The wire value
   * @param def      The formal parameter
   * @param position The argument index, for error reporting
   * @return A new param
   * @throws UnsupportedTypeException if the formal type has no wire form
   * @throws TypeMismatchException    if the wire type is not the one the formal type requires
   */
  public Param decode(WireValue value, ParamDef def, int position) {
    ParamType type = def.type();
    WireType expected = WireSignatures.wireTypeOf(type)
        .orElseThrow(() -> new UnsupportedTypeException(position, type));
    if (value.getType() != expected) {
      throw new TypeMismatchException(position, expected, value.getType());
    }

    return switch (type) {
      case INT32, DISPLAY, IMAGE, LAYER, CHANNEL, DRAWABLE, SELECTION, BOUNDARY, VECTORS ->
          new Param.IntParam(type, value.asInt32());
      case INT16 -> new Param.Int16Param(value.asInt16());
      case INT8 -> new Param.Int8Param(value.asByte());
      case FLOAT -> new Param.FloatParam(value.asDouble());
      case STRING -> new Param.StringParam(value.asString());
      case COLOR -> new Param.ColorParam(RgbColor.unpack(value.asInt32()));
      case INT32ARRAY -> new Param.Int32ArrayParam(value.asInt32Array().clone());
      case INT16ARRAY -> new Param.Int16ArrayParam(narrowToShorts(value.asInt32Array()));
      case INT8ARRAY -> new Param.Int8ArrayParam(narrowToBytes(value.asInt32Array()));
      case FLOATARRAY -> new Param.FloatArrayParam(value.asDoubleArray().clone());
      case STRINGARRAY -> new Param.StringArrayParam(value.asStringArray().clone());
      case REGION, PARASITE, STATUS -> throw new UnsupportedTypeException(position, type);
    };
  }

  /**
   * Encodes one param.
   *
   * @param param    The param
   * @param count    For array params, the number of leading elements to send;
   *                 ignored otherwise
   * @param position The return value index, for error reporting
   * @return A wire value whose type is exactly the one the param's tag maps to
   * @throws EncodeFailedException if the tag has no wire form or the count is out of range
   */
  public WireValue encode(Param param, int count, int position) {
    ParamType type = param.type();
    if (type.isArray()) {
      int length = arrayLength(param);
      if (count < 0 || count > length) {
        throw new EncodeFailedException(position,
            "return value " + position + " claims " + count + " elements but holds " + length);
      }
    }

    return switch (type) {
      case INT32, DISPLAY, IMAGE, LAYER, CHANNEL, DRAWABLE, SELECTION, BOUNDARY, VECTORS ->
          WireValue.int32(((Param.IntParam) param).value());
      case INT16 -> WireValue.int16(((Param.Int16Param) param).value());
      case INT8 -> WireValue.byteValue(((Param.Int8Param) param).value());
      case FLOAT -> WireValue.float64(((Param.FloatParam) param).value());
      case STRING -> WireValue.string(((Param.StringParam) param).value());
      case COLOR -> WireValue.int32(((Param.ColorParam) param).color().pack());
      case INT32ARRAY -> WireValue.int32Array(Arrays.copyOf(((Param.Int32ArrayParam) param).values(), count));
      case INT16ARRAY -> WireValue.int32Array(widenShorts(((Param.Int16ArrayParam) param).values(), count));
      case INT8ARRAY -> WireValue.int32Array(widenBytes(((Param.Int8ArrayParam) param).values(), count));
      case FLOATARRAY -> WireValue.doubleArray(Arrays.copyOf(((Param.FloatArrayParam) param).values(), count));
      case STRINGARRAY -> WireValue.stringArray(copyStrings(((Param.StringArrayParam) param).values(), count,
          position));
      case REGION, PARASITE, STATUS -> throw new EncodeFailedException(position,
          "return value " + position + " has type " + type + ", which cannot be sent");
    };
  }

  /**
   * Decodes a full argument list against a formal signature.
   *
   * @param methodName The method being called, for error reporting
   * @param formals    The formal signature
   * @param values     The wire arguments, in order
   * @return The decoded params, in order
   * @throws InvalidArgumentException if the count differs, an argument does not
   *                                  match, or the array convention is violated
   */
  public List<Param> decodeAll(String methodName, Signature formals, List<WireValue> values) {
    if (values.size() != formals.size()) {
      throw new InvalidArgumentException(formals.size() == 1
          ? methodName + " expects 1 parameter, received " + values.size()
          : methodName + " expects " + formals.size() + " parameters, received " + values.size());
    }

    List<Param> params = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      ParamDef def = formals.get(i);
      if (def.type().isArray() && i == 0) {
        throw new InvalidArgumentException(
            "array parameter 0 ('" + def.name() + "') has no preceding element count", 0);
      }
      Param param = decode(values.get(i), def, i);
      if (def.type().isArray()) {
        int length = arrayLength(param);
        OptionalInt count = countOf(params.get(i - 1));
        if (count.isEmpty()) {
          throw new InvalidArgumentException(
              "parameter " + (i - 1) + " must hold the element count of array parameter " + i, i);
        }
        if (count.getAsInt() != length) {
          throw new InvalidArgumentException("array parameter " + i + " has " + length
              + " elements but parameter " + (i - 1) + " says " + count.getAsInt(), i);
        }
      }
      debug(LOGGER, "  parameter '" + def.name() + "' is " + param);
      params.add(param);
    }
    return Collections.unmodifiableList(params);
  }

  /**
   * Encodes a full return value list. The status entry must already have been
   * removed.
   *
   * @param returns The return signature
   * @param values  The return values, in order
   * @return The wire values, in order
   * @throws EncodeFailedException if any value cannot be encoded
   */
  public List<WireValue> encodeAll(Signature returns, List<Param> values) {
    if (values.size() != returns.size()) {
      throw new EncodeFailedException(Math.min(values.size(), returns.size()),
          "procedure declares " + returns.size() + " return values but produced " + values.size());
    }

    List<WireValue> wireValues = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      Param param = values.get(i);
      ParamType declared = returns.get(i).type();
      if (!WireSignatures.wireTypeOf(declared).equals(WireSignatures.wireTypeOf(param.type()))) {
        throw new EncodeFailedException(i,
            "return value " + i + " is " + param.type() + " but is declared " + declared);
      }
      int count = 0;
      if (param.type().isArray()) {
        if (i == 0) {
          throw new EncodeFailedException(0, "array return value 0 has no preceding element count");
        }
        OptionalInt preceding = countOf(values.get(i - 1));
        if (preceding.isEmpty()) {
          throw new EncodeFailedException(i,
              "return value " + (i - 1) + " must hold the element count of array return value " + i);
        }
        count = preceding.getAsInt();
      }
      wireValues.add(encode(param, count, i));
    }
    return Collections.unmodifiableList(wireValues);
  }

  private static OptionalInt countOf(Param param) {
    if (param instanceof Param.IntParam) {
      return OptionalInt.of(((Param.IntParam) param).value());
    } else if (param instanceof Param.Int16Param) {
      return OptionalInt.of(((Param.Int16Param) param).value());
    } else if (param instanceof Param.Int8Param) {
      return OptionalInt.of(((Param.Int8Param) param).unsignedValue());
    }
    return OptionalInt.empty();
  }

  private static int arrayLength(Param param) {
    if (param instanceof Param.Int32ArrayParam) {
      return ((Param.Int32ArrayParam) param).values().length;
    } else if (param instanceof Param.Int16ArrayParam) {
      return ((Param.Int16ArrayParam) param).values().length;
    } else if (param instanceof Param.Int8ArrayParam) {
      return ((Param.Int8ArrayParam) param).values().length;
    } else if (param instanceof Param.FloatArrayParam) {
      return ((Param.FloatArrayParam) param).values().length;
    } else if (param instanceof Param.StringArrayParam) {
      return ((Param.StringArrayParam) param).values().length;
    }
    throw new IllegalArgumentException("Not an array param: " + param.type());
  }

  private static short[] narrowToShorts(int[] source) {
    short[] target = new short[source.length];
    for (int i = 0; i < source.length; i++) {
      target[i] = (short) source[i];
    }
    return target;
  }

  private static byte[] narrowToBytes(int[] source) {
    byte[] target = new byte[source.length];
    for (int i = 0; i < source.length; i++) {
      target[i] = (byte) source[i];
    }
    return target;
  }

  // The bus has no null string.
  private static String[] copyStrings(String[] source, int count, int position) {
    String[] target = Arrays.copyOf(source, count);
    for (int i = 0; i < count; i++) {
      if (target[i] == null) {
        throw new EncodeFailedException(position,
            "return value " + position + " holds a null string at element " + i);
      }
    }
    return target;
  }

  private static int[] widenShorts(short[] source, int count) {
    int[] target = new int[count];
    for (int i = 0; i < count; i++) {
      target[i] = source[i];
    }
    return target;
  }

  // Bytes are unsigned on the registry side.
  private static int[] widenBytes(byte[] source, int count) {
    int[] target = new int[count];
    for (int i = 0; i < count; i++) {
      target[i] = source[i] & 0xFF;
    }
    return target;
  }
}
