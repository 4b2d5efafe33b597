package io.github.panghy.pdbbridge.pdb;

import java.util.Arrays;
import java.util.Objects;

/**
 * A tagged registry value: one argument or one return value of a procedure call.
 *
 * <p>Each implementation carries exactly one payload and reports its tag through
 * {@link #type()}. Array values carry their own length; the registry's convention
 * of passing the length in the preceding list entry is applied only when a whole
 * parameter list is converted to or from the wire.</p>
 *
 * <p>Params are created fresh for every call and belong to that call alone.</p>
 */
public sealed interface Param permits
    Param.IntParam,
    Param.Int16Param,
    Param.Int8Param,
    Param.FloatParam,
    Param.StringParam,
    Param.ColorParam,
    Param.StatusParam,
    Param.Int32ArrayParam,
    Param.Int16ArrayParam,
    Param.Int8ArrayParam,
    Param.FloatArrayParam,
    Param.StringArrayParam,
    Param.OpaqueParam {

  /**
   * Gets the type tag of this value.
   *
   * @return The tag
   */
  ParamType type();

  static Param int32(int value) {
    return new IntParam(ParamType.INT32, value);
  }

  /**
   * Creates a host object id, such as an image or drawable reference.
   *
   * @param type  An object-id tag
   * @param value The id
   * @return The param
   */
  static Param objectId(ParamType type, int value) {
    return new IntParam(type, value);
  }

  static Param int16(short value) {
    return new Int16Param(value);
  }

  static Param int8(byte value) {
    return new Int8Param(value);
  }

  static Param floatValue(double value) {
    return new FloatParam(value);
  }

  static Param string(String value) {
    return new StringParam(value);
  }

  static Param color(RgbColor value) {
    return new ColorParam(value);
  }

  static Param status(CallStatus status) {
    return new StatusParam(status);
  }

  /**
   * A 32-bit integer or an integer-valued object id.
   */
  record IntParam(ParamType type, int value) implements Param {
    public IntParam {
      if (type != ParamType.INT32 && !type.isObjectId()) {
        throw new IllegalArgumentException("Not an integer type: " + type);
      }
    }
  }

  record Int16Param(short value) implements Param {
    @Override
    public ParamType type() {
      return ParamType.INT16;
    }
  }

  /**
   * An 8-bit value. The registry treats it as unsigned.
   */
  record Int8Param(byte value) implements Param {
    @Override
    public ParamType type() {
      return ParamType.INT8;
    }

    public int unsignedValue() {
      return value & 0xFF;
    }
  }

  record FloatParam(double value) implements Param {
    @Override
    public ParamType type() {
      return ParamType.FLOAT;
    }
  }

  record StringParam(String value) implements Param {
    public StringParam {
      Objects.requireNonNull(value, "String value cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.STRING;
    }
  }

  record ColorParam(RgbColor color) implements Param {
    public ColorParam {
      Objects.requireNonNull(color, "Color cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.COLOR;
    }
  }

  /**
   * The status entry at the head of every result list.
   */
  record StatusParam(CallStatus status) implements Param {
    public StatusParam {
      Objects.requireNonNull(status, "Status cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.STATUS;
    }
  }

  record Int32ArrayParam(int[] values) implements Param {
    public Int32ArrayParam {
      Objects.requireNonNull(values, "Array cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.INT32ARRAY;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Int32ArrayParam && Arrays.equals(values, ((Int32ArrayParam) o).values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "Int32ArrayParam" + Arrays.toString(values);
    }
  }

  record Int16ArrayParam(short[] values) implements Param {
    public Int16ArrayParam {
      Objects.requireNonNull(values, "Array cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.INT16ARRAY;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Int16ArrayParam && Arrays.equals(values, ((Int16ArrayParam) o).values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "Int16ArrayParam" + Arrays.toString(values);
    }
  }

  record Int8ArrayParam(byte[] values) implements Param {
    public Int8ArrayParam {
      Objects.requireNonNull(values, "Array cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.INT8ARRAY;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Int8ArrayParam && Arrays.equals(values, ((Int8ArrayParam) o).values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "Int8ArrayParam" + Arrays.toString(values);
    }
  }

  record FloatArrayParam(double[] values) implements Param {
    public FloatArrayParam {
      Objects.requireNonNull(values, "Array cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.FLOATARRAY;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof FloatArrayParam && Arrays.equals(values, ((FloatArrayParam) o).values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "FloatArrayParam" + Arrays.toString(values);
    }
  }

  record StringArrayParam(String[] values) implements Param {
    public StringArrayParam {
      Objects.requireNonNull(values, "Array cannot be null");
    }

    @Override
    public ParamType type() {
      return ParamType.STRINGARRAY;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof StringArrayParam && Arrays.equals(values, ((StringArrayParam) o).values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "StringArrayParam" + Arrays.toString(values);
    }
  }

  /**
   * A value of a kind the bridge cannot marshal (regions, parasites). The
   * registry may still hand these back; converting one to the wire fails.
   */
  record OpaqueParam(ParamType type, Object payload) implements Param {
    public OpaqueParam {
      if (type != ParamType.REGION && type != ParamType.PARASITE) {
        throw new IllegalArgumentException("Not an opaque type: " + type);
      }
    }
  }
}
