package io.github.panghy.pdbbridge.rpc.serialization;

import java.util.Arrays;
import java.util.Objects;

/**
 * A self-describing value as it travels on the message bus.
 *
 * <p>A WireValue always knows its {@link WireType}; the typed accessors refuse to
 * read a payload of another type. Array payloads are held by reference, so a
 * caller that keeps mutating an array after wrapping it will see the change.</p>
 */
public final class WireValue {

  private final WireType type;
  private final Object value;

  private WireValue(WireType type, Object value) {
    this.type = type;
    this.value = Objects.requireNonNull(value, "Wire value cannot be null");
  }

  public static WireValue bool(boolean value) {
    return new WireValue(WireType.BOOLEAN, value);
  }

  public static WireValue byteValue(byte value) {
    return new WireValue(WireType.BYTE, value);
  }

  public static WireValue int16(short value) {
    return new WireValue(WireType.INT16, value);
  }

  public static WireValue int32(int value) {
    return new WireValue(WireType.INT32, value);
  }

  public static WireValue float64(double value) {
    return new WireValue(WireType.DOUBLE, value);
  }

  public static WireValue string(String value) {
    return new WireValue(WireType.STRING, value);
  }

  public static WireValue byteArray(byte[] values) {
    return new WireValue(WireType.BYTE_ARRAY, values);
  }

  public static WireValue int16Array(short[] values) {
    return new WireValue(WireType.INT16_ARRAY, values);
  }

  public static WireValue int32Array(int[] values) {
    return new WireValue(WireType.INT32_ARRAY, values);
  }

  public static WireValue doubleArray(double[] values) {
    return new WireValue(WireType.DOUBLE_ARRAY, values);
  }

  public static WireValue stringArray(String[] values) {
    return new WireValue(WireType.STRING_ARRAY, values);
  }

  public WireType getType() {
    return type;
  }

  public boolean asBoolean() {
    return (Boolean) payload(WireType.BOOLEAN);
  }

  public byte asByte() {
    return (Byte) payload(WireType.BYTE);
  }

  public short asInt16() {
    return (Short) payload(WireType.INT16);
  }

  public int asInt32() {
    return (Integer) payload(WireType.INT32);
  }

  public double asDouble() {
    return (Double) payload(WireType.DOUBLE);
  }

  public String asString() {
    return (String) payload(WireType.STRING);
  }

  public byte[] asByteArray() {
    return (byte[]) payload(WireType.BYTE_ARRAY);
  }

  public short[] asInt16Array() {
    return (short[]) payload(WireType.INT16_ARRAY);
  }

  public int[] asInt32Array() {
    return (int[]) payload(WireType.INT32_ARRAY);
  }

  public double[] asDoubleArray() {
    return (double[]) payload(WireType.DOUBLE_ARRAY);
  }

  public String[] asStringArray() {
    return (String[]) payload(WireType.STRING_ARRAY);
  }

  /**
   * Gets the element count of an array value.
   *
   * @return The number of elements
   * @throws IllegalStateException if this is not an array
   */
  public int length() {
    switch (type) {
      case BYTE_ARRAY:
        return ((byte[]) value).length;
      case INT16_ARRAY:
        return ((short[]) value).length;
      case INT32_ARRAY:
        return ((int[]) value).length;
      case DOUBLE_ARRAY:
        return ((double[]) value).length;
      case STRING_ARRAY:
        return ((String[]) value).length;
      default:
        throw new IllegalStateException("Not an array: " + type);
    }
  }

  private Object payload(WireType expected) {
    if (type != expected) {
      throw new IllegalStateException("Wire value is " + type + ", not " + expected);
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WireValue)) {
      return false;
    }
    WireValue other = (WireValue) o;
    return type == other.type && Objects.deepEquals(value, other.value);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + Arrays.deepHashCode(new Object[]{value});
  }

  @Override
  public String toString() {
    String rendered = type.isArray() ? Arrays.deepToString(new Object[]{value}) : String.valueOf(value);
    if (type.isArray()) {
      rendered = rendered.substring(1, rendered.length() - 1);
    }
    return type.getSignature() + ":" + rendered;
  }
}
