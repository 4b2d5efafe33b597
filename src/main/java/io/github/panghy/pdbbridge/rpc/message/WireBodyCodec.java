package io.github.panghy.pdbbridge.rpc.message;

import io.github.panghy.pdbbridge.rpc.serialization.WireType;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encodes the body of a bus message.
 *
 * <p>A body starts with its type signature, the concatenated signature codes of
 * its values (for example {@code "iais"}), followed by the values themselves in
 * big-endian order. Strings are a 4-byte length and UTF-8 bytes; arrays are a
 * 4-byte element count followed by the elements.</p>
 */
public final class WireBodyCodec {

  private WireBodyCodec() {
  }

  /**
   * Computes the type signature of a body.
   *
   * @param values The body values
   * @return The concatenated signature codes
   */
  public static String signatureOf(List<WireValue> values) {
    StringBuilder signature = new StringBuilder();
    for (WireValue value : values) {
      signature.append(value.getType().getSignature());
    }
    return signature.toString();
  }

  /**
   * Encodes a body.
   *
   * @param values The body values
   * @return A buffer ready for reading
   * @throws IllegalArgumentException if a string in the body is null
   */
  public static ByteBuffer encode(List<WireValue> values) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      byte[] signature = signatureOf(values).getBytes(StandardCharsets.US_ASCII);
      out.writeShort(signature.length);
      out.write(signature);
      for (WireValue value : values) {
        writeValue(out, value);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode message body", e);
    }
    return ByteBuffer.wrap(bytes.toByteArray());
  }

  /**
   * Decodes a body.
   *
   * @param buffer The encoded body
   * @return The body values, in order
   * @throws IllegalArgumentException if the body is malformed
   */
  public static List<WireValue> decode(ByteBuffer buffer) {
    try {
      byte[] signatureBytes = new byte[buffer.getShort()];
      buffer.get(signatureBytes);
      String signature = new String(signatureBytes, StandardCharsets.US_ASCII);

      List<WireValue> values = new ArrayList<>();
      int i = 0;
      while (i < signature.length()) {
        int end = signature.charAt(i) == 'a' ? i + 2 : i + 1;
        if (end > signature.length()) {
          throw new IllegalArgumentException("Truncated body signature: " + signature);
        }
        values.add(readValue(buffer, WireType.fromSignature(signature.substring(i, end))));
        i = end;
      }
      if (buffer.hasRemaining()) {
        throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after body");
      }
      return Collections.unmodifiableList(values);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated message body", e);
    }
  }

  private static void writeValue(DataOutputStream out, WireValue value) throws IOException {
    switch (value.getType()) {
      case BOOLEAN -> out.writeBoolean(value.asBoolean());
      case BYTE -> out.writeByte(value.asByte());
      case INT16 -> out.writeShort(value.asInt16());
      case INT32 -> out.writeInt(value.asInt32());
      case DOUBLE -> out.writeDouble(value.asDouble());
      case STRING -> writeString(out, value.asString());
      case BYTE_ARRAY -> {
        byte[] array = value.asByteArray();
        out.writeInt(array.length);
        out.write(array);
      }
      case INT16_ARRAY -> {
        short[] array = value.asInt16Array();
        out.writeInt(array.length);
        for (short element : array) {
          out.writeShort(element);
        }
      }
      case INT32_ARRAY -> {
        int[] array = value.asInt32Array();
        out.writeInt(array.length);
        for (int element : array) {
          out.writeInt(element);
        }
      }
      case DOUBLE_ARRAY -> {
        double[] array = value.asDoubleArray();
        out.writeInt(array.length);
        for (double element : array) {
          out.writeDouble(element);
        }
      }
      case STRING_ARRAY -> {
        String[] array = value.asStringArray();
        out.writeInt(array.length);
        for (String element : array) {
          writeString(out, element);
        }
      }
    }
  }

  private static void writeString(DataOutputStream out, String value) throws IOException {
    if (value == null) {
      throw new IllegalArgumentException("Null string in message body");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  private static WireValue readValue(ByteBuffer buffer, WireType type) {
    return switch (type) {
      case BOOLEAN -> WireValue.bool(buffer.get() != 0);
      case BYTE -> WireValue.byteValue(buffer.get());
      case INT16 -> WireValue.int16(buffer.getShort());
      case INT32 -> WireValue.int32(buffer.getInt());
      case DOUBLE -> WireValue.float64(buffer.getDouble());
      case STRING -> WireValue.string(readString(buffer));
      case BYTE_ARRAY -> {
        byte[] array = new byte[readLength(buffer, 1)];
        buffer.get(array);
        yield WireValue.byteArray(array);
      }
      case INT16_ARRAY -> {
        short[] array = new short[readLength(buffer, 2)];
        for (int i = 0; i < array.length; i++) {
          array[i] = buffer.getShort();
        }
        yield WireValue.int16Array(array);
      }
      case INT32_ARRAY -> {
        int[] array = new int[readLength(buffer, 4)];
        for (int i = 0; i < array.length; i++) {
          array[i] = buffer.getInt();
        }
        yield WireValue.int32Array(array);
      }
      case DOUBLE_ARRAY -> {
        double[] array = new double[readLength(buffer, 8)];
        for (int i = 0; i < array.length; i++) {
          array[i] = buffer.getDouble();
        }
        yield WireValue.doubleArray(array);
      }
      case STRING_ARRAY -> {
        String[] array = new String[readLength(buffer, 4)];
        for (int i = 0; i < array.length; i++) {
          array[i] = readString(buffer);
        }
        yield WireValue.stringArray(array);
      }
    };
  }

  private static String readString(ByteBuffer buffer) {
    byte[] bytes = new byte[readLength(buffer, 1)];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  // Rejects counts that cannot fit in what is left, before allocating.
  private static int readLength(ByteBuffer buffer, int elementSize) {
    int length = buffer.getInt();
    if (length < 0 || (long) length * elementSize > buffer.remaining()) {
      throw new IllegalArgumentException("Bad length " + length + " with " + buffer.remaining()
          + " bytes left");
    }
    return length;
  }
}
