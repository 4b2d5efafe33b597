package io.github.panghy.pdbbridge.rpc.message;

import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCategory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Header of a message on the bus.
 *
 * <p>Message structure:</p>
 * <pre>
 * +------+--------+--------------+----------------+-----------+--------+----------+-------------+
 * | Type | Serial | Reply serial | Error category | Interface | Member | Obj path | Body length |
 * +------+--------+--------------+----------------+-----------+--------+----------+-------------+
 * </pre>
 *
 * <p>A method call names the object path, interface and member it targets. A
 * reply carries the serial of the call it answers. An error reply also carries
 * the category of the failure; its message text travels as the body.</p>
 */
public class BusMessageHeader {

  /**
   * Enumeration of bus message types.
   */
  public enum MessageType {
    /**
     * A call of a method on an exported object.
     */
    METHOD_CALL(1),

    /**
     * A successful reply to a call.
     */
    METHOD_RETURN(2),

    /**
     * A failed reply to a call.
     */
    ERROR(3);

    private final int code;

    MessageType(int code) {
      this.code = code;
    }

    public int getCode() {
      return code;
    }

    public static MessageType fromCode(int code) {
      for (MessageType type : values()) {
        if (type.code == code) {
          return type;
        }
      }
      throw new IllegalArgumentException("Unknown message type code: " + code);
    }
  }

  private final MessageType type;
  private final int serial;
  private final int replySerial;
  private final ErrorCategory errorCategory;
  private final String interfaceName;
  private final String member;
  private final String objectPath;
  private final int bodyLength;

  /**
   * Creates a new header.
   *
   * @param type          The message type
   * @param serial        The serial of this message
   * @param replySerial   The serial of the call being answered, or 0 for calls
   * @param errorCategory The failure category for error replies, otherwise null
   * @param interfaceName The target interface, may be null for replies
   * @param member        The target method name, may be null for replies
   * @param objectPath    The target object path, may be null for replies
   * @param bodyLength    The length of the encoded body in bytes
   */
  public BusMessageHeader(MessageType type, int serial, int replySerial, ErrorCategory errorCategory,
                          String interfaceName, String member, String objectPath, int bodyLength) {
    this.type = type;
    this.serial = serial;
    this.replySerial = replySerial;
    this.errorCategory = errorCategory;
    this.interfaceName = interfaceName;
    this.member = member;
    this.objectPath = objectPath;
    this.bodyLength = bodyLength;
  }

  public MessageType getType() {
    return type;
  }

  public int getSerial() {
    return serial;
  }

  public int getReplySerial() {
    return replySerial;
  }

  /**
   * Gets the failure category of an error reply.
   *
   * @return The category, or null for calls and successful replies
   */
  public ErrorCategory getErrorCategory() {
    return errorCategory;
  }

  public String getInterfaceName() {
    return interfaceName;
  }

  public String getMember() {
    return member;
  }

  public String getObjectPath() {
    return objectPath;
  }

  public int getBodyLength() {
    return bodyLength;
  }

  /**
   * Serializes this header to a ByteBuffer.
   *
   * @return A ByteBuffer containing the serialized header, ready for reading
   */
  public ByteBuffer serialize() {
    // Format:
    // - Message type (1 byte)
    // - Serial (4 bytes)
    // - Reply serial (4 bytes)
    // - Error category (1 byte, 0 when absent)
    // - Interface, member and object path (2-byte length + UTF-8 each)
    // - Body length (4 bytes)
    byte[] interfaceBytes = bytesOf(interfaceName);
    byte[] memberBytes = bytesOf(member);
    byte[] pathBytes = bytesOf(objectPath);
    int totalSize = 1 + 4 + 4 + 1
        + 2 + interfaceBytes.length
        + 2 + memberBytes.length
        + 2 + pathBytes.length
        + 4;

    ByteBuffer buffer = ByteBuffer.allocate(totalSize);
    buffer.put((byte) type.getCode());
    buffer.putInt(serial);
    buffer.putInt(replySerial);
    buffer.put(errorCategory == null ? 0 : (byte) (errorCategory.ordinal() + 1));
    putString(buffer, interfaceBytes);
    putString(buffer, memberBytes);
    putString(buffer, pathBytes);
    buffer.putInt(bodyLength);

    buffer.flip();
    return buffer;
  }

  /**
   * Deserializes a header from a ByteBuffer.
   *
   * @param buffer The buffer containing the serialized header
   * @return The deserialized header
   */
  public static BusMessageHeader deserialize(ByteBuffer buffer) {
    MessageType type = MessageType.fromCode(buffer.get());
    int serial = buffer.getInt();
    int replySerial = buffer.getInt();
    int categoryCode = buffer.get();
    ErrorCategory errorCategory = null;
    if (categoryCode > 0) {
      ErrorCategory[] categories = ErrorCategory.values();
      if (categoryCode > categories.length) {
        throw new IllegalArgumentException("Unknown error category code: " + categoryCode);
      }
      errorCategory = categories[categoryCode - 1];
    }
    String interfaceName = getString(buffer);
    String member = getString(buffer);
    String objectPath = getString(buffer);
    int bodyLength = buffer.getInt();

    return new BusMessageHeader(type, serial, replySerial, errorCategory,
        interfaceName, member, objectPath, bodyLength);
  }

  private static byte[] bytesOf(String value) {
    return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
  }

  private static void putString(ByteBuffer buffer, byte[] bytes) {
    buffer.putShort((short) bytes.length);
    buffer.put(bytes);
  }

  private static String getString(ByteBuffer buffer) {
    short length = buffer.getShort();
    if (length == 0) {
      return null;
    }
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "BusMessageHeader{" +
        "type=" + type +
        ", serial=" + serial +
        ", replySerial=" + replySerial +
        ", errorCategory=" + errorCategory +
        ", interfaceName='" + interfaceName + '\'' +
        ", member='" + member + '\'' +
        ", objectPath='" + objectPath + '\'' +
        ", bodyLength=" + bodyLength +
        '}';
  }
}
