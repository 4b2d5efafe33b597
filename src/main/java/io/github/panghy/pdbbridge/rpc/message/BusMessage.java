package io.github.panghy.pdbbridge.rpc.message;

import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCategory;
import io.github.panghy.pdbbridge.rpc.message.BusMessageHeader.MessageType;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * A complete message on the bus: a header followed by an encoded body.
 *
 * <p>Calls carry their arguments as the body, successful replies their return
 * values, and error replies a single string holding the error message.</p>
 */
public class BusMessage {

  private final BusMessageHeader header;
  private final List<WireValue> body;

  /**
   * Creates a new message.
   *
   * @param header The header
   * @param body   The body values
   */
  public BusMessage(BusMessageHeader header, List<WireValue> body) {
    this.header = header;
    this.body = body != null ? List.copyOf(body) : List.of();
  }

  /**
   * Creates a method call.
   *
   * @param serial        The serial of the call
   * @param objectPath    The target object path
   * @param interfaceName The target interface
   * @param member        The method name
   * @param args          The arguments
   * @return The message
   */
  public static BusMessage methodCall(int serial, String objectPath, String interfaceName, String member,
                                      List<WireValue> args) {
    return new BusMessage(new BusMessageHeader(MessageType.METHOD_CALL, serial, 0, null,
        interfaceName, member, objectPath, 0), args);
  }

  /**
   * Creates a successful reply to a call.
   *
   * @param serial The serial of the reply
   * @param call   The call being answered
   * @param values The return values
   * @return The message
   */
  public static BusMessage methodReturn(int serial, BusMessage call, List<WireValue> values) {
    return new BusMessage(new BusMessageHeader(MessageType.METHOD_RETURN, serial,
        call.getHeader().getSerial(), null, null, null, null, 0), values);
  }

  /**
   * Creates an error reply to a call.
   *
   * @param serial   The serial of the reply
   * @param call     The call being answered
   * @param category The failure category
   * @param message  The error message
   * @return The message
   */
  public static BusMessage error(int serial, BusMessage call, ErrorCategory category, String message) {
    return new BusMessage(new BusMessageHeader(MessageType.ERROR, serial,
        call.getHeader().getSerial(), category, null, null, null, 0),
        List.of(WireValue.string(message != null ? message : "")));
  }

  public BusMessageHeader getHeader() {
    return header;
  }

  public List<WireValue> getBody() {
    return body;
  }

  /**
   * Gets the message text of an error reply.
   *
   * @return The error message
   * @throws IllegalStateException if this is not an error reply
   */
  public String getErrorMessage() {
    if (header.getType() != MessageType.ERROR) {
      throw new IllegalStateException("Not an error reply: " + header.getType());
    }
    return body.isEmpty() ? "" : body.get(0).asString();
  }

  /**
   * Serializes this message to a ByteBuffer. The body length in the written
   * header is always the real one.
   *
   * @return A ByteBuffer containing the serialized message, ready for reading
   */
  public ByteBuffer serialize() {
    ByteBuffer encodedBody = WireBodyCodec.encode(body);
    BusMessageHeader written = new BusMessageHeader(header.getType(), header.getSerial(),
        header.getReplySerial(), header.getErrorCategory(), header.getInterfaceName(),
        header.getMember(), header.getObjectPath(), encodedBody.remaining());
    ByteBuffer encodedHeader = written.serialize();

    ByteBuffer buffer = ByteBuffer.allocate(encodedHeader.remaining() + encodedBody.remaining());
    buffer.put(encodedHeader);
    buffer.put(encodedBody);
    buffer.flip();
    return buffer;
  }

  /**
   * Deserializes a message from a ByteBuffer.
   *
   * @param buffer The buffer containing the serialized message
   * @return The deserialized message
   * @throws IllegalArgumentException if the message is malformed
   */
  public static BusMessage deserialize(ByteBuffer buffer) {
    BusMessageHeader header = BusMessageHeader.deserialize(buffer);
    if (header.getBodyLength() > buffer.remaining()) {
      throw new IllegalArgumentException("Body length " + header.getBodyLength()
          + " exceeds the " + buffer.remaining() + " bytes left");
    }
    byte[] bodyBytes = new byte[header.getBodyLength()];
    buffer.get(bodyBytes);
    return new BusMessage(header, WireBodyCodec.decode(ByteBuffer.wrap(bodyBytes)));
  }

  @Override
  public String toString() {
    return "BusMessage{" +
        "header=" + header +
        ", signature='" + WireBodyCodec.signatureOf(body) + '\'' +
        '}';
  }
}
