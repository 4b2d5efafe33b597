package io.github.panghy.pdbbridge.rpc.serialization;

/**
 * The closed set of value types the message bus carries. Each type has the
 * one- or two-character signature code the bus uses to describe it.
 */
public enum WireType {
  BOOLEAN("b"),
  BYTE("y"),
  INT16("n"),
  INT32("i"),
  DOUBLE("d"),
  STRING("s"),
  BYTE_ARRAY("ay"),
  INT16_ARRAY("an"),
  INT32_ARRAY("ai"),
  DOUBLE_ARRAY("ad"),
  STRING_ARRAY("as");

  private final String signature;

  WireType(String signature) {
    this.signature = signature;
  }

  /**
   * Gets the bus signature code.
   *
   * @return The signature, for example {@code "ai"}
   */
  public String getSignature() {
    return signature;
  }

  public boolean isArray() {
    return signature.length() == 2;
  }

  /**
   * Gets the wire type for a signature code.
   *
   * @param signature The signature code
   * @return The wire type
   * @throws IllegalArgumentException if the signature is not one of ours
   */
  public static WireType fromSignature(String signature) {
    for (WireType type : values()) {
      if (type.signature.equals(signature)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported wire signature: " + signature);
  }
}
