package ca.gc.cra.conduit.domain.net;

/**
 * Address-type tag written into the request header ahead of the destination address.
 *
 * @since 0.1.0
 */
public enum AddressType {
  /** Four-byte IPv4 address. */
  IPV4(1),
  /** Length-prefixed ASCII domain name. */
  DOMAIN(2),
  /** Sixteen-byte IPv6 address. */
  IPV6(3);

  private final int wireValue;

  AddressType(int wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the byte value used on the wire.
   *
   * @return wire tag
   */
  public int wireValue() {
    return wireValue;
  }

  /**
   * Resolves a wire tag.
   *
   * @param value unsigned byte read from a header
   * @return matching address type
   * @throws IllegalArgumentException when the tag is unknown
   */
  public static AddressType fromWire(int value) {
    for (AddressType type : values()) {
      if (type.wireValue == value) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown address type: " + value);
  }
}
