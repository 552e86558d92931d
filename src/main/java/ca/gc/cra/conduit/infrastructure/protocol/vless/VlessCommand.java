package ca.gc.cra.conduit.infrastructure.protocol.vless;

/**
 * Request command byte.
 *
 * @since 0.1.0
 */
public enum VlessCommand {
  TCP(1),
  UDP(2),
  MUX(3);

  private final int wireValue;

  VlessCommand(int wireValue) {
    this.wireValue = wireValue;
  }

  public int wireValue() {
    return wireValue;
  }

  static VlessCommand fromWire(int value) throws ProtocolException {
    for (VlessCommand command : values()) {
      if (command.wireValue == value) {
        return command;
      }
    }
    throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Unknown command: " + value);
  }
}
