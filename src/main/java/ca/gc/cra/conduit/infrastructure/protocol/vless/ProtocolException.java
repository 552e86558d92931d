package ca.gc.cra.conduit.infrastructure.protocol.vless;

import java.io.IOException;
import java.util.Objects;

/**
 * Checked exception raised when a header cannot be decoded.
 *
 * @since 0.1.0
 */
public final class ProtocolException extends IOException {
  private static final long serialVersionUID = 1L;

  private final ProtocolError error;

  public ProtocolException(ProtocolError error, String msg) {
    super(msg);
    this.error = Objects.requireNonNull(error, "error");
  }

  public ProtocolError error() {
    return error;
  }
}
