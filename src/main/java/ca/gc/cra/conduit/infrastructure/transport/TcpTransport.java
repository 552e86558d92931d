package ca.gc.cra.conduit.infrastructure.transport;

import ca.gc.cra.conduit.application.port.TransportSettings;

/**
 * Plain TCP transport with TCP_NODELAY and SO_KEEPALIVE enabled.
 *
 * @since 0.1.0
 */
public final class TcpTransport extends AbstractSocketTransport {
  public TcpTransport(TransportSettings settings) {
    super(settings);
  }

  @Override
  protected String name() {
    return "tcp";
  }
}
