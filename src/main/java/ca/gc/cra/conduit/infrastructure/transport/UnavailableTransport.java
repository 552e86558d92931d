package ca.gc.cra.conduit.infrastructure.transport;

import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.domain.profile.TransportKind;

/**
 * Placeholder for framed transports that have no provider registered; every connect fails.
 */
final class UnavailableTransport implements Transport {
  private final TransportKind kind;

  UnavailableTransport(TransportKind kind) {
    this.kind = kind;
  }

  @Override
  public void connect(String host, int port) throws TransportException {
    throw new TransportException(TransportError.CONNECT_FAILED,
        "Transport " + kind.uriName() + " is not available in this build");
  }

  @Override
  public void send(byte[] data, int offset, int length) throws TransportException {
    throw new TransportException(TransportError.NOT_CONNECTED, "Transport not connected");
  }

  @Override
  public int receive(byte[] buffer) throws TransportException {
    throw new TransportException(TransportError.NOT_CONNECTED, "Transport not connected");
  }

  @Override
  public boolean isConnected() {
    return false;
  }

  @Override
  public void close() {
    // Nothing to release
  }
}
