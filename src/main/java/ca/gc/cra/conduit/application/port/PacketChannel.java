package ca.gc.cra.conduit.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Opaque packet source and sink, typically a TUN device managed by the host.
 * <p><strong>Role:</strong> Supplies bytes to {@link ProtocolSession#forward} and receives bytes from
 * {@link ProtocolSession#pull} through the tunnel relay.</p>
 * <p><strong>Thread-safety:</strong> One reader thread and one writer thread.</p>
 *
 * @since 0.1.0
 */
public interface PacketChannel extends AutoCloseable {
  /**
   * Reads outbound bytes.
   *
   * @param buffer destination
   * @return bytes read, or {@code -1} at end of input
   * @throws IOException when the device fails
   */
  int read(byte[] buffer) throws IOException;

  /**
   * Writes inbound bytes.
   *
   * @param data source
   * @param offset first byte
   * @param length byte count
   * @throws IOException when the device fails
   */
  void write(byte[] data, int offset, int length) throws IOException;

  @Override
  void close() throws IOException;
}
