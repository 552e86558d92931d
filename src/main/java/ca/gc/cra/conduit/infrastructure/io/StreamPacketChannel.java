package ca.gc.cra.conduit.infrastructure.io;

import ca.gc.cra.conduit.application.port.PacketChannel;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link PacketChannel} over a plain input/output stream pair such as the process's stdin and stdout.
 * <p>Reads and writes may run on different threads. Writes are flushed immediately so interactive peers see
 * downlink bytes without buffering delays.</p>
 *
 * @since 0.1.0
 */
public final class StreamPacketChannel implements PacketChannel {
  private final InputStream in;
  private final OutputStream out;
  private final boolean closeStreams;

  /**
   * Creates a channel.
   *
   * @param in uplink source
   * @param out downlink sink
   * @param closeStreams whether {@link #close()} should close both streams; {@code false} for stdio
   */
  public StreamPacketChannel(InputStream in, OutputStream out, boolean closeStreams) {
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
    this.closeStreams = closeStreams;
  }

  /** Channel over {@link System#in} and {@link System#out}; closing it leaves stdio open. */
  public static StreamPacketChannel stdio() {
    return new StreamPacketChannel(System.in, System.out, false);
  }

  @Override
  public int read(byte[] buffer) throws IOException {
    return in.read(buffer);
  }

  @Override
  public void write(byte[] data, int offset, int length) throws IOException {
    synchronized (out) {
      out.write(data, offset, length);
      out.flush();
    }
  }

  @Override
  public void close() throws IOException {
    if (!closeStreams) {
      synchronized (out) {
        out.flush();
      }
      return;
    }
    InputStream source = in;
    OutputStream sink = out;
    try (source; sink) {
      synchronized (sink) {
        sink.flush();
      }
    }
  }
}
