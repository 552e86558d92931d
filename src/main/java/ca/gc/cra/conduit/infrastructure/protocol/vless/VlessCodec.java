package ca.gc.cra.conduit.infrastructure.protocol.vless;

import ca.gc.cra.conduit.domain.net.AddressType;
import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import java.io.ByteArrayOutputStream;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Encodes request headers and decodes response headers for the tunnel protocol.
 * <p><strong>Wire format (request):</strong> version (1) | credential UUID (16) | addons length (1) | addons |
 * command (1) | port (2, big-endian) | address type (1) | address (4 bytes, length-prefixed ASCII, or 16 bytes).</p>
 * <p><strong>Wire format (response):</strong> version (1) | addons length (1) | addons. Addons are skipped.</p>
 * <p><strong>Flow:</strong> {@link FlowControl#XTLS_RPRX_VISION} is requested through a protobuf-style addon
 * (field 1, length-delimited). After the header exchange {@link #negotiateFlow()} runs once; payload then passes
 * through unframed for every flow.</p>
 * <p><strong>Thread-safety:</strong> Encoding and decoding are stateless; {@link #negotiateFlow()} is guarded by an
 * atomic flag. One codec instance belongs to one session.</p>
 *
 * @since 0.1.0
 */
public final class VlessCodec {
  private static final Logger log = LoggerFactory.getLogger(VlessCodec.class);

  /** Protocol version written in requests and expected in responses. */
  public static final int VERSION = 0;
  private static final int UUID_LENGTH = 16;
  private static final int FLOW_ADDON_TAG = 0x0A;

  private final FlowControl flow;
  private final AtomicBoolean flowNegotiated = new AtomicBoolean();

  public VlessCodec(FlowControl flow) {
    this.flow = Objects.requireNonNull(flow, "flow");
  }

  public FlowControl flow() {
    return flow;
  }

  /**
   * Builds the request header for a TCP connect.
   *
   * @param credential authenticating credential
   * @param destination address the server should dial
   * @return header bytes, sent once before any payload
   */
  public byte[] encodeRequest(Credential credential, DestinationAddress destination) {
    return encodeRequest(credential, VlessCommand.TCP, destination);
  }

  /**
   * Builds a request header.
   *
   * @param credential authenticating credential
   * @param command command byte
   * @param destination address the server should dial
   * @return header bytes
   */
  public byte[] encodeRequest(Credential credential, VlessCommand command, DestinationAddress destination) {
    Objects.requireNonNull(credential, "credential");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(destination, "destination");
    ByteArrayOutputStream out = new ByteArrayOutputStream(64);
    out.write(VERSION);
    out.writeBytes(credential.toBytes());
    byte[] addons = encodeAddons(flow);
    out.write(addons.length);
    out.writeBytes(addons);
    out.write(command.wireValue());
    out.write((destination.port() >>> 8) & 0xFF);
    out.write(destination.port() & 0xFF);
    out.write(destination.type().wireValue());
    out.writeBytes(encodeAddress(destination));
    return out.toByteArray();
  }

  /**
   * Decodes a response header from the start of {@code data}.
   *
   * @param data received bytes
   * @param length number of valid bytes in {@code data}
   * @return header, or empty when more bytes are needed
   * @throws ProtocolException {@link ProtocolError#UNSUPPORTED_VERSION} when the version byte is unknown
   */
  public Optional<ResponseHeader> decodeResponse(byte[] data, int length) throws ProtocolException {
    Objects.checkFromIndexSize(0, length, data.length);
    if (length < 1) {
      return Optional.empty();
    }
    int version = data[0] & 0xFF;
    if (version != VERSION) {
      throw new ProtocolException(ProtocolError.UNSUPPORTED_VERSION, "Unsupported response version: " + version);
    }
    if (length < 2) {
      return Optional.empty();
    }
    int addonsLength = data[1] & 0xFF;
    int headerLength = 2 + addonsLength;
    if (length < headerLength) {
      return Optional.empty();
    }
    if (addonsLength > 0) {
      log.debug("Skipping {} bytes of response addons", addonsLength);
    }
    return Optional.of(new ResponseHeader(version, addonsLength, headerLength));
  }

  /**
   * Encodes a response header; used by test servers and diagnostics.
   *
   * @param addons addons to include, at most 255 bytes
   * @return response header bytes
   */
  public static byte[] encodeResponse(byte[] addons) {
    byte[] body = addons == null ? new byte[0] : addons;
    if (body.length > 0xFF) {
      throw new IllegalArgumentException("addons must not exceed 255 bytes");
    }
    byte[] header = new byte[2 + body.length];
    header[0] = VERSION;
    header[1] = (byte) body.length;
    System.arraycopy(body, 0, header, 2, body.length);
    return header;
  }

  /**
   * Decodes a request header from the start of {@code data}; used by test servers and diagnostics.
   *
   * @param data received bytes
   * @param length number of valid bytes
   * @return header, or empty when more bytes are needed
   * @throws ProtocolException {@link ProtocolError#BAD_REQUEST_HEADER} for malformed input
   */
  public static Optional<RequestHeader> decodeRequest(byte[] data, int length) throws ProtocolException {
    Objects.checkFromIndexSize(0, length, data.length);
    Reader reader = new Reader(data, length);
    if (!reader.has(1 + UUID_LENGTH + 1)) {
      return Optional.empty();
    }
    int version = reader.u8();
    if (version != VERSION) {
      throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Unsupported request version: " + version);
    }
    Credential credential = Credential.fromBytes(reader.bytes(UUID_LENGTH));
    int addonsLength = reader.u8();
    if (!reader.has(addonsLength + 4)) {
      return Optional.empty();
    }
    FlowControl flow = decodeAddons(reader.bytes(addonsLength));
    VlessCommand command = VlessCommand.fromWire(reader.u8());
    int port = (reader.u8() << 8) | reader.u8();
    AddressType type;
    try {
      type = AddressType.fromWire(reader.u8());
    } catch (IllegalArgumentException ex) {
      throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, ex.getMessage());
    }
    String host;
    switch (type) {
      case IPV4 -> {
        if (!reader.has(4)) {
          return Optional.empty();
        }
        host = hostAddress(reader.bytes(4));
      }
      case IPV6 -> {
        if (!reader.has(16)) {
          return Optional.empty();
        }
        host = ipv6Address(reader.bytes(16));
      }
      default -> {
        if (!reader.has(1)) {
          return Optional.empty();
        }
        int domainLength = reader.u8();
        if (!reader.has(domainLength)) {
          return Optional.empty();
        }
        host = new String(reader.bytes(domainLength), StandardCharsets.US_ASCII);
      }
    }
    try {
      DestinationAddress destination = new DestinationAddress(type, host, port);
      return Optional.of(new RequestHeader(credential, command, destination, flow, reader.position()));
    } catch (IllegalArgumentException ex) {
      throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Invalid destination: " + ex.getMessage());
    }
  }

  /**
   * Runs the one-time flow negotiation step after the header exchange.
   *
   * <p>{@link FlowControl#NONE} has nothing to negotiate. For {@link FlowControl#XTLS_RPRX_VISION} the request addon
   * already announced the flow; the session marks it negotiated and continues with raw pass-through.</p>
   *
   * @throws IllegalStateException when called more than once
   */
  public void negotiateFlow() {
    if (!flowNegotiated.compareAndSet(false, true)) {
      throw new IllegalStateException("flow already negotiated");
    }
    if (flow != FlowControl.NONE) {
      log.debug("Flow {} negotiated; payload continues as raw pass-through", flow.wireName());
    }
  }

  public boolean flowNegotiated() {
    return flowNegotiated.get();
  }

  private static byte[] encodeAddons(FlowControl flow) {
    if (flow == FlowControl.NONE) {
      return new byte[0];
    }
    byte[] name = flow.wireName().getBytes(StandardCharsets.US_ASCII);
    ByteArrayOutputStream out = new ByteArrayOutputStream(name.length + 2);
    out.write(FLOW_ADDON_TAG);
    writeVarint(out, name.length);
    out.writeBytes(name);
    return out.toByteArray();
  }

  private static FlowControl decodeAddons(byte[] addons) throws ProtocolException {
    if (addons.length == 0) {
      return FlowControl.NONE;
    }
    Reader reader = new Reader(addons, addons.length);
    FlowControl flow = FlowControl.NONE;
    while (reader.has(1)) {
      int tag = reader.u8();
      int fieldLength = readVarint(reader);
      if (!reader.has(fieldLength)) {
        throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Truncated request addons");
      }
      byte[] value = reader.bytes(fieldLength);
      if (tag == FLOW_ADDON_TAG) {
        try {
          flow = FlowControl.fromWireName(new String(value, StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException ex) {
          throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, ex.getMessage());
        }
      }
    }
    return flow;
  }

  private static void writeVarint(ByteArrayOutputStream out, int value) {
    int remaining = value;
    while ((remaining & ~0x7F) != 0) {
      out.write((remaining & 0x7F) | 0x80);
      remaining >>>= 7;
    }
    out.write(remaining);
  }

  private static int readVarint(Reader reader) throws ProtocolException {
    int result = 0;
    for (int shift = 0; shift < 32; shift += 7) {
      if (!reader.has(1)) {
        throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Truncated varint in addons");
      }
      int b = reader.u8();
      result |= (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Varint too long in addons");
  }

  private static byte[] encodeAddress(DestinationAddress destination) {
    return switch (destination.type()) {
      case IPV4 -> literalBytes(destination.host());
      case IPV6 -> ipv6Bytes(destination.host());
      case DOMAIN -> {
        byte[] name = destination.host().getBytes(StandardCharsets.US_ASCII);
        byte[] encoded = new byte[name.length + 1];
        encoded[0] = (byte) name.length;
        System.arraycopy(name, 0, encoded, 1, name.length);
        yield encoded;
      }
    };
  }

  private static byte[] literalBytes(String literal) {
    try {
      // Literal addresses are parsed without a DNS lookup.
      return InetAddress.getByName(literal).getAddress();
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("Invalid IP literal: " + literal, ex);
    }
  }

  /**
   * IPv6 destinations always take 16 bytes. The JDK parses IPv4-mapped literals such as {@code ::ffff:10.0.0.7} into
   * an {@link java.net.Inet4Address}, so those are widened back to the mapped form.
   */
  private static byte[] ipv6Bytes(String literal) {
    byte[] raw = literalBytes(literal);
    if (raw.length == 16) {
      return raw;
    }
    byte[] mapped = new byte[16];
    mapped[10] = (byte) 0xFF;
    mapped[11] = (byte) 0xFF;
    System.arraycopy(raw, 0, mapped, 12, 4);
    return mapped;
  }

  private static String ipv6Address(byte[] raw) throws ProtocolException {
    try {
      // Keeps mapped addresses in IPv6 text form so the host still matches its address type.
      return Inet6Address.getByAddress(null, raw, -1).getHostAddress();
    } catch (UnknownHostException ex) {
      throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Invalid address bytes");
    }
  }

  private static String hostAddress(byte[] raw) throws ProtocolException {
    try {
      return InetAddress.getByAddress(raw).getHostAddress();
    } catch (UnknownHostException ex) {
      throw new ProtocolException(ProtocolError.BAD_REQUEST_HEADER, "Invalid address bytes");
    }
  }

  private static final class Reader {
    private final byte[] data;
    private final int limit;
    private int position;

    Reader(byte[] data, int limit) {
      this.data = data;
      this.limit = limit;
    }

    boolean has(int count) {
      return limit - position >= count;
    }

    int u8() {
      return data[position++] & 0xFF;
    }

    byte[] bytes(int count) {
      byte[] out = Arrays.copyOfRange(data, position, position + count);
      position += count;
      return out;
    }

    int position() {
      return position;
    }
  }
}
