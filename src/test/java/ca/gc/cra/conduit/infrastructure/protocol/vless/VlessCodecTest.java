package ca.gc.cra.conduit.infrastructure.protocol.vless;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.domain.net.AddressType;
import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class VlessCodecTest {
  private static final Credential CREDENTIAL = Credential.parse("b831381d-6324-4d53-ad4f-8cda48b30811");

  @Test
  void ipv4RequestHasFixedLayout() {
    byte[] header = new VlessCodec(FlowControl.NONE)
        .encodeRequest(CREDENTIAL, DestinationAddress.of("10.0.0.7", 443));

    assertEquals(1 + 16 + 1 + 1 + 2 + 1 + 4, header.length);
    assertEquals(VlessCodec.VERSION, header[0]);
    assertArrayEquals(CREDENTIAL.toBytes(), Arrays.copyOfRange(header, 1, 17));
    assertEquals(0, header[17]);
    assertEquals(VlessCommand.TCP.wireValue(), header[18]);
    assertEquals(0x01, header[19] & 0xFF);
    assertEquals(0xBB, header[20] & 0xFF);
    assertEquals(AddressType.IPV4.wireValue(), header[21]);
    assertArrayEquals(new byte[] {10, 0, 0, 7}, Arrays.copyOfRange(header, 22, 26));
  }

  @Test
  void domainRequestIsLengthPrefixed() throws Exception {
    byte[] header = new VlessCodec(FlowControl.NONE)
        .encodeRequest(CREDENTIAL, DestinationAddress.of("example.com", 8080));

    int addressStart = 22;
    assertEquals(AddressType.DOMAIN.wireValue(), header[21]);
    assertEquals(11, header[addressStart]);
    assertEquals("example.com",
        new String(header, addressStart + 1, 11, StandardCharsets.US_ASCII));

    RequestHeader decoded = VlessCodec.decodeRequest(header, header.length).orElseThrow();
    assertEquals(CREDENTIAL, decoded.credential());
    assertEquals(DestinationAddress.of("example.com", 8080), decoded.destination());
    assertEquals(header.length, decoded.length());
  }

  @Test
  void ipv6RequestCarriesSixteenAddressBytes() throws Exception {
    byte[] header = new VlessCodec(FlowControl.NONE)
        .encodeRequest(CREDENTIAL, VlessCommand.TCP, DestinationAddress.of("2001:db8::1", 53));

    assertEquals(AddressType.IPV6.wireValue(), header[21]);
    assertEquals(22 + 16, header.length);
    RequestHeader decoded = VlessCodec.decodeRequest(header, header.length).orElseThrow();
    assertEquals(AddressType.IPV6, decoded.destination().type());
    assertEquals(InetAddress.getByName("2001:db8::1"), InetAddress.getByName(decoded.destination().host()));
    assertEquals(53, decoded.destination().port());
  }

  @Test
  void ipv4MappedIpv6KeepsSixteenByteForm() throws Exception {
    VlessCodec codec = new VlessCodec(FlowControl.NONE);
    DestinationAddress mapped = DestinationAddress.of("[::ffff:10.0.0.7]", 443);
    byte[] header = codec.encodeRequest(CREDENTIAL, mapped);

    assertEquals(AddressType.IPV6, mapped.type());
    assertEquals(AddressType.IPV6.wireValue(), header[21]);
    assertEquals(22 + 16, header.length);
    assertArrayEquals(new byte[] {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, (byte) 0xFF, (byte) 0xFF, 10, 0, 0, 7},
        Arrays.copyOfRange(header, 22, 38));

    RequestHeader decoded = VlessCodec.decodeRequest(header, header.length).orElseThrow();
    assertEquals(AddressType.IPV6, decoded.destination().type());
    assertEquals(header.length, decoded.length());
    assertArrayEquals(header, codec.encodeRequest(CREDENTIAL, decoded.destination()));
  }

  @Test
  void visionFlowIsAnnouncedInAddons() throws Exception {
    VlessCodec codec = new VlessCodec(FlowControl.XTLS_RPRX_VISION);
    byte[] header = codec.encodeRequest(CREDENTIAL, DestinationAddress.of("10.0.0.7", 443));

    int addonsLength = header[17] & 0xFF;
    assertEquals(2 + "xtls-rprx-vision".length(), addonsLength);
    assertEquals(0x0A, header[18]);
    RequestHeader decoded = VlessCodec.decodeRequest(header, header.length).orElseThrow();
    assertEquals(FlowControl.XTLS_RPRX_VISION, decoded.flow());
    assertEquals(VlessCommand.TCP, decoded.command());
  }

  @Test
  void partialRequestNeedsMoreBytes() throws Exception {
    byte[] header = new VlessCodec(FlowControl.NONE)
        .encodeRequest(CREDENTIAL, DestinationAddress.of("example.com", 80));

    assertFalse(VlessCodec.decodeRequest(header, 10).isPresent());
    assertFalse(VlessCodec.decodeRequest(header, header.length - 1).isPresent());
  }

  @Test
  void responseAddonsAreSkipped() throws Exception {
    byte[] response = VlessCodec.encodeResponse(new byte[] {1, 2, 3});
    byte[] withPayload = Arrays.copyOf(response, response.length + 2);

    Optional<ResponseHeader> header = new VlessCodec(FlowControl.NONE).decodeResponse(withPayload, withPayload.length);

    assertTrue(header.isPresent());
    assertEquals(3, header.get().addonsLength());
    assertEquals(5, header.get().length());
  }

  @Test
  void partialResponseNeedsMoreBytes() throws Exception {
    VlessCodec codec = new VlessCodec(FlowControl.NONE);

    assertFalse(codec.decodeResponse(new byte[] {0}, 1).isPresent());
    assertFalse(codec.decodeResponse(new byte[] {0, 4, 1}, 3).isPresent());
    assertFalse(codec.decodeResponse(new byte[0], 0).isPresent());
  }

  @Test
  void unknownResponseVersionIsRejected() {
    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> new VlessCodec(FlowControl.NONE).decodeResponse(new byte[] {1, 0}, 2));

    assertEquals(ProtocolError.UNSUPPORTED_VERSION, ex.error());
  }

  @Test
  void badRequestVersionIsRejected() {
    byte[] header = new VlessCodec(FlowControl.NONE)
        .encodeRequest(CREDENTIAL, DestinationAddress.of("10.0.0.7", 443));
    header[0] = 7;

    ProtocolException ex = assertThrows(ProtocolException.class,
        () -> VlessCodec.decodeRequest(header, header.length));

    assertEquals(ProtocolError.BAD_REQUEST_HEADER, ex.error());
  }

  @Test
  void flowNegotiatesOnce() {
    VlessCodec codec = new VlessCodec(FlowControl.XTLS_RPRX_VISION);
    codec.negotiateFlow();

    assertTrue(codec.flowNegotiated());
    assertThrows(IllegalStateException.class, codec::negotiateFlow);
  }

  @Test
  void oversizedResponseAddonsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> VlessCodec.encodeResponse(new byte[256]));
  }
}
