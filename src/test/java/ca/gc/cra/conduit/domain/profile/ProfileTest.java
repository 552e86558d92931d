package ca.gc.cra.conduit.domain.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.conduit.domain.net.AddressType;
import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.net.ServerEndpoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProfileTest {

  @Test
  void defaultsNameFlowAndDestinationFromEndpoint() {
    Profile profile = new Profile("edge", " ", ServerEndpoint.of("203.0.113.9", 8443), new TransportConfig.Plain(),
        null, null);

    assertEquals("203.0.113.9:8443", profile.name());
    assertEquals(FlowControl.NONE, profile.flow());
    assertEquals(new DestinationAddress(AddressType.IPV4, "203.0.113.9", 8443), profile.destination());
  }

  @Test
  void tlsTransportRequiresEndpointSni() {
    TransportConfig.Tls tls = new TransportConfig.Tls("cdn.example.com", List.of(), false);

    assertThrows(IllegalArgumentException.class,
        () -> new Profile("edge", null, ServerEndpoint.of("edge.example.com", 443), tls, null, null));
  }

  @Test
  void blankIdIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new Profile(" ", null, ServerEndpoint.of("edge.example.com", 443), new TransportConfig.Plain(), null,
            null));
  }

  @Test
  void transportNamesAcceptAliases() {
    assertEquals(TransportKind.WEBSOCKET, TransportKind.fromUriName("websocket"));
    assertEquals(TransportKind.HTTP2, TransportKind.fromUriName("http"));
    assertEquals(TransportKind.TCP, TransportKind.fromUriName(null));
    assertThrows(IllegalArgumentException.class, () -> TransportKind.fromUriName("kcp"));
    assertEquals(FlowControl.NONE, FlowControl.fromWireName("none"));
  }
}
