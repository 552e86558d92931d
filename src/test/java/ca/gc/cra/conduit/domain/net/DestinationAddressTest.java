package ca.gc.cra.conduit.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class DestinationAddressTest {

  @Test
  void typeIsInferredFromHostShape() {
    assertEquals(AddressType.IPV4, DestinationAddress.of("192.0.2.1", 80).type());
    assertEquals(AddressType.IPV6, DestinationAddress.of("[2001:db8::1]", 80).type());
    assertEquals("2001:db8::1", DestinationAddress.of("[2001:db8::1]", 80).host());
    assertEquals(AddressType.DOMAIN, DestinationAddress.of("example.com", 80).type());
  }

  @Test
  void declaredTypeMustMatchHost() {
    assertThrows(IllegalArgumentException.class, () -> new DestinationAddress(AddressType.IPV4, "example.com", 80));
    assertThrows(IllegalArgumentException.class, () -> new DestinationAddress(AddressType.IPV6, "192.0.2.1", 80));
  }

  @Test
  void portMustBeInRange() {
    assertThrows(IllegalArgumentException.class, () -> DestinationAddress.of("example.com", 0));
    assertThrows(IllegalArgumentException.class, () -> DestinationAddress.of("example.com", 65_536));
  }

  @Test
  void endpointAuthorityBracketsIpv6() {
    assertEquals("[2001:db8::2]:443", ServerEndpoint.of("2001:db8::2", 443).authority());
    assertEquals("edge.example.com:443",
        new ServerEndpoint("edge.example.com", 443, "cdn.example.com", List.of("h2"), false).authority());
  }
}
