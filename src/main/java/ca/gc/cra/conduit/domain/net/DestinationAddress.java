package ca.gc.cra.conduit.domain.net;

import ca.gc.cra.conduit.validation.Net;
import ca.gc.cra.conduit.validation.Numbers;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * <strong>What:</strong> Destination the tunnel server should dial on the client's behalf.
 * <p><strong>Why:</strong> The codec encodes the host differently depending on its {@link AddressType}; the type is
 * derived once here so encoding and decoding agree.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param type address encoding selected for {@code host}
 * @param host IPv4 literal, IPv6 literal (no brackets) or ASCII domain name
 * @param port destination port in {@code [1, 65535]}
 * @since 0.1.0
 */
public record DestinationAddress(AddressType type, String host, int port) {
  private static final int MAX_DOMAIN_BYTES = 255;

  /**
   * Validates that {@code host} matches the declared {@code type}.
   */
  public DestinationAddress {
    Objects.requireNonNull(type, "type");
    host = Net.requireHost("host", host);
    Numbers.requirePort("port", port);
    switch (type) {
      case IPV4 -> {
        if (!Net.isIpv4Literal(host)) {
          throw new IllegalArgumentException("IPv4 destination must be a dotted quad: " + host);
        }
      }
      case IPV6 -> {
        if (!Net.isIpv6Literal(host)) {
          throw new IllegalArgumentException("IPv6 destination must be an IPv6 literal: " + host);
        }
      }
      case DOMAIN -> {
        if (host.getBytes(StandardCharsets.US_ASCII).length > MAX_DOMAIN_BYTES) {
          throw new IllegalArgumentException("domain destination exceeds 255 bytes");
        }
      }
    }
  }

  /**
   * Builds a destination, inferring the address type from the shape of {@code host}.
   *
   * @param host host text
   * @param port destination port
   * @return destination with the inferred type
   */
  public static DestinationAddress of(String host, int port) {
    String normalized = Net.requireHost("host", host);
    AddressType type;
    if (Net.isIpv4Literal(normalized)) {
      type = AddressType.IPV4;
    } else if (Net.isIpv6Literal(normalized)) {
      type = AddressType.IPV6;
    } else {
      type = AddressType.DOMAIN;
    }
    return new DestinationAddress(type, normalized, port);
  }
}
