package ca.gc.cra.conduit.domain.net;

import ca.gc.cra.conduit.validation.Strings;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies the host network a socket should be bound to.
 *
 * <p>Transports bind their local side to an address of this interface so traffic leaves through the network that was
 * active when the connection was opened, even while the OS is switching routes. The bind address is picked per
 * connection to match the family of the resolved server address.</p>
 *
 * @param name interface name as reported by the host (e.g., {@code wlan0})
 * @param addresses usable addresses of that interface, in preference order; never empty
 * @param wifi whether the host reports the interface as Wi-Fi
 * @param cellular whether the host reports the interface as cellular
 * @since 0.1.0
 */
public record NetworkHandle(String name, List<InetAddress> addresses, boolean wifi, boolean cellular) {
  public NetworkHandle {
    name = Strings.requireNonBlank("name", name);
    Objects.requireNonNull(addresses, "addresses");
    addresses = List.copyOf(addresses);
    if (addresses.isEmpty()) {
      throw new IllegalArgumentException("addresses must not be empty");
    }
  }

  public NetworkHandle(String name, InetAddress address, boolean wifi, boolean cellular) {
    this(name, List.of(Objects.requireNonNull(address, "address")), wifi, cellular);
  }

  /**
   * Returns the first interface address in the same family as {@code remote}.
   *
   * @param remote resolved server address
   * @return bind address, or empty when the interface has no address of that family
   */
  public Optional<InetAddress> localAddressFor(InetAddress remote) {
    Objects.requireNonNull(remote, "remote");
    boolean v4 = remote instanceof Inet4Address;
    return addresses.stream()
        .filter(address -> (address instanceof Inet4Address) == v4)
        .findFirst();
  }
}
