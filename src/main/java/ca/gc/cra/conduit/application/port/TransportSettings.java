package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.net.NetworkHandle;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-transport timeouts and socket binding.
 *
 * @param connectTimeout TCP connect timeout, also applied to the TLS handshake
 * @param readTimeout blocking read timeout
 * @param networkHandle network to bind the socket to, {@code null} to let the OS route
 * @since 0.1.0
 */
public record TransportSettings(Duration connectTimeout, Duration readTimeout, NetworkHandle networkHandle) {
  /** Default connect timeout. */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  /** Default read timeout. */
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

  public TransportSettings {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(readTimeout, "readTimeout");
    if (connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be positive");
    }
    if (readTimeout.isNegative() || readTimeout.isZero()) {
      throw new IllegalArgumentException("readTimeout must be positive");
    }
  }

  public static TransportSettings defaults() {
    return new TransportSettings(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, null);
  }

  /**
   * Copy bound to {@code handle}.
   *
   * @param handle network to bind to, or {@code null} to clear the binding
   * @return new settings
   */
  public TransportSettings withNetwork(NetworkHandle handle) {
    return new TransportSettings(connectTimeout, readTimeout, handle);
  }

  public Optional<NetworkHandle> binding() {
    return Optional.ofNullable(networkHandle);
  }

  /**
   * Connect timeout as the {@code int} milliseconds {@link java.net.Socket} expects.
   *
   * @return clamped milliseconds
   */
  public int connectTimeoutMillis() {
    return (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis());
  }

  /**
   * Read timeout as the {@code int} milliseconds {@link java.net.Socket#setSoTimeout(int)} expects.
   *
   * @return clamped milliseconds
   */
  public int readTimeoutMillis() {
    return (int) Math.min(Integer.MAX_VALUE, readTimeout.toMillis());
  }
}
