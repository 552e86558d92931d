package ca.gc.cra.conduit.domain.profile;

import ca.gc.cra.conduit.logging.Logs;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> UUID credential authenticating a tunnel request.
 * <p><strong>Why:</strong> The UUID is a bearer secret. Only the codec reads {@link #toBytes()}; everything else sees the
 * redacted {@link #toString()}.</p>
 * <p><strong>Role:</strong> Passed by value into a single connect call and dropped afterwards.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param uuid credential identifier
 * @since 0.1.0
 */
public record Credential(UUID uuid) {
  private static final Pattern CANONICAL = Pattern.compile(
      "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  public Credential {
    Objects.requireNonNull(uuid, "uuid");
  }

  /**
   * Parses the 36-character hyphenated hex form.
   *
   * @param text candidate UUID text
   * @return credential
   * @throws IllegalArgumentException if {@code text} is not a canonical UUID; the message does not echo the input
   */
  public static Credential parse(String text) {
    if (!isCanonicalUuid(text)) {
      throw new IllegalArgumentException("Invalid UUID format");
    }
    return new Credential(UUID.fromString(text));
  }

  /**
   * Checks the 8-4-4-4-12 hex layout without allocating a UUID.
   *
   * @param text candidate
   * @return {@code true} for canonical UUID text
   */
  public static boolean isCanonicalUuid(String text) {
    return text != null && CANONICAL.matcher(text).matches();
  }

  /**
   * Returns the 16 raw bytes in network order.
   *
   * @return fresh array; callers should not retain it
   */
  public byte[] toBytes() {
    ByteBuffer buffer = ByteBuffer.allocate(16);
    buffer.putLong(uuid.getMostSignificantBits());
    buffer.putLong(uuid.getLeastSignificantBits());
    return buffer.array();
  }

  /**
   * Rebuilds a credential from 16 network-order bytes.
   *
   * @param bytes exactly 16 bytes
   * @return credential
   */
  public static Credential fromBytes(byte[] bytes) {
    if (bytes == null || bytes.length != 16) {
      throw new IllegalArgumentException("credential must be 16 bytes");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new Credential(new UUID(buffer.getLong(), buffer.getLong()));
  }

  /**
   * Returns the canonical text form. Only exporters that must reproduce the secret should call this.
   *
   * @return lowercase hyphenated UUID
   */
  public String reveal() {
    return uuid.toString();
  }

  @Override
  public String toString() {
    return "Credential[" + Logs.REDACTED_UUID + "]";
  }
}
