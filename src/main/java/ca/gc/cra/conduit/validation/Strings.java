package ca.gc.cra.conduit.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by conduit profiles, URIs and CLI arguments.
 * <p><strong>Why:</strong> Profiles reach the transport layer as hostnames, SNI values and header values; rejecting
 * blank or control-character input early keeps malformed values off the wire.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked from record constructors and parsers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs or metrics; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Normalizes an optional string: {@code null} or blank becomes {@code null}, anything else is validated.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text, may be {@code null}
   * @return trimmed value or {@code null}
   */
  public static String optional(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return requireNonBlank(name, value);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
