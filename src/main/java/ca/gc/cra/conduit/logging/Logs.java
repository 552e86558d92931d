package ca.gc.cra.conduit.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep credentials and large payloads out of logs.
 * <p><strong>Why:</strong> Tunnel credentials are bearer secrets; any UUID that reaches an error reason, a URI echo or a
 * log line would grant access to the server.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used where error reasons are constructed and where URIs are echoed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Replace UUID-shaped text with a fixed placeholder.</li>
 *   <li>Truncate UTF-8 text to a safe byte budget while preserving readability.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  /** Placeholder substituted for every UUID-shaped token. */
  public static final String REDACTED_UUID = "[REDACTED_UUID]";
  private static final Pattern UUID_PATTERN = Pattern.compile(
      "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private Logs() {
    // Utility
  }

  /**
   * Replaces every UUID-shaped token in {@code value} with {@link #REDACTED_UUID}.
   *
   * @param value text that may embed a credential; {@code null} results in {@code "<null>"}
   * @return redacted text
   */
  public static String redactCredentials(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return UUID_PATTERN.matcher(value).replaceAll(REDACTED_UUID);
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return prefix + "... (truncated)";
    }
  }
}
