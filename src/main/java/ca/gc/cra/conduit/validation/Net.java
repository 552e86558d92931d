package ca.gc.cra.conduit.validation;

import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Host validation for server endpoints and tunnel destinations.
 * <p><strong>Why:</strong> The codec chooses its address encoding from the shape of the host, so the shape must be
 * known and well-formed before a header is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a hostname, IPv4 literal or IPv6 literal (with or without brackets).
   *
   * @param name parameter label used in diagnostics
   * @param host candidate host
   * @return trimmed host with IPv6 brackets removed
   * @throws IllegalArgumentException when the host is malformed
   */
  public static String requireHost(String name, String host) {
    String sanitized = Strings.requireNonBlank(name, host);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (isIpv4Literal(sanitized)) {
      validateIpv4Octets(name, sanitized);
      return sanitized;
    }
    if (sanitized.indexOf(':') >= 0) {
      if (!isIpv6Literal(sanitized)) {
        throw new IllegalArgumentException(name + " is not a valid IPv6 literal: " + sanitized);
      }
      return sanitized;
    }
    validateHostname(name, sanitized);
    return sanitized;
  }

  /**
   * Returns whether {@code host} has the dotted-quad IPv4 shape.
   *
   * @param host candidate host
   * @return {@code true} for dotted-quad text
   */
  public static boolean isIpv4Literal(String host) {
    return host != null && IPV4_PATTERN.matcher(host).matches();
  }

  /**
   * Returns whether {@code host} is a syntactically valid IPv6 literal without brackets.
   *
   * @param host candidate host
   * @return {@code true} when the literal parses as IPv6
   */
  public static boolean isIpv6Literal(String host) {
    if (host == null || host.indexOf(':') < 0) {
      return false;
    }
    for (int i = 0; i < host.length(); i++) {
      char c = host.charAt(i);
      if (!(Character.digit(c, 16) >= 0 || c == ':' || c == '.' || c == '%')) {
        return false;
      }
    }
    int doubleColon = host.indexOf("::");
    if (doubleColon >= 0 && host.indexOf("::", doubleColon + 1) >= 0) {
      return false;
    }
    String scopeless = host.contains("%") ? host.substring(0, host.indexOf('%')) : host;
    String[] groups = scopeless.split(":", -1);
    return groups.length >= 3 && groups.length <= 9;
  }

  private static void validateHostname(String name, String host) {
    int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          name + " has invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(name, host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        // Trailing dot denotes the root zone.
        break;
      }
    }
  }

  private static void validateLabel(String name, String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          name + " has invalid label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    for (int i = start; i < end; i++) {
      char c = s.charAt(i);
      boolean edge = i == start || i == end - 1;
      if (!(isAsciiAlnum(c) || c == '_' || (!edge && c == '-'))) {
        throw new IllegalArgumentException(name + " contains illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String name, String host) {
    for (String octet : host.split("\\.")) {
      int value = Integer.parseInt(octet);
      if (value > 255) {
        throw new IllegalArgumentException(name + " has IPv4 octet out of range: " + octet);
      }
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
