package ca.gc.cra.conduit.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by conduit configuration and URI parsing.
 * <p><strong>Why:</strong> Guards ports, timeouts and sampling intervals before sockets or executors are created.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., ms, port number)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates a TCP port number.
   *
   * @param name logical parameter name
   * @param port candidate port
   * @return the port when it lies in {@code [1, 65535]}
   */
  public static int requirePort(String name, int port) {
    return (int) requireRange(name, port, 1, 65_535);
  }

  /**
   * Parses a decimal integer, reporting the parameter name on failure.
   *
   * @param name logical parameter name
   * @param raw textual value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not numeric
   */
  public static long parseLong(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be numeric (was " + trimmed + ")", ex);
    }
  }
}
