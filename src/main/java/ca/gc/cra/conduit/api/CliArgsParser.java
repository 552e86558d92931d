package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.logging.Logs;
import ca.gc.cra.conduit.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable map.
 * <p>Values are split on the first {@code '='} only, so {@code uri=vless://...?type=ws&path=/a} keeps its query
 * intact. A leading {@code --} on a key is dropped, so {@code --config=a.yaml} equals {@code config=a.yaml}. Error
 * messages never echo values; share links carry credentials.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final int MAX_VALUE_LENGTH = 8_192;

  private CliArgsParser() {
    // Utility
  }

  /**
   * Parses settings.
   *
   * @param args {@code key=value} tokens; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException on a malformed token, an invalid key, a repeated key or a value with control
   *     characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + keyHint(arg) + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (key.startsWith("--")) {
        key = key.substring(2);
      }
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + keyHint(key));
      }
      validateValue(key, value);
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static void validateValue(String key, String value) {
    if (value.length() > MAX_VALUE_LENGTH) {
      throw new IllegalArgumentException("argument " + key + " exceeds " + MAX_VALUE_LENGTH + " characters");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    if (!value.isEmpty()) {
      Strings.requireNonBlank(key, value);
    }
  }

  private static String keyHint(String text) {
    return Logs.truncate(Logs.redactCredentials(text), 48);
  }
}
