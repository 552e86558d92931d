package ca.gc.cra.conduit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a conduit YAML file into the flat {@code key -> value} space shared with CLI arguments.
 *
 * <p>The document root holds a {@code common} section and one section per command ({@code connect},
 * {@code probe}, {@code inspect}, {@code export}). Keys from the command section override {@code common}. Nested
 * mappings flatten with dots; lists of scalars join with commas so {@code alpn: [h2, http/1.1]} matches the URI
 * form.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {
    // Utility
  }

  /**
   * Loads {@code path} and returns the merged {@code common} and {@code command} sections.
   *
   * @param path YAML file
   * @param command command whose section applies
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not valid conduit YAML
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(load(reader, command, path.toString()));
    }
  }

  /**
   * Parses YAML from a reader.
   *
   * @param reader YAML source
   * @param command command whose section applies
   * @param origin label used in error messages
   * @return flattened settings
   */
  public static Map<String, String> load(Reader reader, String command, String origin) {
    Objects.requireNonNull(reader, "reader");
    String section = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + origin + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = mapping(document, "document root");
    Map<String, String> settings = new LinkedHashMap<>();
    sectionNamed(root, COMMON_SECTION).ifPresent(common ->
        flattenInto(settings, "", mapping(common, COMMON_SECTION)));
    sectionNamed(root, section).ifPresent(commandSection ->
        flattenInto(settings, "", mapping(commandSection, section)));
    return Collections.unmodifiableMap(settings);
  }

  private static Optional<Object> sectionNamed(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(entry -> entry.getKey().trim().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst();
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> result = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String text) || text.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-string key: " + key);
      }
      result.put(text, value);
    });
    return result;
  }

  private static void flattenInto(Map<String, String> target, String prefix, Map<String, Object> source) {
    source.forEach((key, value) -> {
      String name = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        target.put(name, "");
      } else if (value instanceof Map<?, ?>) {
        flattenInto(target, name, mapping(value, name));
      } else if (value instanceof List<?> items) {
        target.put(name, joinScalars(name, items));
      } else {
        target.put(name, value.toString());
      }
    });
  }

  private static String joinScalars(String name, List<?> items) {
    StringBuilder joined = new StringBuilder();
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException(name + " must be a list of scalars");
      }
      if (joined.length() > 0) {
        joined.append(',');
      }
      joined.append(item == null ? "" : item.toString());
    }
    return joined.toString();
  }
}
