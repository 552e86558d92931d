package ca.gc.cra.conduit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void commandSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("conduit.yaml");
    Files.writeString(yaml, """
        common:
          connectTimeoutMs: 5000
          metricsExporter: none
        connect:
          connectTimeoutMs: 8000
          autoReconnect: true
        probe:
          connectTimeoutMs: 2000
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "connect").orElseThrow();

    assertEquals("8000", map.get("connectTimeoutMs"));
    assertEquals("true", map.get("autoReconnect"));
    assertEquals("none", map.get("metricsExporter"));
  }

  @Test
  void nestedMappingsFlattenWithDots() {
    Map<String, String> map = YamlConfigLoader.load(new StringReader("""
        common:
          otel:
            endpoint: http://collector:4317
        """), "probe", "inline");

    assertEquals("http://collector:4317", map.get("otel.endpoint"));
  }

  @Test
  void scalarListsJoinWithCommas() {
    Map<String, String> map = YamlConfigLoader.load(new StringReader("""
        export:
          alpn: [h2, http/1.1]
        """), "EXPORT", "inline");

    assertEquals("h2,http/1.1", map.get("alpn"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "connect");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsNoSettings() {
    assertTrue(YamlConfigLoader.load(new StringReader(""), "connect", "inline").isEmpty());
  }

  @Test
  void sequenceRootIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(new StringReader("- connect: {}\n"), "connect", "inline"));

    assertTrue(ex.getMessage().contains("document root"));
  }

  @Test
  void nestedListsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(new StringReader("""
        connect:
          alpn:
            - [h2]
        """), "connect", "inline"));
  }

  @Test
  void malformedYamlNamesOrigin() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(new StringReader("connect: [unterminated"), "connect", "bad.yaml"));

    assertTrue(ex.getMessage().contains("bad.yaml"));
  }

  @Test
  void unsafeTagsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(
        new StringReader("connect: !!java.io.File {}\n"), "connect", "inline"));
  }
}
