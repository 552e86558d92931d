package ca.gc.cra.conduit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  private static final String UUID = "b831381d-6324-4d53-ad4f-8cda48b30811";

  @Test
  void splitsOnFirstEqualsAndKeepsOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "uri=vless://" + UUID + "@example.com:443?type=ws&path=/a",
        "connectTimeoutMs=5000"});

    assertEquals(List.of("uri", "connectTimeoutMs"), List.copyOf(map.keySet()));
    assertEquals("vless://" + UUID + "@example.com:443?type=ws&path=/a", map.get("uri"));
  }

  @Test
  void leadingDashesOnKeysAreDropped() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"--config=conduit.yaml"});

    assertEquals("conduit.yaml", map.get("config"));
  }

  @Test
  void blankAndNullTokensAreSkipped() {
    assertTrue(CliArgsParser.toMap(new String[] {" ", null}).isEmpty());
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void emptyValueIsAllowed() {
    assertEquals("", CliArgsParser.toMap(new String[] {"bindInterface="}).get("bindInterface"));
  }

  @Test
  void rejectsTokenWithoutKey() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"positional"}));
  }

  @Test
  void rejectsInvalidKeyNames() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"a b=1"}));
  }

  @Test
  void rejectsRepeatedKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"uri=a", "uri=b"}));

    assertTrue(ex.getMessage().contains("more than once"));
  }

  @Test
  void rejectsControlCharactersAndOversizedValues() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"name=a\u0007b"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"name=" + "x".repeat(8_193)}));
  }

  @Test
  void errorHintNeverEchoesCredential() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"vless://" + UUID + "@example.com:443"}));

    assertFalse(ex.getMessage().contains(UUID));
    assertFalse(ex.getMessage().contains("b831381d"));
  }
}
