package ca.gc.cra.conduit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("edge-1", Strings.requireNonBlank("profileId", "  edge-1  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("profileId", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("profileId", null));
  }

  @Test
  void optionalMapsBlankToNull() {
    assertNull(Strings.optional("serverName", "   "));
    assertEquals("cdn.example.com", Strings.optional("serverName", " cdn.example.com "));
  }
}
