package ca.gc.cra.conduit.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromSettings() {
    CliInput input = CliInput.parse(new String[] {"uri=vless://x", "--dry-run", "--config=a.yaml", "-V"});

    assertArrayEquals(new String[] {"uri=vless://x", "--config=a.yaml"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("-v"));
    assertTrue(input.verbose());
  }

  @Test
  void helpAliasesCollapse() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void verboseWinsOverQuiet() {
    assertTrue(CliInput.parse(new String[] {"--quiet"}).quiet());
    assertFalse(CliInput.parse(new String[] {"-q", "--debug"}).quiet());
  }

  @Test
  void keyValueArgsAreDefensiveCopies() {
    CliInput input = CliInput.parse(new String[] {"a=1"});
    input.keyValueArgs()[0] = "b=2";

    assertArrayEquals(new String[] {"a=1"}, input.keyValueArgs());
  }

  @Test
  void blankFlagIsNeverPresent() {
    assertFalse(CliInput.parse(new String[] {"--compact"}).hasFlag(" "));
  }
}
