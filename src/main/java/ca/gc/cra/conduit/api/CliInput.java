package ca.gc.cra.conduit.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command arguments split into switches ({@code --help}, {@code --dry-run}) and {@code key=value} settings.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> QUIET_FLAGS = Set.of("--quiet", "-q");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * <p>A token starting with {@code -} and holding no {@code =} is a switch; everything else is a setting.
   * Aliases collapse to {@code --help}, {@code --verbose} and {@code --quiet}.</p>
   *
   * @param args raw arguments; {@code null} behaves like an empty array
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (QUIET_FLAGS.contains(lower)) {
        flags.add("--quiet");
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /** {@code --quiet} lowers logging to WARN; ignored when {@code --verbose} is also present. */
  public boolean quiet() {
    return flags.contains("--quiet") && !verbose();
  }

  /**
   * Checks for a switch such as {@code --dry-run}.
   *
   * @param flag switch name, case-insensitive
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }
}
