package ca.gc.cra.conduit.api;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * conduit command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: conduit <connect|probe|inspect|export> [options]";
  private static final String HELP_TEXT = """
      conduit tunnel client

      Usage:
        conduit <command> [options] key=value...

      Commands:
        connect   Relay stdin/stdout through a VLESS tunnel (connect --help for details)
        probe     Check that a server answers and report handshake latency
        inspect   Print a share link's profile as redacted JSON
        export    Print a share link in canonical form or as Xray outbound JSON

      Global flags:
        --help      Show this message, or the command's help after a command
        --verbose   Enable DEBUG logging
        --quiet     Log warnings and errors only
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command without exiting the JVM.
   *
   * <p>The first argument that is not a switch names the command; every other argument, switches included, is
   * handed to it.</p>
   *
   * @param args raw arguments
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] != null && !raw[i].isBlank() && !raw[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0 || raw[commandIndex].trim().equalsIgnoreCase("help")) {
      if (CliInput.parse(raw).help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[raw.length - 1];
    System.arraycopy(raw, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(raw, commandIndex + 1, delegateArgs, commandIndex, raw.length - commandIndex - 1);
    log.debug("Dispatching {} with {} argument(s)", command, delegateArgs.length);

    return switch (command) {
      case "connect" -> ConnectCli.run(delegateArgs);
      case "probe" -> ProbeCli.run(delegateArgs);
      case "inspect" -> InspectCli.run(delegateArgs);
      case "export" -> ExportCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
