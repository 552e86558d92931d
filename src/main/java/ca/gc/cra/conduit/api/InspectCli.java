package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.infrastructure.profile.ProfileJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the profile decoded from a share link as JSON with the credential redacted.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE = "usage: inspect uri=vless://... [profileId=ID] [--compact]";
  private static final String HELP_TEXT = """
      conduit profile inspector

      Usage:
        inspect uri=vless://UUID@HOST:PORT?... [options]

      Prints the parsed profile as JSON. The UUID is always replaced with [REDACTED_UUID].

      Optional:
        profileId=ID     Profile id to show (default host:port)
        config=PATH      YAML file with 'common' and 'inspect' sections
        --compact        Single-line JSON
        --help           Show this message
      """;

  private InspectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.applyLogging(input, log, "inspect");
    try {
      CommandSupport.Prepared prepared = CommandSupport.prepare("inspect", input, log);
      ProfileJsonWriter writer = new ProfileJsonWriter(!input.hasFlag("--compact"));
      CliPrinter.println(writer.inspect(prepared.parsed().profile()));
      return ExitCode.SUCCESS;
    } catch (CliException ex) {
      return CommandSupport.report(ex, log, SUMMARY_USAGE);
    } catch (RuntimeException ex) {
      log.error("Failed to render profile", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
