package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.infrastructure.profile.ParsedUri;
import ca.gc.cra.conduit.infrastructure.profile.ProfileJsonWriter;
import ca.gc.cra.conduit.infrastructure.profile.VlessUriExporter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-emits a share link in canonical form, or as an Xray outbound JSON block with {@code format=xray}.
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  private static final String SUMMARY_USAGE = "usage: export uri=vless://... [format=uri|xray] [name=LABEL]";
  private static final String HELP_TEXT = """
      conduit profile exporter

      Usage:
        export uri=vless://UUID@HOST:PORT?... [options]

      Output contains the credential; treat it like the input link.

      Optional:
        format=uri|xray  Canonical vless:// link (default) or Xray outbound JSON
        name=LABEL       Replace the link's #fragment label
        config=PATH      YAML file with 'common' and 'export' sections
        --help           Show this message
      """;

  private ExportCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.applyLogging(input, log, "export");
    try {
      CommandSupport.Prepared prepared = CommandSupport.prepare("export", input, log);
      ParsedUri parsed = relabel(prepared.parsed(), prepared.settings().get("name"));
      String format = prepared.settings().getOrDefault("format", "uri").trim().toLowerCase(Locale.ROOT);
      switch (format) {
        case "uri" -> CliPrinter.println(VlessUriExporter.export(parsed.profile(), parsed.credential()));
        case "xray" -> CliPrinter.println(
            new ProfileJsonWriter(true).xrayOutbound(parsed.profile(), parsed.credential()));
        default -> {
          log.error("Unknown export format: {}", format);
          CliPrinter.println(SUMMARY_USAGE);
          return ExitCode.INVALID_ARGS;
        }
      }
      return ExitCode.SUCCESS;
    } catch (CliException ex) {
      return CommandSupport.report(ex, log, SUMMARY_USAGE);
    } catch (RuntimeException ex) {
      log.error("Failed to export profile", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ParsedUri relabel(ParsedUri parsed, String name) {
    if (name == null || name.isBlank()) {
      return parsed;
    }
    Profile p = parsed.profile();
    return new ParsedUri(
        new Profile(p.id(), name.trim(), p.endpoint(), p.transport(), p.flow(), p.destination()),
        parsed.credential());
  }
}
