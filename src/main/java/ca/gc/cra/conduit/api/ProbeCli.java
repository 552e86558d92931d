package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.config.CompositionRoot;
import ca.gc.cra.conduit.config.TunnelRuntime;
import ca.gc.cra.conduit.domain.connection.ProbeResult;
import ca.gc.cra.conduit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot reachability check: opens a throwaway session, completes the header exchange and reports the latency.
 *
 * @since 0.1.0
 */
public final class ProbeCli {
  private static final Logger log = LoggerFactory.getLogger(ProbeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: probe uri=vless://... [config=PATH] [connectTimeoutMs=N] [readTimeoutMs=N] [bindInterface=NIC]";
  private static final String HELP_TEXT = """
      conduit connection probe

      Usage:
        probe uri=vless://UUID@HOST:PORT?... [options]

      Prints 'OK <latency> ms' and exits 0 when the server answers, or 'FAILED: <reason>' and exits 5.

      Optional:
        config=PATH                 YAML file with 'common' and 'probe' sections
        connectTimeoutMs=1000-120000  TCP/TLS connect timeout (default 10000)
        readTimeoutMs=1000-300000   Wait for the response header (default 30000)
        bindInterface=NIC           Prefer this interface when several are up
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        --verbose                   Enable DEBUG logging
        --quiet                     Log warnings and errors only
        --help                      Show this message
      """;

  private ProbeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.applyLogging(input, log, "probe");

    CommandSupport.Prepared prepared;
    try {
      prepared = CommandSupport.prepare("probe", input, log);
      TelemetryConfigurator.configureMetrics(prepared.settings());
    } catch (CliException ex) {
      return CommandSupport.report(ex, log, SUMMARY_USAGE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid telemetry configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        TunnelRuntime runtime = new CompositionRoot(prepared.config(), metrics).tunnelRuntime(prepared.parsed())) {
      ProbeResult result = runtime.probe().testConnection(runtime.profileId());
      if (result.success()) {
        CliPrinter.println("OK " + result.latencyMs() + " ms");
        return ExitCode.SUCCESS;
      }
      CliPrinter.println("FAILED: " + result.errorMessage().orElse("unknown error"));
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Probe failed unexpectedly", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
