package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.application.connection.ConnectionException;
import ca.gc.cra.conduit.application.pipeline.TunnelRelayUseCase;
import ca.gc.cra.conduit.config.CompositionRoot;
import ca.gc.cra.conduit.config.TunnelConfig;
import ca.gc.cra.conduit.config.TunnelRuntime;
import ca.gc.cra.conduit.domain.profile.Profile;
import ca.gc.cra.conduit.infrastructure.io.StreamPacketChannel;
import ca.gc.cra.conduit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tunnel: connects the profile from {@code uri=} and relays stdin to the server and the server to stdout
 * until stdin reaches EOF or the process receives SIGINT.
 *
 * @since 0.1.0
 */
public final class ConnectCli {
  private static final Logger log = LoggerFactory.getLogger(ConnectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: connect uri=vless://... [config=PATH] [profileId=ID] [autoReconnect=true|false] "
          + "[connectTimeoutMs=N] [readTimeoutMs=N] [statsIntervalMs=N] [backoffUnitMs=N] [networkPollMs=N] "
          + "[bindInterface=NIC] [metricsExporter=otlp|none] [otelEndpoint=URL] [--dry-run]";
  private static final String HELP_TEXT = """
      conduit tunnel relay

      Usage:
        connect uri=vless://UUID@HOST:PORT?... [options]

      Payload read from stdin is sent through the tunnel; payload received from the server is written to stdout.
      Logs go to stderr.

      Required:
        uri=LINK                    vless:// share link (quote it; it contains '&')

      Optional:
        config=PATH                 YAML file with 'common' and 'connect' sections
        profileId=ID                Profile id (default host:port)
        autoReconnect=true|false    Retry with exponential backoff and follow network changes (default false)
        connectTimeoutMs=1000-120000  TCP/TLS connect timeout (default 10000)
        readTimeoutMs=1000-300000   Socket read timeout (default 30000)
        statsIntervalMs=250-60000   Traffic statistics sampling period (default 2000)
        backoffUnitMs=1-60000       Reconnect backoff unit; delays are 1,2,4,...,60 units (default 1000)
        networkPollMs=250-60000     Network change polling period (default 2000)
        bindInterface=NIC           Prefer this interface when several are up
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        --dry-run                   Validate settings and print the plan without connecting
        --verbose                   Enable DEBUG logging
        --quiet                     Log warnings and errors only
        --help                      Show this message
      """;

  private ConnectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.applyLogging(input, log, "connect");

    CommandSupport.Prepared prepared;
    try {
      prepared = CommandSupport.prepare("connect", input, log);
      TelemetryConfigurator.configureMetrics(prepared.settings());
    } catch (CliException ex) {
      return CommandSupport.report(ex, log, SUMMARY_USAGE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid telemetry configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(prepared);
      return ExitCode.SUCCESS;
    }
    return runTunnel(prepared);
  }

  private static ExitCode runTunnel(CommandSupport.Prepared prepared) {
    TunnelConfig config = prepared.config();
    Profile profile = prepared.parsed().profile();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      try (TunnelRuntime runtime = root.tunnelRuntime(prepared.parsed());
          StreamPacketChannel channel = StreamPacketChannel.stdio()) {
        Thread hook = new Thread(runtime::close, "conduit-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        runtime.start();
        try {
          runtime.manager().connect(runtime.profileId());
          log.info("Tunnel up to {} via {}", profile.endpoint().authority(), profile.transport().kind().uriName());
        } catch (ConnectionException ex) {
          if (!config.autoReconnect() || !ex.failure().retryable()) {
            log.error("Connect to {} failed ({}): {}", profile.endpoint().authority(), ex.failure(), ex.getMessage());
            return ExitCode.RUNTIME_FAILURE;
          }
          log.warn("Connect to {} failed ({}); retrying in the background",
              profile.endpoint().authority(), ex.failure());
        }

        try (TunnelRelayUseCase relay = root.relay(runtime, channel)) {
          relay.run();
        }
        removeHook(hook);
        return ExitCode.SUCCESS;
      }
    } catch (IOException ex) {
      log.error("Relay IO failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Tunnel failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }

  private static void printDryRunPlan(CommandSupport.Prepared prepared) {
    TunnelConfig config = prepared.config();
    Profile profile = prepared.parsed().profile();
    CliPrinter.printLines(
        "Connect dry-run plan:",
        "  profileId=" + profile.id(),
        "  server=" + profile.endpoint().authority(),
        "  transport=" + profile.transport().kind().uriName(),
        "  flow=" + profile.flow(),
        "  backend=" + config.backend(),
        "  connectTimeoutMs=" + config.connectTimeout().toMillis(),
        "  readTimeoutMs=" + config.readTimeout().toMillis(),
        "  statsIntervalMs=" + config.statsInterval().toMillis(),
        "  autoReconnect=" + config.autoReconnect(),
        "  backoffUnitMs=" + config.backoffUnit().toMillis(),
        "  networkPollMs=" + config.networkPollInterval().toMillis(),
        "  bindInterface=" + (config.bindInterface() == null ? "(auto)" : config.bindInterface()),
        "  metricsExporter=" + prepared.settings().getOrDefault("metricsExporter", "none"),
        "Dry run only; no connection attempted.");
  }
}
