package ca.gc.cra.conduit.api;

import ca.gc.cra.conduit.config.ConfigMerger;
import ca.gc.cra.conduit.config.TunnelConfig;
import ca.gc.cra.conduit.config.YamlConfigLoader;
import ca.gc.cra.conduit.infrastructure.profile.ParsedUri;
import ca.gc.cra.conduit.infrastructure.profile.UriParseException;
import ca.gc.cra.conduit.infrastructure.profile.VlessUriParser;
import ca.gc.cra.conduit.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Setup shared by the subcommands: logging switches, argument parsing, YAML loading, merging and link parsing.
 */
final class CommandSupport {

  private CommandSupport() {
    // Utility
  }

  /**
   * Settings, config and profile resolved for one command invocation.
   *
   * @param settings effective flat settings after precedence is applied
   * @param config validated tunnel config
   * @param parsed profile and credential decoded from {@code uri}
   */
  record Prepared(Map<String, String> settings, TunnelConfig config, ParsedUri parsed) {}

  static void applyLogging(CliInput input, Logger log, String command) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    } else if (input.quiet()) {
      LoggingConfigurator.setLevel(Logger.ROOT_LOGGER_NAME, "WARN");
    }
  }

  /**
   * Resolves everything a command needs before it touches the network.
   *
   * @param command subcommand name, used to pick the YAML section
   * @param input parsed arguments
   * @param log command logger, receives override notices
   * @return prepared invocation
   * @throws CliException with {@link ExitCode#INVALID_ARGS} for malformed arguments or links,
   *     {@link ExitCode#IO_ERROR} for unreadable config files and {@link ExitCode#CONFIG_ERROR} for settings that
   *     fail validation
   */
  static Prepared prepare(String command, CliInput input, Logger log) throws CliException {
    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      throw new CliException(ExitCode.INVALID_ARGS, "Invalid argument: " + ex.getMessage(), true, ex);
    }

    Optional<Map<String, String>> yaml = loadYaml(command, extractConfigPath(cli), log);

    Map<String, String> settings;
    TunnelConfig config;
    try {
      settings = ConfigMerger.buildEffectiveConfig(
          command, yaml, cli, TunnelConfig.defaultsAsFlatMap(), message -> log.info("{}", message));
      config = TunnelConfig.fromMap(settings);
    } catch (IllegalArgumentException ex) {
      throw new CliException(ExitCode.CONFIG_ERROR, "Invalid configuration: " + ex.getMessage(), true, ex);
    }

    ParsedUri parsed;
    try {
      parsed = VlessUriParser.parse(config.uri(), config.profileId());
    } catch (UriParseException ex) {
      throw new CliException(ExitCode.INVALID_ARGS, ex.getMessage(), false, ex);
    }
    return new Prepared(settings, config, parsed);
  }

  /**
   * Logs a setup failure and maps it to the command's exit code.
   *
   * @param ex failure raised by {@link #prepare}
   * @param log command logger
   * @param usage one-line usage printed when the failure is argument related
   * @return exit code to return from {@code run}
   */
  static ExitCode report(CliException ex, Logger log, String usage) {
    log.error("{}", ex.getMessage());
    if (ex.showUsage()) {
      CliPrinter.println(usage);
    }
    return ex.exitCode();
  }

  /**
   * Removes {@code config} from the CLI map; {@code --config=PATH} arrives here with its dashes stripped.
   *
   * @param args mutable CLI settings
   * @return configured path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static Optional<Map<String, String>> loadYaml(String command, String configPath, Logger log)
      throws CliException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path path;
    try {
      path = Paths.get(configPath);
    } catch (RuntimeException ex) {
      throw new CliException(ExitCode.INVALID_ARGS, "Invalid config path: " + configPath, true, ex);
    }
    if (!Files.isRegularFile(path)) {
      throw new CliException(ExitCode.IO_ERROR, "Config file not found: " + path, false, null);
    }
    try {
      Optional<Map<String, String>> loaded = YamlConfigLoader.load(path, command);
      log.debug("Loaded {} settings for {} from {}", loaded.map(Map::size).orElse(0), command, path);
      return loaded;
    } catch (IOException ex) {
      throw new CliException(ExitCode.IO_ERROR, "Failed to read config " + path + ": " + ex.getMessage(), false, ex);
    } catch (IllegalArgumentException ex) {
      throw new CliException(ExitCode.CONFIG_ERROR, ex.getMessage(), false, ex);
    }
  }
}
