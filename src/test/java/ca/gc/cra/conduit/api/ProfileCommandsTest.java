package ca.gc.cra.conduit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ProfileCommandsTest {
  private static final String UUID = "b831381d-6324-4d53-ad4f-8cda48b30811";
  private static final String URI = "vless://" + UUID + "@edge.example.com:443?security=tls&sni=cdn.example.com#Edge";

  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void inspectPrintsRedactedJson() {
    ExitCode code = InspectCli.run(new String[] {"uri=" + URI, "profileId=edge", "--compact"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("\"id\":\"edge\""));
    assertTrue(out.contains("[REDACTED_UUID]"));
    assertFalse(out.contains(UUID));
  }

  @Test
  void inspectWithoutUriIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, InspectCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: inspect"));
  }

  @Test
  void malformedUriIsInvalidArgsAndNeverLogged() {
    ExitCode code = InspectCli.run(new String[] {"uri=vless://" + UUID + "@example.com:443?type=grpc"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("serviceName")));
    assertTrue(appender.list.stream().noneMatch(event -> event.getFormattedMessage().contains(UUID)));
  }

  @Test
  void exportDefaultsToCanonicalUri() {
    assertEquals(ExitCode.SUCCESS, ExportCli.run(new String[] {"uri=" + URI, "name=Renamed Edge"}));

    String out = buffer.toString().trim();
    assertTrue(out.startsWith("vless://" + UUID + "@edge.example.com:443?type=tcp"));
    assertTrue(out.endsWith("#Renamed%20Edge"));
  }

  @Test
  void exportXrayJson() {
    assertEquals(ExitCode.SUCCESS, ExportCli.run(new String[] {"uri=" + URI, "format=xray"}));

    assertTrue(buffer.toString().contains("\"protocol\" : \"vless\""));
  }

  @Test
  void exportRejectsUnknownFormat() {
    assertEquals(ExitCode.INVALID_ARGS, ExportCli.run(new String[] {"uri=" + URI, "format=yaml"}));
    assertTrue(buffer.toString().contains("usage: export"));
  }

  @Test
  void yamlSuppliesUriAndCliOverrides() throws Exception {
    Path yaml = tempDir.resolve("conduit.yaml");
    Files.writeString(yaml, """
        common:
          uri: "%s"
        inspect:
          profileId: from-yaml
        """.formatted(URI));

    ExitCode code = InspectCli.run(new String[] {"--config=" + yaml, "profileId=from-cli", "--compact"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("\"id\":\"from-cli\""));
  }

  @Test
  void missingConfigFileIsIoError() {
    ExitCode code = ExportCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "uri=" + URI});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void connectDryRunPrintsPlanWithoutConnecting() {
    ExitCode code = ConnectCli.run(new String[] {"uri=" + URI, "autoReconnect=true", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("server=edge.example.com:443"));
    assertTrue(out.contains("autoReconnect=true"));
    assertFalse(out.contains(UUID));
  }

  @Test
  void connectRejectsPositionalArguments() {
    assertEquals(ExitCode.INVALID_ARGS, ConnectCli.run(new String[] {"edge.example.com"}));
    assertTrue(buffer.toString().contains("usage: connect"));
  }

  @Test
  void probeRejectsBadTimeout() {
    assertEquals(ExitCode.CONFIG_ERROR, ProbeCli.run(new String[] {"uri=" + URI, "connectTimeoutMs=1"}));
  }
}
