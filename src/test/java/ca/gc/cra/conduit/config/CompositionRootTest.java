package ca.gc.cra.conduit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.Transport;
import ca.gc.cra.conduit.application.port.TransportError;
import ca.gc.cra.conduit.application.port.TransportException;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.connection.ConnectionState;
import ca.gc.cra.conduit.domain.connection.ProbeResult;
import ca.gc.cra.conduit.infrastructure.profile.ParsedUri;
import ca.gc.cra.conduit.infrastructure.profile.VlessUriParser;
import ca.gc.cra.conduit.infrastructure.protocol.vless.VlessSessionFactory;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final String URI = "vless://b831381d-6324-4d53-ad4f-8cda48b30811@edge.example.com:443#Edge";

  private final AtomicReference<TransportSettings> lastSettings = new AtomicReference<>();

  @Test
  void transportSettingsFollowConfig() {
    TunnelConfig config = TunnelConfig.fromMap(Map.of("uri", URI, "connectTimeoutMs", "3000", "readTimeoutMs", "4000"));

    TransportSettings settings = root(config).transportSettings();

    assertEquals(Duration.ofSeconds(3), settings.connectTimeout());
    assertEquals(Duration.ofSeconds(4), settings.readTimeout());
    assertInstanceOf(VlessSessionFactory.class, root(config).sessionFactory());
  }

  @Test
  void runtimeRegistersProfileAndProbesThroughInjectedTransports() throws Exception {
    TunnelConfig config = TunnelConfig.fromMap(Map.of("uri", URI, "profileId", "edge", "connectTimeoutMs", "2000"));
    ParsedUri parsed = VlessUriParser.parse(config.uri(), config.profileId());

    try (TunnelRuntime runtime = root(config).tunnelRuntime(parsed)) {
      assertEquals("edge", runtime.profileId());
      assertTrue(runtime.profiles().getProfile("edge").isPresent());
      assertInstanceOf(ConnectionState.Disconnected.class, runtime.manager().states().current());

      ProbeResult result = runtime.probe().testConnection("edge");

      assertFalse(result.success());
      assertTrue(result.errorMessage().orElseThrow().contains("refused by test"));
      assertEquals(Duration.ofSeconds(2), lastSettings.get().connectTimeout());
    }
  }

  @Test
  void closingRuntimeTwiceIsHarmless() throws Exception {
    TunnelConfig config = TunnelConfig.fromMap(Map.of("uri", URI));
    TunnelRuntime runtime = root(config).tunnelRuntime(VlessUriParser.parse(URI));

    runtime.close();
    runtime.close();

    assertFalse(runtime.supervisor().snapshot().armed());
  }

  private CompositionRoot root(TunnelConfig config) {
    return new CompositionRoot(config, MetricsPort.NO_OP, ClockPort.SYSTEM, (transport, settings) -> {
      lastSettings.set(settings);
      return new RefusingTransport();
    });
  }

  private static final class RefusingTransport implements Transport {
    @Override
    public void connect(String host, int port) throws TransportException {
      throw new TransportException(TransportError.CONNECT_FAILED, "refused by test");
    }

    @Override
    public void send(byte[] data, int offset, int length) throws TransportException {
      throw new TransportException(TransportError.NOT_CONNECTED, "not connected");
    }

    @Override
    public int receive(byte[] buffer) throws TransportException {
      throw new TransportException(TransportError.NOT_CONNECTED, "not connected");
    }

    @Override
    public boolean isConnected() {
      return false;
    }

    @Override
    public void close() {
      // Nothing to release
    }
  }
}
