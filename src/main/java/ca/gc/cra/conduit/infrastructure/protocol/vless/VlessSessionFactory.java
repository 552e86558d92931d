package ca.gc.cra.conduit.infrastructure.protocol.vless;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.ProtocolSession;
import ca.gc.cra.conduit.application.port.SessionFactory;
import ca.gc.cra.conduit.application.port.TransportFactory;
import ca.gc.cra.conduit.application.port.TransportSettings;
import ca.gc.cra.conduit.domain.profile.Profile;
import java.util.Objects;

/**
 * {@link SessionFactory} producing {@link VlessSession}s with a fresh codec per attempt.
 *
 * @since 0.1.0
 */
public final class VlessSessionFactory implements SessionFactory {
  private final TransportFactory transports;
  private final ClockPort clock;

  public VlessSessionFactory(TransportFactory transports, ClockPort clock) {
    this.transports = Objects.requireNonNull(transports, "transports");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ProtocolSession create(Profile profile, TransportSettings settings) {
    Objects.requireNonNull(profile, "profile");
    return new VlessSession(transports, settings, profile.destination(), new VlessCodec(profile.flow()), clock);
  }
}
