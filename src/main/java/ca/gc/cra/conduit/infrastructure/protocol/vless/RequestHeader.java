package ca.gc.cra.conduit.infrastructure.protocol.vless;

import ca.gc.cra.conduit.domain.net.DestinationAddress;
import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.FlowControl;
import java.util.Objects;

/**
 * Decoded request header.
 *
 * @param credential authenticating credential (redacted in {@code toString})
 * @param command requested command
 * @param destination address the server should dial
 * @param flow flow requested through the addons field
 * @param length number of bytes the header occupied
 * @since 0.1.0
 */
public record RequestHeader(
    Credential credential,
    VlessCommand command,
    DestinationAddress destination,
    FlowControl flow,
    int length) {

  public RequestHeader {
    Objects.requireNonNull(credential, "credential");
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(flow, "flow");
  }
}
