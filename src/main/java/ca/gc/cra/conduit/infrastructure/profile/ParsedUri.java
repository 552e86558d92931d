package ca.gc.cra.conduit.infrastructure.profile;

import ca.gc.cra.conduit.domain.profile.Credential;
import ca.gc.cra.conduit.domain.profile.Profile;
import java.util.Objects;

/**
 * Result of parsing a share URI: the profile and the credential that must go to the vault separately.
 *
 * @param profile validated profile
 * @param credential credential carried in the URI user-info
 * @since 0.1.0
 */
public record ParsedUri(Profile profile, Credential credential) {
  public ParsedUri {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(credential, "credential");
  }
}
