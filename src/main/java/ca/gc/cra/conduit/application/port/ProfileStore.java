package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.profile.Profile;
import java.util.Optional;

/**
 * <strong>What:</strong> Read access to saved server profiles.
 * <p><strong>Role:</strong> Consumed by the connection manager; persistence lives outside the core.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from the manager's lifecycle thread while
 * other threads update profiles.</p>
 *
 * @since 0.1.0
 */
public interface ProfileStore {
  /**
   * Looks up a profile.
   *
   * @param profileId opaque identifier
   * @return profile, or empty when unknown
   */
  Optional<Profile> getProfile(String profileId);
}
