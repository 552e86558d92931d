package ca.gc.cra.conduit.infrastructure.store;

import ca.gc.cra.conduit.application.port.ProfileStore;
import ca.gc.cra.conduit.domain.profile.Profile;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ProfileStore} backed by a concurrent map.
 * <p>Thread-safe. The CLI registers the profile parsed from its {@code uri} argument here.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryProfileStore implements ProfileStore {
  private final Map<String, Profile> profiles = new ConcurrentHashMap<>();

  public InMemoryProfileStore() {}

  /**
   * Adds or replaces a profile keyed by its id.
   *
   * @param profile profile to store
   * @return the previous profile with the same id, if any
   */
  public Optional<Profile> put(Profile profile) {
    Objects.requireNonNull(profile, "profile");
    return Optional.ofNullable(profiles.put(profile.id(), profile));
  }

  public boolean remove(String profileId) {
    return profileId != null && profiles.remove(profileId) != null;
  }

  @Override
  public Optional<Profile> getProfile(String profileId) {
    if (profileId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(profiles.get(profileId));
  }

  public List<Profile> all() {
    return List.copyOf(profiles.values());
  }
}
