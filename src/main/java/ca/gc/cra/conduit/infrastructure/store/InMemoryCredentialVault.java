package ca.gc.cra.conduit.infrastructure.store;

import ca.gc.cra.conduit.application.port.CredentialVault;
import ca.gc.cra.conduit.application.port.VaultException;
import ca.gc.cra.conduit.domain.profile.Credential;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CredentialVault}.
 * <p>Thread-safe. Credentials live only in memory for the lifetime of the process and are never logged.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryCredentialVault implements CredentialVault {
  private final Map<String, Credential> credentials = new ConcurrentHashMap<>();

  public InMemoryCredentialVault() {}

  public void store(String profileId, Credential credential) {
    Objects.requireNonNull(profileId, "profileId");
    Objects.requireNonNull(credential, "credential");
    credentials.put(profileId, credential);
  }

  public void forget(String profileId) {
    if (profileId != null) {
      credentials.remove(profileId);
    }
  }

  @Override
  public Credential getCredential(String profileId) throws VaultException {
    Credential credential = profileId == null ? null : credentials.get(profileId);
    if (credential == null) {
      throw new VaultException("No credential stored for profile " + profileId);
    }
    return credential;
  }
}
