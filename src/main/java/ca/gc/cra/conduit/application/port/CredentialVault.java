package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.profile.Credential;

/**
 * <strong>What:</strong> Source of credentials for profiles.
 * <p><strong>Why:</strong> The platform vault owns the secret; the core borrows it for one connect call and never
 * stores it.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public interface CredentialVault {
  /**
   * Returns the credential for a profile.
   *
   * @param profileId opaque identifier
   * @return credential value
   * @throws VaultException when the entry is missing or unreadable
   */
  Credential getCredential(String profileId) throws VaultException;
}
