/**
 * Server profiles and the credential type that authenticates them.
 * <p><strong>Security:</strong> {@link ca.gc.cra.conduit.domain.profile.Credential} redacts itself in
 * {@code toString()}; profiles never embed a credential.</p>
 */
package ca.gc.cra.conduit.domain.profile;
