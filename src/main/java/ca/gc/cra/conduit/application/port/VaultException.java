package ca.gc.cra.conduit.application.port;

/**
 * Checked exception thrown when the credential vault cannot supply a credential.
 *
 * @since 0.1.0
 */
public final class VaultException extends Exception {
  private static final long serialVersionUID = 1L;

  public VaultException(String msg) {
    super(msg);
  }

  public VaultException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
