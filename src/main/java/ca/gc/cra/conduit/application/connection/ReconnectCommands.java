package ca.gc.cra.conduit.application.connection;

/**
 * One-way command channel from the reconnect supervisor to the connection manager.
 *
 * <p>The supervisor never holds the manager itself; it only sends these requests. Commands are asynchronous and may
 * be ignored when the manager's state makes them moot (for example a reconnect while already connected).</p>
 *
 * @since 0.1.0
 */
public interface ReconnectCommands {
  /**
   * Requests a connect attempt for a profile that is currently down.
   *
   * @param profileId profile to connect
   */
  void reconnect(String profileId);

  /**
   * Requests a teardown and fresh connect so new sockets bind to the current network.
   *
   * @param profileId profile that should be connected afterwards
   */
  void restart(String profileId);
}
