/**
 * Connection lifecycle services: the connection manager and its state observable, the reconnect supervisor with its
 * backoff policy, traffic statistics and the standalone connection probe.
 */
package ca.gc.cra.conduit.application.connection;
