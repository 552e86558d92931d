/**
 * Connection lifecycle model: the published {@link ca.gc.cra.conduit.domain.connection.ConnectionState}, statistics
 * snapshots and reconnect bookkeeping.
 * <p><strong>Concurrency:</strong> Immutable values; safe to hand to any observer thread.</p>
 * <p><strong>Security:</strong> Error reasons are redacted on construction.</p>
 */
package ca.gc.cra.conduit.domain.connection;
