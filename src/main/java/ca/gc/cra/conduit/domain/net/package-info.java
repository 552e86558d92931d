/**
 * Network-level value types: server endpoints, tunnel destinations and host network notifications.
 * <p><strong>Concurrency:</strong> All types are immutable records.</p>
 * <p><strong>Security:</strong> Hostnames are not secret; credentials never live in this package.</p>
 */
package ca.gc.cra.conduit.domain.net;
