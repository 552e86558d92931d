/**
 * Ports between the conduit core and its collaborators.
 * <p><strong>Role:</strong> Transports, sessions, profile and credential sources, network monitoring, packet
 * channels, metrics and time.</p>
 * <p><strong>Concurrency:</strong> Each interface documents its threading contract; adapters must honour it.</p>
 * <p><strong>Security:</strong> Credentials cross these ports by value only; exception messages are redacted.</p>
 */
package ca.gc.cra.conduit.application.port;
