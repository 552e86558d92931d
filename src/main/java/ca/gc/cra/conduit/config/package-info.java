/**
 * Configuration loading, merging and the composition root.
 * <p><strong>Role:</strong> Turns YAML and CLI {@code key=value} settings into a validated
 * {@link ca.gc.cra.conduit.config.TunnelConfig} and wires services from it.</p>
 * <p><strong>Precedence:</strong> CLI over YAML over built-in defaults.</p>
 */
package ca.gc.cra.conduit.config;
