/**
 * Command-line entry points: {@code connect}, {@code probe}, {@code inspect} and {@code export}.
 * <p><strong>Role:</strong> Driving adapter; parses {@code key=value} arguments, merges YAML config, configures
 * logging and telemetry, then hands off to the composition root.</p>
 * <p><strong>Security:</strong> Share links carry the credential; argument and parse errors are logged with UUIDs
 * redacted.</p>
 */
package ca.gc.cra.conduit.api;
