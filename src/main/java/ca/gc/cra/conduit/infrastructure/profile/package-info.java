/**
 * Import and export of server profiles: the {@code vless://} share-link parser and exporter and JSON renderings.
 * <p><strong>Security:</strong> Parse errors and inspection output are redacted; only the exporters emit the
 * credential, because their output is the secret by definition.</p>
 */
package ca.gc.cra.conduit.infrastructure.profile;
