/**
 * VLESS header codec and the session that runs it over a transport.
 * <p><strong>Concurrency:</strong> One codec and one session per connection attempt.</p>
 * <p><strong>Security:</strong> Only {@link ca.gc.cra.conduit.infrastructure.protocol.vless.VlessCodec} reads raw
 * credential bytes.</p>
 */
package ca.gc.cra.conduit.infrastructure.protocol.vless;
