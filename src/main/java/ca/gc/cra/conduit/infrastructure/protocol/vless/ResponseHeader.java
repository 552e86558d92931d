package ca.gc.cra.conduit.infrastructure.protocol.vless;

/**
 * Decoded response header.
 *
 * @param version version byte echoed by the server
 * @param addonsLength length of the skipped addons block
 * @param length total header length; payload starts at this offset
 * @since 0.1.0
 */
public record ResponseHeader(int version, int addonsLength, int length) {}
