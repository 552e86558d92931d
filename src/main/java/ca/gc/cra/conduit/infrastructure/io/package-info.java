/**
 * Local byte-stream adapters for the {@link ca.gc.cra.conduit.application.port.PacketChannel} port.
 */
package ca.gc.cra.conduit.infrastructure.io;
