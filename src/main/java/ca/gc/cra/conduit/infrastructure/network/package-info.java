/**
 * Host network observation for reconnect triggering and socket binding hints.
 */
package ca.gc.cra.conduit.infrastructure.network;
