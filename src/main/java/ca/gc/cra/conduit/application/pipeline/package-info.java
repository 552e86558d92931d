/**
 * Long-running use cases that move payload bytes between a local packet channel and the tunnel.
 */
package ca.gc.cra.conduit.application.pipeline;
