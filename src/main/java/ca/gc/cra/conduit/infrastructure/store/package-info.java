/**
 * In-memory adapters for the profile store and credential vault ports.
 */
package ca.gc.cra.conduit.infrastructure.store;
