/**
 * Logging backend helpers.
 */
package ca.gc.cra.relay.logging;
