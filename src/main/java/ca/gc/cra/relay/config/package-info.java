/**
 * Configuration binding and wiring of RELAY services.
 */
package ca.gc.cra.relay.config;
