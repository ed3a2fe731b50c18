/**
 * Asker-side invocation states and outcomes.
 */
package ca.gc.cra.relay.domain.invocation;
