/**
 * Validation helpers shared by configuration parsing.
 */
package ca.gc.cra.relay.validation;
