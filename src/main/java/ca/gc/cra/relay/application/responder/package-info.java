/**
 * Answering side of the invocation protocol.
 */
package ca.gc.cra.relay.application.responder;
