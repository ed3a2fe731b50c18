/** Backoff policy shared by transports and the invoker. */
package ca.gc.cra.relay.application.retry;
