/**
 * Executor factories used by transports, the invoker sweeper, and the responder analysis pool.
 */
package ca.gc.cra.relay.infrastructure.exec;
