/**
 * Protocol envelopes: a tagged variant over question, log_record, monitor_message, result,
 * exception, and heartbeat payloads.
 * <p><strong>Invariants:</strong> ordering numbers strictly increase per (correlation id, sender
 * role); at most one terminal envelope is emitted per correlation id.</p>
 */
package ca.gc.cra.relay.domain.envelope;
