/**
 * Unchecked exceptions mirroring the protocol error kinds.
 * <p><strong>Role:</strong> Domain layer; thrown by content, codec, transport, and invocation code.</p>
 * <p><strong>Retry:</strong> Only {@link ca.gc.cra.relay.domain.error.TransportException} and
 * {@link ca.gc.cra.relay.domain.error.InvocationTimeoutException} are retried automatically.</p>
 */
package ca.gc.cra.relay.domain.error;
