/**
 * Asking side of the invocation protocol: the correlation registry, per-invocation ordering and
 * fragment reassembly, and {@link ca.gc.cra.relay.application.invocation.ChildServiceProxy}.
 * <p><strong>Concurrency:</strong> Answer envelopes are handled on transport workers; each
 * invocation's lock serializes its state and stream. Sweeps run on one scheduler thread.</p>
 */
package ca.gc.cra.relay.application.invocation;
