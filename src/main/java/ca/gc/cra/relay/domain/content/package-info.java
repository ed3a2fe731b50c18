/**
 * Content model: addressable file collections with integrity metadata.
 * <p><strong>Role:</strong> Domain values exchanged inside question and result envelopes.</p>
 * <p><strong>Concurrency:</strong> All types are immutable records.</p>
 */
package ca.gc.cra.relay.domain.content;
