/**
 * Ports between the invocation protocol and its collaborators: the message bus, the envelope
 * codec, schema validation, byte storage, metrics, and time.
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe; handler workers, analysis
 * workers, and the sweeper call them concurrently.</p>
 */
package ca.gc.cra.relay.application.port;
