package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.domain.content.Manifest;

/**
 * Successful answer returned by {@link ChildServiceProxy#awaitAnswer}.
 *
 * @param outputValues output values produced by the child
 * @param outputManifest output manifest; may be {@code null}
 * @param correlationId correlation id of the attempt that answered
 */
public record Answer(Object outputValues, Manifest outputManifest, String correlationId) {}
