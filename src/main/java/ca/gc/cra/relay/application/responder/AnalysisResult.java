package ca.gc.cra.relay.application.responder;

import ca.gc.cra.relay.domain.content.Manifest;

/**
 * Output of an {@link Analysis}.
 *
 * @param outputValues JSON-compatible output values
 * @param outputManifest output manifest; may be {@code null}
 */
public record AnalysisResult(Object outputValues, Manifest outputManifest) {

  public static AnalysisResult of(Object outputValues) {
    return new AnalysisResult(outputValues, null);
  }
}
