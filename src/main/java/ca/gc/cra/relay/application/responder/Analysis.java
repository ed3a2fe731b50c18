package ca.gc.cra.relay.application.responder;

/**
 * Work a service performs to answer a question.
 *
 * <p>Throw {@link ca.gc.cra.relay.domain.error.AnalysisException} to choose the error kind
 * reported to the asker; any other exception is reported under its simple class name.</p>
 */
@FunctionalInterface
public interface Analysis {
  /**
   * Answers one question.
   *
   * @param context question inputs and the log/monitor side channel
   * @return output values and manifest
   * @throws Exception when the analysis fails
   */
  AnalysisResult run(AnalysisContext context) throws Exception;
}
