package ca.gc.cra.relay.domain.error;

/**
 * Raised when two datafiles with the same name are added to one dataset.
 *
 * @since 0.1.0
 */
public final class DuplicateNameException extends RelayException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a duplicate-name failure.
   *
   * @param datasetName dataset being built
   * @param datafileName colliding datafile name
   */
  public DuplicateNameException(String datasetName, String datafileName) {
    super("Dataset '" + datasetName + "' already contains a datafile named '" + datafileName + "'");
  }

  @Override
  public String kind() {
    return "DuplicateNameError";
  }
}
