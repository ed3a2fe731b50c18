package ca.gc.cra.relay.domain.error;

import java.net.URI;

/**
 * Raised when the checksum computed for a datafile's bytes differs from the declared checksum.
 *
 * @since 0.1.0
 */
public final class ChecksumMismatchException extends RelayException {
  private static final long serialVersionUID = 1L;

  private final URI location;
  private final String declared;
  private final String computed;

  /**
   * Creates a mismatch report for a datafile location.
   *
   * @param location file location being registered
   * @param declared checksum supplied by the caller
   * @param computed checksum computed from the content bytes
   */
  public ChecksumMismatchException(URI location, String declared, String computed) {
    super("Checksum mismatch for " + location + ": declared " + declared + " but content is " + computed);
    this.location = location;
    this.declared = declared;
    this.computed = computed;
  }

  public URI location() {
    return location;
  }

  public String declared() {
    return declared;
  }

  public String computed() {
    return computed;
  }

  @Override
  public String kind() {
    return "ChecksumMismatchError";
  }
}
