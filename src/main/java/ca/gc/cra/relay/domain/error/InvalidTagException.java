package ca.gc.cra.relay.domain.error;

/**
 * Raised when a tag applied to a datafile or dataset does not match the tag grammar.
 *
 * @since 0.1.0
 */
public final class InvalidTagException extends RelayException {
  private static final long serialVersionUID = 1L;

  public InvalidTagException(String tag) {
    super("Invalid tag '" + tag + "': tags are lowercase [a-z0-9], may contain ':' or '-', "
        + "and must not end with either");
  }

  @Override
  public String kind() {
    return "InvalidTagError";
  }
}
