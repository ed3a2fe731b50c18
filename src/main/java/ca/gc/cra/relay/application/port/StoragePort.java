package ca.gc.cra.relay.application.port;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.Optional;

/**
 * Black-box byte storage addressed by absolute URI.
 *
 * @since 0.1.0
 */
public interface StoragePort {
  /**
   * Reads the full content at {@code uri}.
   *
   * @param uri absolute location
   * @return content bytes
   * @throws IOException when the content cannot be read
   */
  byte[] readBytes(URI uri) throws IOException;

  /**
   * Writes {@code bytes} to {@code uri}, replacing existing content.
   *
   * @param uri absolute location
   * @param bytes content
   * @throws IOException when the content cannot be written
   */
  void writeBytes(URI uri, byte[] bytes) throws IOException;

  /**
   * Indicates whether this storage handles the URI scheme.
   *
   * @param uri absolute location
   * @return {@code true} when supported
   */
  boolean supports(URI uri);

  /**
   * Returns when the content at {@code uri} was last modified, where the storage records it.
   *
   * @param uri absolute location
   * @return modification time, or empty when the storage keeps none
   * @throws IOException when the content cannot be inspected
   */
  default Optional<Instant> lastModified(URI uri) throws IOException {
    return Optional.empty();
  }
}
