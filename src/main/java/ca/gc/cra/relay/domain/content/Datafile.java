package ca.gc.cra.relay.domain.content;

import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable reference to one file held in storage, with integrity metadata.
 * <p><strong>Why:</strong> Lets services exchange data by URI while receivers can verify content.</p>
 * <p><strong>Role:</strong> Leaf of the content model; grouped into {@link Dataset}s.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * @param id unique identifier
 * @param name file name, unique within a dataset
 * @param location absolute storage URI; relative locations are rejected
 * @param sizeBytes content size in bytes
 * @param checksum CRC32C of the content, base64 of the big-endian 4-byte value
 * @param lastModified time the content was registered or last modified
 * @param metadata free-form string metadata
 * @param tags validated tags
 * @since 0.1.0
 */
public record Datafile(
    String id,
    String name,
    URI location,
    long sizeBytes,
    String checksum,
    Instant lastModified,
    Map<String, String> metadata,
    Set<String> tags) {

  public Datafile {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(checksum, "checksum");
    Objects.requireNonNull(lastModified, "lastModified");
    if (!location.isAbsolute()) {
      throw new IllegalArgumentException("Datafile location must be an absolute URI: " + location);
    }
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be non-negative");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    tags = Tags.validated(tags);
  }

  /**
   * Returns a copy of this datafile pointing at a different storage location.
   *
   * @param newLocation absolute URI of the relocated content
   * @return relocated datafile with identical integrity metadata
   */
  public Datafile relocatedTo(URI newLocation) {
    return new Datafile(id, name, newLocation, sizeBytes, checksum, lastModified, metadata, tags);
  }
}
