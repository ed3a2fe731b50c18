package ca.gc.cra.relay.application.content;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.StoragePort;
import ca.gc.cra.relay.domain.content.Datafile;
import ca.gc.cra.relay.domain.content.Dataset;
import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.error.ChecksumMismatchException;
import ca.gc.cra.relay.domain.error.DuplicateNameException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds datafiles, datasets, and manifests with integrity checks.
 * <p><strong>Why:</strong> Content must be verified at registration so a corrupted file never
 * reaches a dataset or crosses the bus.</p>
 * <p><strong>Role:</strong> Application service used by askers before sending a question and by
 * analyses before answering.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected ports; safe for concurrent use
 * when the {@link StoragePort} is.</p>
 *
 * @since 0.1.0
 */
public final class ContentModel {
  private static final Logger log = LoggerFactory.getLogger(ContentModel.class);

  private final StoragePort storage;
  private final ClockPort clock;

  public ContentModel(StoragePort storage, ClockPort clock) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Registers a local file, converting its path to an absolute {@code file:} URI.
   *
   * @param path local file path
   * @return registered datafile
   * @throws IOException when the file cannot be read
   */
  public Datafile register(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    return register(path.toAbsolutePath().normalize().toUri(), null, Map.of(), Set.of());
  }

  /**
   * Registers the content at {@code location}, computing its size and checksum.
   *
   * @param location absolute URI of the content
   * @param declaredChecksum checksum the caller expects, or {@code null} to skip the comparison
   * @param metadata free-form metadata; may be empty
   * @param tags tags to attach; may be empty
   * @return registered datafile
   * @throws IOException when the content cannot be read
   * @throws ChecksumMismatchException when {@code declaredChecksum} differs from the content's checksum
   */
  public Datafile register(
      URI location, String declaredChecksum, Map<String, String> metadata, Collection<String> tags)
      throws IOException {
    return register(location, declaredChecksum, null, metadata, tags);
  }

  /**
   * Registers the content at {@code location} with an explicit modification time.
   *
   * <p>Without a declared time the storage's own modification time is used, and the current time
   * when the storage keeps none.</p>
   *
   * @param location absolute URI of the content
   * @param declaredChecksum checksum the caller expects, or {@code null} to skip the comparison
   * @param declaredLastModified modification time to record, or {@code null}
   * @param metadata free-form metadata; may be empty
   * @param tags tags to attach; may be empty
   * @return registered datafile
   * @throws IOException when the content cannot be read
   * @throws ChecksumMismatchException when {@code declaredChecksum} differs from the content's checksum
   */
  public Datafile register(
      URI location,
      String declaredChecksum,
      Instant declaredLastModified,
      Map<String, String> metadata,
      Collection<String> tags)
      throws IOException {
    Objects.requireNonNull(location, "location");
    if (!location.isAbsolute()) {
      throw new IllegalArgumentException("Datafile location must be an absolute URI: " + location);
    }
    byte[] content = storage.readBytes(location);
    String computed = Checksums.crc32c(content);
    if (declaredChecksum != null && !declaredChecksum.equals(computed)) {
      log.warn("Rejecting {}: declared checksum {} but content is {}", location, declaredChecksum, computed);
      throw new ChecksumMismatchException(location, declaredChecksum, computed);
    }
    Datafile datafile = new Datafile(
        UUID.randomUUID().toString(),
        nameOf(location),
        location,
        content.length,
        computed,
        declaredLastModified != null ? declaredLastModified : lastModified(location),
        metadata,
        tags == null ? Set.of() : Set.copyOf(tags));
    log.debug("Registered datafile {} ({} bytes, crc32c {})", location, content.length, computed);
    return datafile;
  }

  private Instant lastModified(URI location) throws IOException {
    Optional<Instant> recorded = storage.lastModified(location);
    return recorded.isPresent() ? recorded.get() : Instant.ofEpochMilli(clock.nowMillis());
  }

  /**
   * Re-reads a datafile's content and checks it against the recorded checksum.
   *
   * @param datafile datafile to verify
   * @throws IOException when the content cannot be read
   * @throws ChecksumMismatchException when the content changed since registration
   */
  public void verify(Datafile datafile) throws IOException {
    Objects.requireNonNull(datafile, "datafile");
    String computed = Checksums.crc32c(storage.readBytes(datafile.location()));
    if (!computed.equals(datafile.checksum())) {
      throw new ChecksumMismatchException(datafile.location(), datafile.checksum(), computed);
    }
  }

  /**
   * Copies a datafile's content to a new location and returns the relocated datafile.
   *
   * @param datafile registered datafile
   * @param target absolute URI to copy to
   * @return datafile pointing at {@code target} with identical integrity metadata
   * @throws IOException when reading or writing fails
   * @throws ChecksumMismatchException when the source content no longer matches its checksum
   */
  public Datafile upload(Datafile datafile, URI target) throws IOException {
    Objects.requireNonNull(datafile, "datafile");
    Objects.requireNonNull(target, "target");
    byte[] content = storage.readBytes(datafile.location());
    String computed = Checksums.crc32c(content);
    if (!computed.equals(datafile.checksum())) {
      throw new ChecksumMismatchException(datafile.location(), datafile.checksum(), computed);
    }
    storage.writeBytes(target, content);
    log.info("Uploaded datafile {} to {}", datafile.name(), target);
    return datafile.relocatedTo(target);
  }

  /**
   * Builds a dataset from registered datafiles.
   *
   * @param name dataset name
   * @param datafiles member datafiles
   * @return dataset
   * @throws DuplicateNameException when two datafiles share a name
   */
  public Dataset buildDataset(String name, Collection<Datafile> datafiles) {
    return buildDataset(name, datafiles, Set.of());
  }

  /**
   * Builds a tagged dataset from registered datafiles.
   *
   * @param name dataset name
   * @param datafiles member datafiles
   * @param tags dataset tags
   * @return dataset
   * @throws DuplicateNameException when two datafiles share a name
   */
  public Dataset buildDataset(String name, Collection<Datafile> datafiles, Collection<String> tags) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(datafiles, "datafiles");
    Set<String> names = new HashSet<>();
    for (Datafile datafile : datafiles) {
      if (!names.add(datafile.name())) {
        throw new DuplicateNameException(name, datafile.name());
      }
    }
    return new Dataset(UUID.randomUUID().toString(), name, Set.copyOf(datafiles),
        tags == null ? Set.of() : Set.copyOf(tags));
  }

  /**
   * Builds a manifest from datasets keyed by logical key.
   *
   * @param datasetsByKey datasets by key such as {@code input}
   * @return manifest stamped with the current time
   */
  public Manifest buildManifest(Map<String, Dataset> datasetsByKey) {
    Objects.requireNonNull(datasetsByKey, "datasetsByKey");
    return new Manifest(UUID.randomUUID().toString(), Instant.ofEpochMilli(clock.nowMillis()), datasetsByKey);
  }

  private static String nameOf(URI location) {
    String path = location.getPath();
    if (path == null || path.isEmpty()) {
      path = location.getSchemeSpecificPart();
    }
    int slash = path.lastIndexOf('/');
    String name = slash >= 0 ? path.substring(slash + 1) : path;
    if (name.isBlank()) {
      throw new IllegalArgumentException("Cannot derive a file name from " + location);
    }
    return name;
  }
}
