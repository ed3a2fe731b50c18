package ca.gc.cra.relay.infrastructure.storage;

import ca.gc.cra.relay.application.port.StoragePort;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StoragePort} for {@code file:} URIs. Writes go to a sibling temp file first and are
 * moved into place so readers never observe partial content.
 */
public final class FileSystemStorageAdapter implements StoragePort {
  private static final Logger log = LoggerFactory.getLogger(FileSystemStorageAdapter.class);

  @Override
  public byte[] readBytes(URI uri) throws IOException {
    return Files.readAllBytes(toPath(uri));
  }

  @Override
  public void writeBytes(URI uri, byte[] bytes) throws IOException {
    Objects.requireNonNull(bytes, "bytes");
    Path target = toPath(uri);
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".part");
    try {
      Files.write(temp, bytes);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
    log.debug("Wrote {} bytes to {}", bytes.length, target);
  }

  @Override
  public Optional<Instant> lastModified(URI uri) throws IOException {
    return Optional.of(Files.getLastModifiedTime(toPath(uri)).toInstant());
  }

  @Override
  public boolean supports(URI uri) {
    return uri != null && "file".equalsIgnoreCase(uri.getScheme());
  }

  private Path toPath(URI uri) throws IOException {
    Objects.requireNonNull(uri, "uri");
    if (!supports(uri)) {
      throw new IOException("Unsupported storage scheme for " + uri);
    }
    return Path.of(uri);
  }
}
