package ca.gc.cra.relay.infrastructure.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemStorageAdapterTest {
  @TempDir Path tempDir;

  private final FileSystemStorageAdapter storage = new FileSystemStorageAdapter();

  @Test
  void writeCreatesParentsAndLeavesNoPartFiles() throws IOException {
    URI target = tempDir.resolve("nested/dir/out.bin").toUri();

    storage.writeBytes(target, new byte[] {7, 8, 9});

    assertArrayEquals(new byte[] {7, 8, 9}, storage.readBytes(target));
    try (Stream<Path> files = Files.list(tempDir.resolve("nested/dir"))) {
      assertEquals(1L, files.count());
    }
  }

  @Test
  void writeReplacesExistingContent() throws IOException {
    URI target = tempDir.resolve("out.txt").toUri();
    storage.writeBytes(target, "first".getBytes());
    storage.writeBytes(target, "second".getBytes());

    assertEquals("second", Files.readString(Path.of(target)));
  }

  @Test
  void lastModifiedIsTheFileModificationTime() throws IOException {
    Path file = tempDir.resolve("dated.bin");
    Files.write(file, new byte[] {1});
    Instant stamp = Instant.parse("2022-02-02T02:02:02Z");
    Files.setLastModifiedTime(file, FileTime.from(stamp));

    assertEquals(stamp, storage.lastModified(file.toUri()).orElseThrow());
    assertThrows(IOException.class, () -> storage.lastModified(tempDir.resolve("missing.bin").toUri()));
  }

  @Test
  void onlyFileSchemeIsSupported() {
    assertTrue(storage.supports(URI.create("file:///tmp/x")));
    assertFalse(storage.supports(URI.create("gs://bucket/x")));
    assertThrows(IOException.class, () -> storage.readBytes(URI.create("gs://bucket/x")));
  }
}
