package ca.gc.cra.relay.application.content;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.zip.CRC32C;

/**
 * CRC32C checksums encoded as base64 of the big-endian 4-byte value, the encoding object stores
 * publish for their {@code crc32c} metadata.
 *
 * @since 0.1.0
 */
public final class Checksums {
  private Checksums() {}

  /**
   * Computes the encoded CRC32C of {@code bytes}.
   *
   * @param bytes content
   * @return base64 checksum, e.g. {@code AAAAAA==} for empty content
   */
  public static String crc32c(byte[] bytes) {
    CRC32C crc = new CRC32C();
    crc.update(bytes, 0, bytes.length);
    byte[] raw = ByteBuffer.allocate(4).putInt((int) crc.getValue()).array();
    return Base64.getEncoder().encodeToString(raw);
  }
}
