package ca.gc.cra.relay.domain.envelope;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * <strong>What:</strong> Generates ULID-style opaque identifiers for correlating questions and answers.
 * <p><strong>Why:</strong> Provides sortable, practically unique correlation ids; a retried question
 * always receives a fresh one.</p>
 * <p><strong>Thread-safety:</strong> Stateless static methods leveraging {@link ThreadLocalRandom}.</p>
 *
 * @since 0.1.0
 */
public final class CorrelationIds {
  private static final char[] ENC = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

  private CorrelationIds() {}

  /**
   * Generates a lexicographically sortable identifier composed of timestamp and random bits.
   *
   * @return 26-character identifier
   * @implNote Uses {@link ThreadLocalRandom}; not suitable for cryptographic purposes.
   */
  public static String newId() {
    return newId(Instant.now().toEpochMilli());
  }

  /**
   * Generates an identifier using the provided timestamp.
   *
   * @param epochMillis epoch milliseconds component for the identifier
   * @return 26-character identifier
   */
  public static String newId(long epochMillis) {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    char[] out = new char[26];
    encodeTime(epochMillis, out);
    encodeRandom(random.nextLong(), random.nextLong(), out);
    return new String(out);
  }

  private static void encodeTime(long v, char[] d) {
    for (int i = 9; i >= 0; i--) {
      d[i] = ENC[(int) (v & 31)];
      v >>>= 5;
    }
  }

  // 80 random bits across positions 10..25; the high part comes from r1, the low 48 bits from r2.
  private static void encodeRandom(long r1, long r2, char[] d) {
    long high = (r1 << 16) | ((r2 >>> 48) & 0xFFFFL);
    long low = r2 & 0x0000FFFFFFFFFFFFL;
    for (int i = 25; i >= 18; i--) {
      d[i] = ENC[(int) (low & 31)];
      low >>>= 5;
    }
    for (int i = 17; i >= 10; i--) {
      d[i] = ENC[(int) (high & 31)];
      high >>>= 5;
    }
  }
}
