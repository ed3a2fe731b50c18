package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to deadline and reorder-timeout logic.
 * <p><strong>Why:</strong> Lets tests drive deadlines deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the sweeper and handler
 * workers read the clock concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
