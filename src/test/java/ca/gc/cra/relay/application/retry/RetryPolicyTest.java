package ca.gc.cra.relay.application.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffDoublesUpToCap() {
    RetryPolicy policy = new RetryPolicy(6, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));

    assertEquals(Duration.ofSeconds(1), policy.delayBefore(1));
    assertEquals(Duration.ofSeconds(2), policy.delayBefore(2));
    assertEquals(Duration.ofSeconds(4), policy.delayBefore(3));
    assertEquals(Duration.ofSeconds(5), policy.delayBefore(4));
    assertEquals(Duration.ofSeconds(5), policy.delayBefore(6));
    assertEquals(7, policy.maxAttempts());
  }

  @Test
  void noneMeansSingleAttempt() {
    assertEquals(1, RetryPolicy.NONE.maxAttempts());
    assertEquals(3, RetryPolicy.withRetries(2).maxAttempts());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(-1, Duration.ZERO, 2.0, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(2)));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ofSeconds(3), 2.0, Duration.ofSeconds(2)));
  }
}
