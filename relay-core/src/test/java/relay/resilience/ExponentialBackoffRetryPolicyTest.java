package relay.resilience;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void doublesFromBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 0, 60_000);

    assertEquals(1000, policy.computeDelayMs(1));
    assertEquals(2000, policy.computeDelayMs(2));
    assertEquals(4000, policy.computeDelayMs(3));
  }

  @Test
  void jitterStaysBelowBound() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 1000, 60_000);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 1000 && delay < 2000, "got: " + delay);
    }
  }

  @Test
  void delayIsCappedBeforeJitter() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 0, 5000);

    assertEquals(5000, policy.computeDelayMs(10));
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 0, 60_000);

    assertEquals(60_000, policy.computeDelayMs(31));
    assertEquals(60_000, policy.computeDelayMs(63));
    assertEquals(60_000, policy.computeDelayMs(1000));
  }

  @Test
  void zeroBaseDelayReturnsZero() {
    assertEquals(0, new ExponentialBackoffRetryPolicy(0, 0, 1000).computeDelayMs(5));
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100, 10_000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsNegativeArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, -1, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 0, -1));
  }
}
