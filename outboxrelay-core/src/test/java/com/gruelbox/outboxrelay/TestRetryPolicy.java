package com.gruelbox.outboxrelay;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class TestRetryPolicy {

  private final RetryPolicy policy = RetryPolicy.exponential(Duration.ofMillis(100), 5);

  @RepeatedTest(20)
  void delaysDoubleWithBoundedJitter() {
    assertBetween(policy.nextDelay(1), 100, 150);
    assertBetween(policy.nextDelay(2), 200, 250);
    assertBetween(policy.nextDelay(3), 400, 450);
  }

  @Test
  void withoutJitterDelaysAreExact() {
    RetryPolicy exact = policy.withoutJitter();
    assertThat(exact.nextDelay(1), equalTo(Duration.ofMillis(100)));
    assertThat(exact.nextDelay(2), equalTo(Duration.ofMillis(200)));
    assertThat(exact.nextDelay(4), equalTo(Duration.ofMillis(800)));
  }

  @Test
  void jitterIsAdded() {
    RetryPolicy fixed = policy.withJitter(bound -> bound - 1);
    assertThat(fixed.nextDelay(1), equalTo(Duration.ofNanos(150_000_000L - 1)));
  }

  @Test
  void delaysAreClamped() {
    assertThat(policy.withoutJitter().nextDelay(30), equalTo(RetryPolicy.DEFAULT_MAX_DELAY));
    assertThat(policy.nextDelay(Integer.MAX_VALUE), equalTo(RetryPolicy.DEFAULT_MAX_DELAY));
    RetryPolicy tight = policy.withMaxDelay(Duration.ofMillis(300)).withoutJitter();
    assertThat(tight.nextDelay(2), equalTo(Duration.ofMillis(200)));
    assertThat(tight.nextDelay(3), equalTo(Duration.ofMillis(300)));
  }

  @Test
  void delaysNeverDecrease() {
    RetryPolicy exact = policy.withoutJitter();
    for (int attempt = 1; attempt < 70; attempt++) {
      assertThat(
          exact.nextDelay(attempt + 1), greaterThanOrEqualTo(exact.nextDelay(attempt)));
    }
  }

  @Test
  void shouldRetryBelowMaxAttempts() {
    assertTrue(policy.shouldRetry(1));
    assertTrue(policy.shouldRetry(4));
    assertFalse(policy.shouldRetry(5));
    assertFalse(policy.shouldRetry(6));
    assertFalse(RetryPolicy.shouldRetry(1, 1));
    assertTrue(RetryPolicy.shouldRetry(2, 3));
  }

  @Test
  void rejectsBadSettings() {
    assertThrows(
        IllegalArgumentException.class, () -> RetryPolicy.exponential(Duration.ZERO, 3));
    assertThrows(
        IllegalArgumentException.class, () -> RetryPolicy.exponential(Duration.ofMillis(-1), 3));
    assertThrows(
        IllegalArgumentException.class, () -> RetryPolicy.exponential(Duration.ofMillis(10), 0));
    assertThrows(
        IllegalArgumentException.class, () -> policy.withMaxDelay(Duration.ofMillis(50)));
    assertThrows(IllegalArgumentException.class, () -> policy.withJitter(null));
    assertThrows(IllegalArgumentException.class, () -> policy.nextDelay(0));
  }

  @Test
  void rejectsOutOfRangeJitter() {
    assertThrows(IllegalStateException.class, () -> policy.withJitter(bound -> bound).nextDelay(1));
    assertThrows(IllegalStateException.class, () -> policy.withJitter(bound -> -1).nextDelay(1));
  }

  private static void assertBetween(Duration delay, long fromMillis, long toMillisExclusive) {
    assertThat(delay, greaterThanOrEqualTo(Duration.ofMillis(fromMillis)));
    assertThat(delay, lessThan(Duration.ofMillis(toMillisExclusive)));
  }
}
