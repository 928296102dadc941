package com.gruelbox.outboxrelay;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Exponential backoff with jitter and a bounded number of attempts.
 *
 * <p>The delay after failed attempt {@code n} is {@code baseDelay * 2^(n-1)} plus a uniformly
 * random jitter in {@code [0, baseDelay/2)}, clamped to {@code maxDelay}. With a base delay of
 * 100ms, attempts 1, 2 and 3 are followed by delays in {@code [100,150)}, {@code [200,250)} and
 * {@code [400,450)} milliseconds.
 *
 * <p>Instances are immutable and may be shared freely.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryPolicy implements Validatable {

  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

  private static final LongUnaryOperator RANDOM_JITTER =
      bound -> ThreadLocalRandom.current().nextLong(bound);

  Duration baseDelay;
  int maxAttempts;
  Duration maxDelay;

  /** Maps an exclusive upper bound in nanoseconds to a jitter value in {@code [0, bound)}. */
  @EqualsAndHashCode.Exclude @ToString.Exclude LongUnaryOperator jitter;

  /**
   * @param baseDelay The delay after the first failed attempt.
   * @param maxAttempts The total number of attempts, including the first. At least 1.
   * @return The policy, with delays clamped to {@link #DEFAULT_MAX_DELAY}.
   */
  public static RetryPolicy exponential(Duration baseDelay, int maxAttempts) {
    return create(baseDelay, maxAttempts, DEFAULT_MAX_DELAY, RANDOM_JITTER);
  }

  /**
   * @param maxDelay The ceiling for any single delay, jitter included.
   * @return A copy of this policy with a different ceiling.
   */
  public RetryPolicy withMaxDelay(Duration maxDelay) {
    return create(baseDelay, maxAttempts, maxDelay, jitter);
  }

  /**
   * @param jitter Maps an exclusive upper bound in nanoseconds to the jitter to add. Mostly useful
   *     to make tests deterministic.
   * @return A copy of this policy using the given jitter source.
   */
  public RetryPolicy withJitter(LongUnaryOperator jitter) {
    return create(baseDelay, maxAttempts, maxDelay, jitter);
  }

  /**
   * @return A copy of this policy which never adds jitter.
   */
  public RetryPolicy withoutJitter() {
    return withJitter(bound -> 0L);
  }

  private static RetryPolicy create(
      Duration baseDelay, int maxAttempts, Duration maxDelay, LongUnaryOperator jitter) {
    RetryPolicy policy = new RetryPolicy(baseDelay, maxAttempts, maxDelay, jitter);
    new Validator().validate(policy);
    return policy;
  }

  /**
   * @param attempt The attempt which just failed, starting at 1.
   * @return How long to wait before the next attempt.
   */
  public Duration nextDelay(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be at least 1, was " + attempt);
    }
    long base = baseDelay.toNanos();
    long max = maxDelay.toNanos();
    int exponent = Math.min(attempt - 1, Long.SIZE - 2);
    long exponential = base > (Long.MAX_VALUE >> exponent) ? Long.MAX_VALUE : base << exponent;
    long bound = base / 2;
    long noise = bound > 0 ? jitter.applyAsLong(bound) : 0L;
    if (noise < 0 || (bound > 0 && noise >= bound)) {
      throw new IllegalStateException("Jitter " + noise + " outside [0, " + bound + ")");
    }
    long total = exponential > Long.MAX_VALUE - noise ? Long.MAX_VALUE : exponential + noise;
    return Duration.ofNanos(Math.min(total, max));
  }

  /**
   * @param attempt The attempt which just failed, starting at 1.
   * @return True if another attempt is allowed.
   */
  public boolean shouldRetry(int attempt) {
    return shouldRetry(attempt, maxAttempts);
  }

  public static boolean shouldRetry(int attempt, int maxAttempts) {
    return attempt < maxAttempts;
  }

  @Override
  public void validate(Validator validator) {
    validator.positive("baseDelay", baseDelay);
    validator.min("maxAttempts", maxAttempts, 1);
    validator.positive("maxDelay", maxDelay);
    validator.isTrue(
        "maxDelay",
        maxDelay.compareTo(baseDelay) >= 0,
        "must not be less than baseDelay (%s), was %s",
        baseDelay,
        maxDelay);
    validator.notNull("jitter", jitter);
  }
}
