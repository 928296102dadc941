package com.gruelbox.outboxrelay;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A one-way cancellation flag which relay tasks check at every point they might wait: before each
 * delivery attempt and during each backoff delay. Cancellation is cooperative; nothing is
 * interrupted.
 */
public final class CancellationToken {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Waits for the given duration, returning early if cancelled.
   *
   * @param duration How long to wait.
   * @return True if the token was cancelled before or during the wait.
   * @throws InterruptedException If the waiting thread is interrupted.
   */
  public boolean await(Duration duration) throws InterruptedException {
    return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
  }
}
