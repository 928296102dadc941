package com.gruelbox.outboxrelay;

import lombok.Getter;

/** An event failed on every attempt its {@link RetryPolicy} allowed. */
public class RetriesExhaustedException extends Exception {

  @Getter private final String eventId;
  @Getter private final int attempts;

  public RetriesExhaustedException(String eventId, int attempts, Throwable lastFailure) {
    super(
        String.format(
            "Gave up on event %s after %d attempts: %s", eventId, attempts, lastFailure),
        lastFailure);
    this.eventId = eventId;
    this.attempts = attempts;
  }
}
