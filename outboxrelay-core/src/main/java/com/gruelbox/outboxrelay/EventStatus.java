package com.gruelbox.outboxrelay;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Lifecycle of an {@link OutboxEvent}. {@link #PROCESSED} and {@link #FAILED} are terminal. */
@RequiredArgsConstructor
public enum EventStatus {
  PENDING("pending"),
  PROCESSED("processed"),
  FAILED("failed");

  /** The token written to persisted records. */
  @Getter private final String token;

  public boolean isTerminal() {
    return this != PENDING;
  }

  public static Optional<EventStatus> fromToken(String token) {
    return Arrays.stream(values()).filter(it -> it.token.equals(token)).findFirst();
  }
}
