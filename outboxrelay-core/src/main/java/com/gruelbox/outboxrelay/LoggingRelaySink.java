package com.gruelbox.outboxrelay;

import lombok.extern.slf4j.Slf4j;

/** A {@link RelaySink} which just logs each event. Handy for wiring checks and local runs. */
@Slf4j
public final class LoggingRelaySink implements RelaySink {

  @Override
  public void deliver(OutboxEvent event) {
    log.info("Relayed {}", event.description());
  }
}
