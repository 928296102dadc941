package com.gruelbox.outboxrelay;

/**
 * A listener for events fired by {@link OutboxRelay}. Exceptions thrown by listener methods are
 * logged and otherwise ignored; they never affect delivery.
 */
public interface OutboxRelayListener {

  OutboxRelayListener EMPTY = new OutboxRelayListener() {};

  /**
   * Fired when {@link OutboxRelay#schedule(OutboxEvent)} has durably appended an event, before it
   * is submitted for delivery.
   *
   * @param event The event scheduled.
   */
  default void scheduled(OutboxEvent event) {
    // No-op
  }

  /**
   * Fired when an event has been delivered <em>and</em> recorded as processed, so it will not be
   * attempted again. Delivery is at-least-once: the sink may have seen the event any number of
   * times before this fires.
   *
   * @param event The event, in {@link EventStatus#PROCESSED}.
   * @param attempts The number of attempts made in this run, including the successful one.
   */
  default void success(OutboxEvent event, int attempts) {
    // No-op
  }

  /**
   * Fired each time a delivery attempt fails. If the failure is permanent or the attempt was the
   * last allowed, this is followed by {@link #failed(OutboxEvent, Throwable)}.
   *
   * @param event The event, still pending.
   * @param attempt The attempt which failed, starting at 1.
   * @param cause The failure.
   */
  default void failure(OutboxEvent event, int attempt, Throwable cause) {
    // No-op
  }

  /**
   * Fired once an event has been recorded as failed and will not be attempted again.
   *
   * @param event The event, in {@link EventStatus#FAILED}.
   * @param cause The failure which ended delivery: a {@link PermanentDeliveryException} or a {@link
   *     RetriesExhaustedException}.
   */
  default void failed(OutboxEvent event, Throwable cause) {
    // No-op
  }

  /**
   * Fired when a scan of the store skipped corrupt or duplicate records.
   *
   * @param count The number skipped.
   */
  default void skippedRecords(int count) {
    // No-op
  }

  /**
   * Chains this listener with another and returns the result.
   *
   * @param other The other listener. It will always be called after this one.
   * @return The combined listener.
   */
  default OutboxRelayListener andThen(OutboxRelayListener other) {
    var self = this;
    return new OutboxRelayListener() {

      @Override
      public void scheduled(OutboxEvent event) {
        self.scheduled(event);
        other.scheduled(event);
      }

      @Override
      public void success(OutboxEvent event, int attempts) {
        self.success(event, attempts);
        other.success(event, attempts);
      }

      @Override
      public void failure(OutboxEvent event, int attempt, Throwable cause) {
        self.failure(event, attempt, cause);
        other.failure(event, attempt, cause);
      }

      @Override
      public void failed(OutboxEvent event, Throwable cause) {
        self.failed(event, cause);
        other.failed(event, cause);
      }

      @Override
      public void skippedRecords(int count) {
        self.skippedRecords(count);
        other.skippedRecords(count);
      }
    };
  }
}
