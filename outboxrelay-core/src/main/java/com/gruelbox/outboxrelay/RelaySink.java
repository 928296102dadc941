package com.gruelbox.outboxrelay;

/**
 * The external target events are relayed to: a network call, a broker publish, a database write.
 * Supplied by the caller when building an {@link OutboxRelay}.
 *
 * <p>Delivery is at-least-once. A sink may see the same event more than once, e.g. if the process
 * dies after a successful {@link #deliver(OutboxEvent)} but before the store records it, so
 * implementations should be idempotent on {@link OutboxEvent#getId()}.
 */
@FunctionalInterface
public interface RelaySink {

  /**
   * Delivers one event. May block. Never called concurrently for the same event id.
   *
   * @param event The event.
   * @throws PermanentDeliveryException If the event can never be delivered. It will be failed
   *     without further attempts.
   * @throws Exception Any other failure, which is treated as transient and retried according to
   *     the {@link RetryPolicy}.
   */
  void deliver(OutboxEvent event) throws Exception;
}
