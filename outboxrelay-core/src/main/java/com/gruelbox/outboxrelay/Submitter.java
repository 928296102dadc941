package com.gruelbox.outboxrelay;

import java.util.concurrent.Executor;
import java.util.function.Consumer;

/** Called by {@link OutboxRelay} to hand events to worker threads for delivery. */
public interface Submitter extends AutoCloseable {

  /**
   * Delivers using a caller-supplied {@link Executor}, which remains owned by the caller.
   *
   * <p>Shortcut for {@code ExecutorSubmitter.builder().executor(executor).build()}.
   *
   * @param executor The executor.
   * @return The submitter.
   */
  static Submitter withExecutor(Executor executor) {
    return ExecutorSubmitter.builder().executor(executor).build();
  }

  /**
   * Delivers on a fixed pool of {@code concurrency} daemon threads with a bounded queue.
   *
   * @param concurrency The number of worker threads, and so the most deliveries in flight at once.
   * @return The submitter.
   */
  static Submitter withConcurrency(int concurrency) {
    return ExecutorSubmitter.builder().concurrency(concurrency).build();
  }

  /**
   * Submits an event for delivery. The {@code localExecutor} performs the whole delivery cycle for
   * the event when called. Implementations should normally call it on another thread; calling it
   * directly makes delivery synchronous, which is occasionally useful in tests.
   *
   * @param event The event to deliver.
   * @param localExecutor Runs the delivery.
   * @return False if the work was refused, e.g. because a queue is full. The event stays pending
   *     and is picked up by a later pass.
   */
  boolean submit(OutboxEvent event, Consumer<OutboxEvent> localExecutor);

  /**
   * Releases any releasable resource. The instance becomes unusable after calling this method.
   */
  @Override
  default void close() {}
}
