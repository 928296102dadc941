package com.gruelbox.outboxrelay;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

/**
 * Delivers events using a local {@link Executor}.
 *
 * <p>A caller-supplied executor should use a <strong>bounded</strong> queue and a {@link
 * java.util.concurrent.RejectedExecutionHandler} which throws, such as the default {@link
 * ThreadPoolExecutor.AbortPolicy}. It should not run work in the calling thread (such as {@link
 * ThreadPoolExecutor.CallerRunsPolicy}), since that can stall the poll loop behind a slow sink.
 * Rejected events simply stay pending, so the store absorbs any backpressure. Work dropped by a
 * discarding handler is only noticed once {@link
 * OutboxRelay.OutboxRelayBuilder#startTimeout(java.time.Duration)} expires.
 */
@Slf4j
public class ExecutorSubmitter implements Submitter, Validatable {

  static final int DEFAULT_QUEUE_CAPACITY = 16384;

  private final Executor executor;
  private final boolean shutdownExecutorOnClose;
  private final Level logLevelWorkQueueSaturation;

  ExecutorSubmitter(
      Executor executor, int concurrency, int queueCapacity, Level logLevelWorkQueueSaturation) {
    if (executor != null) {
      this.executor = executor;
      shutdownExecutorOnClose = false;
    } else {
      new Validator().min("concurrency", concurrency, 1);
      new Validator().min("queueCapacity", queueCapacity, 1);
      this.executor =
          new ThreadPoolExecutor(
              concurrency,
              concurrency,
              0L,
              TimeUnit.MILLISECONDS,
              new ArrayBlockingQueue<>(queueCapacity),
              new NamedThreadFactory("outbox-relay-worker-"));
      shutdownExecutorOnClose = true;
    }
    this.logLevelWorkQueueSaturation = logLevelWorkQueueSaturation;
    new Validator().validate(this);
  }

  public static ExecutorSubmitterBuilder builder() {
    return new ExecutorSubmitterBuilder();
  }

  @Override
  public boolean submit(OutboxEvent event, Consumer<OutboxEvent> localExecutor) {
    try {
      executor.execute(() -> localExecutor.accept(event));
      log.debug("Submitted {} for delivery", event.description());
      return true;
    } catch (RejectedExecutionException e) {
      Utils.logAtLevel(
          log,
          logLevelWorkQueueSaturation,
          "Work queue full; {} will be delivered on a later pass",
          event.description());
      return false;
    } catch (Exception e) {
      log.warn(
          "Failed to submit {} for delivery. It will be re-attempted later.",
          event.description(),
          e);
      return false;
    }
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("executor", executor);
    validator.notNull("logLevelWorkQueueSaturation", logLevelWorkQueueSaturation);
  }

  @Override
  public void close() {
    if (!shutdownExecutorOnClose) {
      return;
    }
    if (!(executor instanceof ExecutorService)) {
      return;
    }
    Utils.shutdown((ExecutorService) executor);
  }

  public static class ExecutorSubmitterBuilder {
    private Executor executor;
    private Integer concurrency;
    private Integer queueCapacity;
    private Level logLevelWorkQueueSaturation;

    ExecutorSubmitterBuilder() {}

    /**
     * @param executor The executor to use. It is not shut down by {@link #close()}. If not
     *     provided, a fixed pool of {@link #concurrency(int)} daemon threads is created.
     */
    public ExecutorSubmitterBuilder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * @param concurrency The size of the default thread pool. Defaults to 4. Ignored if {@link
     *     #executor(Executor)} is set.
     */
    public ExecutorSubmitterBuilder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * @param queueCapacity The queue size of the default thread pool. Defaults to 16384. Ignored
     *     if {@link #executor(Executor)} is set.
     */
    public ExecutorSubmitterBuilder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * @param logLevelWorkQueueSaturation The log level to use when submission hits the queue limit.
     *     This usually indicates saturation and may be of greater interest than the default {@code
     *     DEBUG} level.
     */
    public ExecutorSubmitterBuilder logLevelWorkQueueSaturation(Level logLevelWorkQueueSaturation) {
      this.logLevelWorkQueueSaturation = logLevelWorkQueueSaturation;
      return this;
    }

    public ExecutorSubmitter build() {
      return new ExecutorSubmitter(
          executor,
          Utils.firstNonNull(concurrency, () -> OutboxRelay.DEFAULT_CONCURRENCY),
          Utils.firstNonNull(queueCapacity, () -> DEFAULT_QUEUE_CAPACITY),
          Utils.firstNonNull(logLevelWorkQueueSaturation, () -> Level.DEBUG));
    }

    @Override
    public String toString() {
      return "ExecutorSubmitter.ExecutorSubmitterBuilder(executor="
          + executor
          + ", concurrency="
          + concurrency
          + ", queueCapacity="
          + queueCapacity
          + ", logLevelWorkQueueSaturation="
          + logLevelWorkQueueSaturation
          + ")";
    }
  }
}
