package com.gruelbox.outboxrelay;

import static com.gruelbox.outboxrelay.Utils.logAtLevel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.slf4j.event.Level;

@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class OutboxRelayImpl implements OutboxRelay, Validatable {

  private final OutboxStore store;
  private final RelaySink sink;
  private final RetryPolicy retryPolicy;
  private final RetryPolicy storeRetryPolicy;
  private final Submitter submitter;
  private final Duration deliveryTimeout;
  private final Duration pollInterval;
  private final Duration startTimeout;
  private final OutboxRelayListener listener;
  private final ShutdownCoordinator coordinator;
  private final Duration drainTimeout;
  private final boolean registerShutdownHook;
  private final Level logLevelTemporaryFailure;
  private final boolean purgeProcessed;
  private final AtomicBoolean initialized = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final ConcurrentMap<String, Submission> inFlight = new ConcurrentHashMap<>();
  private volatile ExecutorService deliveryExecutor;
  private ScheduledExecutorService poller;

  @Override
  public void validate(Validator validator) {
    validator.notNull("store", store);
    validator.notNull("sink", sink);
    validator.valid("retryPolicy", retryPolicy);
    validator.valid("storeRetryPolicy", storeRetryPolicy);
    validator.valid("submitter", submitter);
    validator.nullOrPositive("deliveryTimeout", deliveryTimeout);
    validator.positive("pollInterval", pollInterval);
    validator.positive("startTimeout", startTimeout);
    validator.notNull("listener", listener);
    validator.notNull("shutdownCoordinator", coordinator);
    validator.positive("drainTimeout", drainTimeout);
    validator.notNull("logLevelTemporaryFailure", logLevelTemporaryFailure);
  }

  static OutboxRelayBuilder builder() {
    return new OutboxRelayBuilderImpl();
  }

  @Override
  public void initialize() {
    if (initialized.compareAndSet(false, true)) {
      try {
        store.initialize();
      } catch (OutboxStoreIoException e) {
        initialized.set(false);
        throw new UncheckedException(e);
      } catch (RuntimeException e) {
        initialized.set(false);
        throw e;
      }
      if (deliveryTimeout != null) {
        deliveryExecutor =
            Executors.newCachedThreadPool(new NamedThreadFactory("outbox-relay-delivery-"));
      }
      if (registerShutdownHook) {
        coordinator.registerShutdownHook(drainTimeout);
      }
      log.info("Outbox relay initialized on {}", store);
    }
  }

  @Override
  public void schedule(OutboxEvent event) throws DuplicateEventException, OutboxStoreIoException {
    requireInitialized();
    store.append(event);
    Utils.safelyRun("notifying listener of schedule", () -> listener.scheduled(event));
    if (coordinator.isShuttingDown()) {
      log.debug("Shutting down; {} will be delivered after restart", event.description());
      return;
    }
    submit(event);
  }

  @Override
  public RelayReport relayPending() throws OutboxStoreIoException {
    requireInitialized();
    PendingEvents pending = store.listPending();
    if (pending.getSkippedRecords() > 0) {
      log.warn("Skipped {} unreadable records in {}", pending.getSkippedRecords(), store);
      Utils.safelyRun(
          "notifying listener of skipped records",
          () -> listener.skippedRecords(pending.getSkippedRecords()));
    }
    if (pending.isEmpty()) {
      log.debug("No pending events");
      return RelayReport.of(List.of(), pending.getSkippedRecords());
    }
    log.debug("Relaying {} pending events", pending.size());
    List<Submission> submissions = new ArrayList<>(pending.size());
    for (OutboxEvent event : pending.getEvents()) {
      submissions.add(submit(event));
    }
    List<RelayOutcome> outcomes = awaitPass(submissions);
    RelayReport report = RelayReport.of(outcomes, pending.getSkippedRecords());
    if (purgeProcessed && report.getProcessed() > 0) {
      purge();
    }
    log.info(
        "Relay pass complete: {} processed, {} failed, {} deferred",
        report.getProcessed(),
        report.getFailed(),
        report.getDeferred());
    return report;
  }

  /**
   * Waits for every submission to come to rest. Anything not started within {@link #startTimeout}
   * is withdrawn and counted as deferred. Deliveries already running are always waited for.
   */
  private List<RelayOutcome> awaitPass(List<Submission> submissions) {
    CompletableFuture<Void> all =
        CompletableFuture.allOf(
            submissions.stream().map(s -> s.result).toArray(CompletableFuture<?>[]::new));
    try {
      all.get(startTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      int withdrawn = 0;
      for (Submission submission : submissions) {
        if (withdraw(submission)) {
          withdrawn++;
        }
      }
      if (withdrawn > 0) {
        log.warn(
            "{} events did not start within {}; leaving them for a later pass",
            withdrawn,
            startTimeout);
      }
      all.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      submissions.forEach(this::withdraw);
      log.warn("Interrupted waiting for relay pass; unfinished events stay pending");
    } catch (ExecutionException e) {
      throw new UncheckedException(e.getCause());
    }
    List<RelayOutcome> outcomes = new ArrayList<>(submissions.size());
    for (Submission submission : submissions) {
      outcomes.add(submission.result.getNow(RelayOutcome.DEFERRED));
    }
    return outcomes;
  }

  private void purge() {
    try {
      int removed = store.deleteProcessed();
      log.debug("Purged {} processed events", removed);
    } catch (OutboxStoreIoException e) {
      log.error("Failed to purge processed events; will try again after the next pass", e);
    }
  }

  @Override
  public synchronized void start() {
    requireInitialized();
    if (closed.get() || coordinator.isShuttingDown()) {
      throw new IllegalStateException("Relay is shut down");
    }
    if (poller != null) {
      throw new IllegalStateException("Relay already started");
    }
    poller =
        Executors.newSingleThreadScheduledExecutor(
            new NamedThreadFactory("outbox-relay-poller-"));
    poller.scheduleWithFixedDelay(this::poll, 0, pollInterval.toNanos(), TimeUnit.NANOSECONDS);
    log.info("Polling for pending events every {}", pollInterval);
  }

  private void poll() {
    if (coordinator.isShuttingDown()) {
      return;
    }
    try {
      relayPending();
    } catch (Exception e) {
      log.error("Relay pass failed; will try again in {}", pollInterval, e);
    }
  }

  @Override
  public RelayOutcome process(OutboxEvent event) {
    requireInitialized();
    Submission submission = Submission.running(event.getId());
    if (!claim(event, submission)) {
      return RelayOutcome.DEFERRED;
    }
    try {
      return processNow(event);
    } finally {
      inFlight.remove(event.getId(), submission);
    }
  }

  private Submission submit(OutboxEvent event) {
    Submission submission = Submission.queued(event.getId());
    if (!claim(event, submission)) {
      return Submission.deferred(event.getId());
    }
    boolean accepted = submitter.submit(event, e -> run(e, submission));
    if (!accepted) {
      withdraw(submission);
    }
    return submission;
  }

  private void run(OutboxEvent event, Submission submission) {
    if (!submission.start()) {
      log.debug("{} was withdrawn before it started", event.description());
      return;
    }
    RelayOutcome outcome = RelayOutcome.DEFERRED;
    try {
      outcome = processNow(event);
    } catch (RuntimeException e) {
      log.error("Unexpected error relaying {}", event.description(), e);
    } finally {
      inFlight.remove(event.getId(), submission);
      submission.result.complete(outcome);
    }
  }

  /**
   * Registers the event as in flight. A previous submission which has sat unstarted for longer
   * than {@link #startTimeout}, e.g. because the executor dropped it, is withdrawn and replaced.
   *
   * @return False if the event is already being delivered.
   */
  private boolean claim(OutboxEvent event, Submission submission) {
    while (true) {
      Submission existing = inFlight.putIfAbsent(event.getId(), submission);
      if (existing == null) {
        return true;
      }
      if (!existing.isStale(startTimeout) || !withdraw(existing)) {
        log.debug("{} is already being delivered", event.description());
        return false;
      }
      log.warn(
          "{} was submitted over {} ago but never started; submitting again",
          event.description(),
          startTimeout);
    }
  }

  private boolean withdraw(Submission submission) {
    if (!submission.state.compareAndSet(Submission.QUEUED, Submission.WITHDRAWN)) {
      return false;
    }
    inFlight.remove(submission.id, submission);
    submission.result.complete(RelayOutcome.DEFERRED);
    return true;
  }

  private RelayOutcome processNow(OutboxEvent event) {
    if (!coordinator.tryEnter()) {
      log.debug("Shutting down; not starting {}", event.description());
      return RelayOutcome.DEFERRED;
    }
    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_EVENT_ID, event.getId())) {
      return relay(event);
    } finally {
      coordinator.exit();
    }
  }

  private RelayOutcome relay(OutboxEvent event) {
    CancellationToken token = coordinator.getToken();
    int attempt = 0;
    while (true) {
      if (token.isCancelled()) {
        log.info(
            "Shutting down; leaving {} pending after {} attempts", event.description(), attempt);
        return RelayOutcome.DEFERRED;
      }
      attempt++;
      Exception failure;
      try {
        failure = attemptDelivery(event, attempt);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted delivering {}; leaving it pending", event.description());
        return RelayOutcome.DEFERRED;
      }
      if (failure == null) {
        return recordProcessed(event, attempt);
      }

      int failedAttempt = attempt;
      Utils.safelyRun(
          "notifying listener of failure",
          () -> listener.failure(event, failedAttempt, failure));

      PermanentDeliveryException permanent =
          Utils.findCause(failure, PermanentDeliveryException.class);
      if (permanent != null) {
        log.error(
            "Permanently failed to deliver {} on attempt {}",
            event.description(),
            attempt,
            failure);
        return recordFailed(event, describe(permanent), permanent);
      }

      if (!retryPolicy.shouldRetry(attempt)) {
        RetriesExhaustedException exhausted =
            new RetriesExhaustedException(event.getId(), attempt, failure);
        log.error("Giving up on {}", event.description(), exhausted);
        return recordFailed(event, exhausted.getMessage(), exhausted);
      }

      Duration delay = retryPolicy.nextDelay(attempt);
      logAtLevel(
          log,
          logLevelTemporaryFailure,
          "Temporarily failed to deliver {} on attempt {}; retrying in {}",
          event.description(),
          attempt,
          delay,
          failure);
      try {
        if (token.await(delay)) {
          log.info(
              "Shutting down; leaving {} pending after {} attempts", event.description(), attempt);
          return RelayOutcome.DEFERRED;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted waiting to retry {}; leaving it pending", event.description());
        return RelayOutcome.DEFERRED;
      }
    }
  }

  /**
   * @return The failure, or null if the sink accepted the event.
   */
  private Exception attemptDelivery(OutboxEvent event, int attempt) throws InterruptedException {
    log.debug("Delivering {} (attempt {})", event.description(), attempt);
    try {
      deliver(event);
      return null;
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      return e;
    }
  }

  private void deliver(OutboxEvent event) throws Exception {
    if (deliveryExecutor == null) {
      sink.deliver(event);
      return;
    }
    TimedDelivery delivery = new TimedDelivery(event);
    Future<Void> future = deliveryExecutor.submit(delivery);
    try {
      future.get(deliveryTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      delivery.abandon(future);
      throw new TransientDeliveryException(
          "Delivery did not complete within " + deliveryTimeout, e);
    } catch (InterruptedException e) {
      delivery.abandon(future);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      Utils.uncheckAndThrow(cause);
    }
  }

  private RelayOutcome recordProcessed(OutboxEvent event, int attempts) {
    if (!updateStore(event, "marking processed", () -> store.markProcessed(event.getId()))) {
      return RelayOutcome.DEFERRED;
    }
    log.info("Delivered {} after {} attempts", event.description(), attempts);
    OutboxEvent processed = event.processed();
    Utils.safelyRun(
        "notifying listener of success", () -> listener.success(processed, attempts));
    return RelayOutcome.PROCESSED;
  }

  private RelayOutcome recordFailed(OutboxEvent event, String reason, Throwable cause) {
    if (!updateStore(event, "marking failed", () -> store.markFailed(event.getId(), reason))) {
      return RelayOutcome.DEFERRED;
    }
    OutboxEvent failed = event.failed(reason);
    Utils.safelyRun("notifying listener of failed event", () -> listener.failed(failed, cause));
    return RelayOutcome.FAILED;
  }

  /**
   * Applies a status change, retrying I/O failures with {@link #storeRetryPolicy}.
   *
   * @return False if the change could not be made, in which case the event stays pending in the
   *     store (or is gone) and will be delivered again by a later pass if still there.
   */
  private boolean updateStore(OutboxEvent event, String gerund, StoreUpdate update) {
    int attempt = 1;
    while (true) {
      try {
        update.run();
        return true;
      } catch (EventNotFoundException e) {
        log.error("{} disappeared from the store before {}", event.description(), gerund);
        return false;
      } catch (IllegalStateException e) {
        log.error("Could not record outcome of {}: {}", event.description(), e.getMessage());
        return false;
      } catch (OutboxStoreException e) {
        if (!storeRetryPolicy.shouldRetry(attempt)) {
          log.error(
              "Failed {} {} after {} attempts; it stays pending and will be delivered again",
              gerund,
              event.description(),
              attempt,
              e);
          return false;
        }
        Duration delay = storeRetryPolicy.nextDelay(attempt);
        log.warn(
            "Failed {} {} on attempt {}; retrying in {}: {}",
            gerund,
            event.description(),
            attempt,
            delay,
            e.getMessage());
        try {
          TimeUnit.NANOSECONDS.sleep(delay.toNanos());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          log.error("Interrupted while {} {}; it stays pending", gerund, event.description());
          return false;
        }
        attempt++;
      }
    }
  }

  private static String describe(Throwable t) {
    return t.getMessage() == null
        ? t.getClass().getSimpleName()
        : t.getClass().getSimpleName() + ": " + t.getMessage();
  }

  private void requireInitialized() {
    if (!initialized.get()) {
      throw new IllegalStateException("Not initialized");
    }
  }

  @Override
  public synchronized void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    log.info("Closing outbox relay");
    try {
      coordinator.shutdownAndAwait(drainTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted waiting for in-flight deliveries");
    }
    if (poller != null) {
      Utils.shutdown(poller);
    }
    submitter.close();
    if (deliveryExecutor != null) {
      deliveryExecutor.shutdownNow();
    }
    if (registerShutdownHook) {
      coordinator.unregisterShutdownHook();
    }
  }

  /**
   * A sink call on the delivery pool. The worker which started it may stop waiting for the result,
   * but never moves on until the call has returned.
   */
  private final class TimedDelivery implements Callable<Void> {

    private final OutboxEvent event;
    private final AtomicBoolean claimed = new AtomicBoolean();
    private final CountDownLatch returned = new CountDownLatch(1);

    TimedDelivery(OutboxEvent event) {
      this.event = event;
    }

    @Override
    public Void call() throws Exception {
      if (!claimed.compareAndSet(false, true)) {
        return null;
      }
      try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_EVENT_ID, event.getId())) {
        sink.deliver(event);
      } finally {
        returned.countDown();
      }
      return null;
    }

    /** Interrupts the call and blocks, uninterruptibly, until it has returned. */
    void abandon(Future<Void> future) {
      future.cancel(true);
      if (claimed.compareAndSet(false, true)) {
        return;
      }
      boolean interrupted = false;
      boolean warned = false;
      try {
        while (true) {
          try {
            if (returned.await(deliveryTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
              return;
            }
            if (!warned) {
              log.warn(
                  "Delivery of {} ignored interruption; waiting for it to return",
                  event.description());
              warned = true;
            }
          } catch (InterruptedException e) {
            interrupted = true;
          }
        }
      } finally {
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
    }
  }

  /** Tracks one event from submission until it comes to rest. */
  private static final class Submission {

    private static final int QUEUED = 0;
    private static final int RUNNING = 1;
    private static final int WITHDRAWN = 2;

    private final String id;
    private final AtomicInteger state;
    private final long submittedAt = System.nanoTime();
    private final CompletableFuture<RelayOutcome> result = new CompletableFuture<>();

    private Submission(String id, int state) {
      this.id = id;
      this.state = new AtomicInteger(state);
    }

    static Submission queued(String id) {
      return new Submission(id, QUEUED);
    }

    static Submission running(String id) {
      return new Submission(id, RUNNING);
    }

    static Submission deferred(String id) {
      Submission submission = new Submission(id, WITHDRAWN);
      submission.result.complete(RelayOutcome.DEFERRED);
      return submission;
    }

    boolean start() {
      return state.compareAndSet(QUEUED, RUNNING);
    }

    boolean isStale(Duration timeout) {
      return state.get() == QUEUED && System.nanoTime() - submittedAt >= timeout.toNanos();
    }
  }

  @FunctionalInterface
  private interface StoreUpdate {
    void run() throws OutboxStoreException;
  }

  static class OutboxRelayBuilderImpl extends OutboxRelayBuilder {

    OutboxRelayBuilderImpl() {
      super();
    }

    @Override
    public OutboxRelayImpl build() {
      Validator validator = new Validator();
      OutboxRelayImpl impl =
          new OutboxRelayImpl(
              store,
              sink,
              Utils.firstNonNull(
                  retryPolicy, () -> RetryPolicy.exponential(Duration.ofMillis(100), 5)),
              Utils.firstNonNull(
                  storeRetryPolicy, () -> RetryPolicy.exponential(Duration.ofMillis(50), 3)),
              Utils.firstNonNull(
                  submitter,
                  () ->
                      Submitter.withConcurrency(
                          Utils.firstNonNull(concurrency, () -> DEFAULT_CONCURRENCY))),
              deliveryTimeout,
              Utils.firstNonNull(pollInterval, () -> Duration.ofSeconds(1)),
              Utils.firstNonNull(startTimeout, () -> Duration.ofSeconds(30)),
              Utils.firstNonNull(listener, () -> OutboxRelayListener.EMPTY),
              Utils.firstNonNull(shutdownCoordinator, ShutdownCoordinator::new),
              Utils.firstNonNull(drainTimeout, () -> Duration.ofSeconds(30)),
              registerShutdownHook != null && registerShutdownHook,
              Utils.firstNonNull(logLevelTemporaryFailure, () -> Level.WARN),
              purgeProcessed != null && purgeProcessed);
      validator.validate(impl);
      if (initializeImmediately == null || initializeImmediately) {
        impl.initialize();
      }
      return impl;
    }
  }
}
