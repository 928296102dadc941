package com.gruelbox.outboxrelay;

import java.time.Duration;
import lombok.ToString;
import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * Relays events from an {@link OutboxStore} to a {@link RelaySink} with at-least-once semantics.
 *
 * <p>Producers {@link #schedule(OutboxEvent)} events, which are durably appended and then handed
 * to worker threads. Each event is delivered with retries according to the configured {@link
 * RetryPolicy} until it is recorded as {@link EventStatus#PROCESSED} or {@link
 * EventStatus#FAILED}. Anything left pending, because of a crash, a store failure or shutdown, is
 * picked up again by {@link #relayPending()}, which {@link #start()} runs periodically.
 *
 * <p>{@link #close()} shuts down gracefully: no new delivery starts, deliveries already under way
 * complete and record their outcome, and anything not yet started stays pending.
 */
public interface OutboxRelay extends AutoCloseable {

  /** The {@link MDC} key holding the id of the event being worked on. */
  String MDC_EVENT_ID = "outboxEventId";

  int DEFAULT_CONCURRENCY = 4;

  /**
   * @return A builder for creating a new instance of {@link OutboxRelay}.
   */
  static OutboxRelayBuilder builder() {
    return OutboxRelayImpl.builder();
  }

  /**
   * Performs initial setup of the store, making the instance usable. If {@link
   * OutboxRelayBuilder#initializeImmediately(boolean)} is true, which is the default, this is
   * called automatically when the instance is built. Idempotent.
   *
   * @throws UncheckedException Wrapping an {@link OutboxStoreIoException} if the store cannot be
   *     prepared, e.g. because its path is not writable.
   */
  void initialize();

  /**
   * Durably records a new event and submits it for immediate delivery. If the submission is
   * refused, or shutdown has begun, the event is delivered by a later {@link #relayPending()}.
   *
   * @param event A pending event.
   * @throws DuplicateEventException If an event with the same id is already stored.
   * @throws OutboxStoreIoException If the event could not be recorded. It has not been accepted.
   */
  void schedule(OutboxEvent event) throws DuplicateEventException, OutboxStoreIoException;

  /**
   * Runs one relay pass: every pending event is submitted for delivery, and this method returns
   * once each has reached a resting state.
   *
   * @return What happened to the events found.
   * @throws OutboxStoreIoException If pending events could not be listed.
   */
  RelayReport relayPending() throws OutboxStoreIoException;

  /**
   * Starts a background thread running {@link #relayPending()} every {@link
   * OutboxRelayBuilder#pollInterval(Duration)}. Failed passes are logged and retried on the next
   * tick.
   *
   * @throws IllegalStateException If already started or closed.
   */
  void start();

  /**
   * Runs the delivery cycle for one event in the calling thread, bypassing the {@link Submitter}.
   * Mainly useful where events are distributed to workers by some external mechanism.
   *
   * @param event The event, as read from the store.
   * @return Where the event ended up.
   */
  RelayOutcome process(OutboxEvent event);

  /**
   * Shuts down gracefully, waiting up to {@link OutboxRelayBuilder#drainTimeout(Duration)} for
   * in-flight deliveries, then releases all threads. Idempotent.
   */
  @Override
  void close();

  /** Builder for {@link OutboxRelay}. */
  @ToString
  abstract class OutboxRelayBuilder {

    protected OutboxStore store;
    protected RelaySink sink;
    protected RetryPolicy retryPolicy;
    protected RetryPolicy storeRetryPolicy;
    protected Integer concurrency;
    protected Submitter submitter;
    protected Duration deliveryTimeout;
    protected Duration pollInterval;
    protected Duration startTimeout;
    protected OutboxRelayListener listener;
    protected ShutdownCoordinator shutdownCoordinator;
    protected Duration drainTimeout;
    protected Boolean registerShutdownHook;
    protected Level logLevelTemporaryFailure;
    protected Boolean purgeProcessed;
    protected Boolean initializeImmediately;

    protected OutboxRelayBuilder() {}

    /**
     * @param store Where events are recorded. Required.
     * @return Builder.
     */
    public OutboxRelayBuilder store(OutboxStore store) {
      this.store = store;
      return this;
    }

    /**
     * @param sink The downstream consumer. Required.
     * @return Builder.
     */
    public OutboxRelayBuilder sink(RelaySink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * @param retryPolicy How failed deliveries are retried. Defaults to {@code
     *     RetryPolicy.exponential(Duration.ofMillis(100), 5)}.
     * @return Builder.
     */
    public OutboxRelayBuilder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * @param storeRetryPolicy How failed status updates to the store are retried. Defaults to
     *     {@code RetryPolicy.exponential(Duration.ofMillis(50), 3)}.
     * @return Builder.
     */
    public OutboxRelayBuilder storeRetryPolicy(RetryPolicy storeRetryPolicy) {
      this.storeRetryPolicy = storeRetryPolicy;
      return this;
    }

    /**
     * @param concurrency The most deliveries in flight at once. Defaults to 4. Ignored if {@link
     *     #submitter(Submitter)} is set.
     * @return Builder.
     */
    public OutboxRelayBuilder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * @param submitter Used to run deliveries in the background. Defaults to {@link
     *     Submitter#withConcurrency(int)}.
     * @return Builder.
     */
    public OutboxRelayBuilder submitter(Submitter submitter) {
      this.submitter = submitter;
      return this;
    }

    /**
     * @param deliveryTimeout If set, a {@link RelaySink#deliver(OutboxEvent)} call taking longer
     *     than this is interrupted and treated as a transient failure. The next attempt waits until
     *     the interrupted call has actually returned. Unset by default.
     * @return Builder.
     */
    public OutboxRelayBuilder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    /**
     * @param pollInterval How often {@link #start()} runs a relay pass. Defaults to 1 second.
     * @return Builder.
     */
    public OutboxRelayBuilder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * @param startTimeout How long a relay pass waits for a submitted event to start delivery.
     *     Events still queued after this are withdrawn and left for a later pass, as are events
     *     which a {@link Submitter} accepted but silently dropped. Defaults to 30 seconds.
     * @return Builder.
     */
    public OutboxRelayBuilder startTimeout(Duration startTimeout) {
      this.startTimeout = startTimeout;
      return this;
    }

    /**
     * @param listener Notified of delivery events. Defaults to {@link OutboxRelayListener#EMPTY}.
     * @return Builder.
     */
    public OutboxRelayBuilder listener(OutboxRelayListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * @param shutdownCoordinator Controls graceful shutdown. May be shared between relays so one
     *     signal stops them all. Defaults to a new instance.
     * @return Builder.
     */
    public OutboxRelayBuilder shutdownCoordinator(ShutdownCoordinator shutdownCoordinator) {
      this.shutdownCoordinator = shutdownCoordinator;
      return this;
    }

    /**
     * @param drainTimeout The longest {@link #close()} or the shutdown hook waits for in-flight
     *     deliveries. Defaults to 30 seconds.
     * @return Builder.
     */
    public OutboxRelayBuilder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * @param registerShutdownHook If true, a JVM shutdown hook drains in-flight deliveries before
     *     the process exits. Defaults to false.
     * @return Builder.
     */
    public OutboxRelayBuilder registerShutdownHook(boolean registerShutdownHook) {
      this.registerShutdownHook = registerShutdownHook;
      return this;
    }

    /**
     * @param logLevelTemporaryFailure The log level to use when logging a failed attempt which
     *     will be retried. Defaults to {@link Level#WARN}.
     * @return Builder.
     */
    public OutboxRelayBuilder logLevelTemporaryFailure(Level logLevelTemporaryFailure) {
      this.logLevelTemporaryFailure = logLevelTemporaryFailure;
      return this;
    }

    /**
     * @param purgeProcessed If true, processed events are deleted from the store after each relay
     *     pass. Defaults to false.
     * @return Builder.
     */
    public OutboxRelayBuilder purgeProcessed(boolean purgeProcessed) {
      this.purgeProcessed = purgeProcessed;
      return this;
    }

    /**
     * @param initializeImmediately If true, {@link OutboxRelay#initialize()} is called on build.
     *     Defaults to true.
     * @return Builder.
     */
    public OutboxRelayBuilder initializeImmediately(boolean initializeImmediately) {
      this.initializeImmediately = initializeImmediately;
      return this;
    }

    /**
     * Creates and initialises the {@link OutboxRelay}.
     *
     * @return The relay.
     * @throws IllegalArgumentException If the configuration is invalid.
     */
    public abstract OutboxRelay build();
  }
}
