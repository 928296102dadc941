package com.gruelbox.outboxrelay;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Coordinates graceful shutdown of an {@link OutboxRelay}.
 *
 * <p>Each delivery task registers with {@link #tryEnter()} before it starts and calls {@link
 * #exit()} once its event has reached a resting state. {@link #shutdown()} cancels the shared
 * {@link CancellationToken}, after which no new task is admitted and running tasks stop at their
 * next check. {@link #awaitTermination(Duration)} then waits for the running tasks to finish;
 * a {@link RelaySink#deliver(OutboxEvent)} call already under way is always allowed to complete.
 *
 * <p>{@link #registerShutdownHook(Duration)} ties this to process termination (SIGTERM, SIGINT or
 * a normal exit) so the JVM only exits once in-flight deliveries have resolved.
 */
@Slf4j
public final class ShutdownCoordinator {

  private final CancellationToken token = new CancellationToken();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition idle = lock.newCondition();
  private int active;
  private Thread shutdownHook;

  public CancellationToken getToken() {
    return token;
  }

  public boolean isShuttingDown() {
    return token.isCancelled();
  }

  /**
   * Registers a task about to start work.
   *
   * @return False if shutdown has begun, in which case the task must not start.
   */
  public boolean tryEnter() {
    lock.lock();
    try {
      if (token.isCancelled()) {
        return false;
      }
      active++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Deregisters a task admitted by {@link #tryEnter()}. */
  public void exit() {
    lock.lock();
    try {
      if (active <= 0) {
        throw new IllegalStateException("exit() called without a matching tryEnter()");
      }
      active--;
      if (active == 0) {
        idle.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return The number of tasks currently registered.
   */
  public int getActiveCount() {
    lock.lock();
    try {
      return active;
    } finally {
      lock.unlock();
    }
  }

  /** Signals cancellation. Idempotent; never blocks. */
  public void shutdown() {
    lock.lock();
    try {
      if (token.isCancelled()) {
        return;
      }
      token.cancel();
      log.info("Shutdown requested with {} deliveries in flight", active);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for every registered task to finish.
   *
   * @param timeout The longest to wait.
   * @return True if all tasks finished, false if the timeout elapsed first.
   * @throws InterruptedException If interrupted while waiting.
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    long nanos = timeout.toNanos();
    lock.lock();
    try {
      while (active > 0) {
        if (nanos <= 0) {
          return false;
        }
        nanos = idle.awaitNanos(nanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Equivalent to {@link #shutdown()} followed by {@link #awaitTermination(Duration)}.
   *
   * @param timeout The longest to wait.
   * @return True if all tasks finished in time.
   * @throws InterruptedException If interrupted while waiting.
   */
  public boolean shutdownAndAwait(Duration timeout) throws InterruptedException {
    shutdown();
    boolean drained = awaitTermination(timeout);
    if (drained) {
      log.info("All in-flight deliveries completed");
    } else {
      log.warn(
          "{} deliveries still running after {}; their events remain pending",
          getActiveCount(),
          timeout);
    }
    return drained;
  }

  /**
   * Installs a JVM shutdown hook which calls {@link #shutdownAndAwait(Duration)}. Calling this more
   * than once has no further effect.
   *
   * @param timeout The longest the hook will hold up process exit.
   */
  public void registerShutdownHook(Duration timeout) {
    lock.lock();
    try {
      if (shutdownHook != null) {
        return;
      }
      shutdownHook =
          new Thread(
              () -> {
                try {
                  shutdownAndAwait(timeout);
                } catch (InterruptedException e) {
                  log.warn("Interrupted waiting for in-flight deliveries");
                  Thread.currentThread().interrupt();
                }
              },
              "outbox-relay-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
    } finally {
      lock.unlock();
    }
  }

  /** Removes any hook installed by {@link #registerShutdownHook(Duration)}. */
  void unregisterShutdownHook() {
    lock.lock();
    try {
      if (shutdownHook == null) {
        return;
      }
      try {
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
      } catch (IllegalStateException e) {
        log.debug("JVM already shutting down; leaving shutdown hook in place");
      }
      shutdownHook = null;
    } finally {
      lock.unlock();
    }
  }
}
