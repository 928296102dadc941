package com.gruelbox.outboxrelay;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Internal helpers shared across the relay. Not part of the public API and may change without
 * notice.
 */
@Slf4j
public final class Utils {

  private Utils() {}

  @SuppressWarnings({"UnusedReturnValue"})
  public static boolean safelyRun(String gerund, ThrowingRunnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (Exception e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  public static void uncheck(ThrowingRunnable runnable) {
    try {
      runnable.run();
    } catch (Exception e) {
      uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckedly(Callable<T> callable) {
    try {
      return callable.call();
    } catch (Exception e) {
      return uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckAndThrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    if (e instanceof Error) {
      throw (Error) e;
    }
    throw new UncheckedException(e);
  }

  public static <T> T firstNonNull(T one, Supplier<T> two) {
    if (one == null) return two.get();
    return one;
  }

  /**
   * Walks the cause chain of {@code throwable} looking for an instance of {@code type}.
   *
   * @return The first match, or null.
   */
  public static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
    Throwable current = throwable;
    int depth = 0;
    while (current != null && depth++ < 32) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause();
    }
    return null;
  }

  public static void shutdown(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate within 30 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public static boolean logAtLevel(Logger logger, Level level, String message, Object... args) {
    switch (level) {
      case ERROR:
        if (logger.isErrorEnabled()) {
          logger.error(message, args);
          return true;
        } else {
          return false;
        }
      case WARN:
        if (logger.isWarnEnabled()) {
          logger.warn(message, args);
          return true;
        } else {
          return false;
        }
      case INFO:
        if (logger.isInfoEnabled()) {
          logger.info(message, args);
          return true;
        } else {
          return false;
        }
      case DEBUG:
        if (logger.isDebugEnabled()) {
          logger.debug(message, args);
          return true;
        } else {
          return false;
        }
      case TRACE:
        if (logger.isTraceEnabled()) {
          logger.trace(message, args);
          return true;
        } else {
          return false;
        }
      default:
        return logAtLevel(logger, Level.WARN, message, args);
    }
  }
}
