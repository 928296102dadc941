package com.gruelbox.outboxrelay;

/**
 * Carries a checked exception across a boundary which only permits unchecked ones, such as an
 * {@link java.util.concurrent.Executor} task. See {@link Utils#uncheckAndThrow(Throwable)}.
 */
public class UncheckedException extends RuntimeException {

  public UncheckedException(Throwable cause) {
    super(cause);
  }
}
