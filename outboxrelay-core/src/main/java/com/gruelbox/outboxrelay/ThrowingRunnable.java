package com.gruelbox.outboxrelay;

/** A {@link Runnable} which may throw a checked exception. */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Exception;
}
