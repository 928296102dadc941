package com.gruelbox.outboxrelay;

/** Base class for failures reported by an {@link OutboxStore}. */
public abstract class OutboxStoreException extends Exception {

  protected OutboxStoreException(String message) {
    super(message);
  }

  protected OutboxStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
