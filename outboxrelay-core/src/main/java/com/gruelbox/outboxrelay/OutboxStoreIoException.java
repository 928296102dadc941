package com.gruelbox.outboxrelay;

/**
 * The persistence medium could not be read or written. The operation may succeed if repeated, and
 * {@link OutboxRelay} retries store operations which fail this way.
 */
public class OutboxStoreIoException extends OutboxStoreException {

  public OutboxStoreIoException(String message, Throwable cause) {
    super(message, cause);
  }
}
