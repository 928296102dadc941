package com.gruelbox.outboxrelay;

/**
 * Thrown by a {@link RelaySink} for a failure which may clear up on retry. Any exception other than
 * {@link PermanentDeliveryException} is treated the same way; this type just makes the intent
 * explicit.
 */
public class TransientDeliveryException extends Exception {

  public TransientDeliveryException(String message) {
    super(message);
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
