package com.gruelbox.outboxrelay;

/**
 * Thrown by a {@link RelaySink} to reject an event outright, e.g. because the payload is
 * malformed. The event is failed immediately without further attempts.
 */
public class PermanentDeliveryException extends Exception {

  public PermanentDeliveryException(String message) {
    super(message);
  }

  public PermanentDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
