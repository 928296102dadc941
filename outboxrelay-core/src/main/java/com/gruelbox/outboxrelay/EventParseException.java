package com.gruelbox.outboxrelay;

/** Thrown by an {@link EventFormat} when a persisted record cannot be read back as an event. */
public class EventParseException extends Exception {

  public EventParseException(String message) {
    super(message);
  }

  public EventParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
