package com.gruelbox.outboxrelay;

import lombok.Getter;

/** Thrown when changing the status of an event id the store does not hold. */
public class EventNotFoundException extends OutboxStoreException {

  @Getter private final String eventId;

  public EventNotFoundException(String eventId) {
    super("No event with id " + eventId);
    this.eventId = eventId;
  }
}
