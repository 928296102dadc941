package com.gruelbox.outboxrelay;

import lombok.Getter;

/**
 * Thrown when appending an event whose id is already held by the store, in any status. Producers
 * which retry an append after an ambiguous failure can treat this as confirmation that the first
 * attempt was recorded.
 */
public class DuplicateEventException extends OutboxStoreException {

  @Getter private final String eventId;

  public DuplicateEventException(String eventId) {
    super("Event " + eventId + " has already been appended");
    this.eventId = eventId;
  }
}
