package com.gruelbox.outboxrelay;

import java.util.List;
import lombok.Value;

/** A snapshot of the pending events in a store, in append order. */
@Value
public class PendingEvents {

  List<OutboxEvent> events;

  /**
   * Records which could not be read back (corrupt or duplicated) and were left out of {@link
   * #getEvents()}.
   */
  int skippedRecords;

  public static PendingEvents of(List<OutboxEvent> events, int skippedRecords) {
    return new PendingEvents(List.copyOf(events), skippedRecords);
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  public int size() {
    return events.size();
  }
}
