package com.gruelbox.outboxrelay;

import java.util.Collection;
import lombok.Value;

/** Summary of one {@link OutboxRelay#relayPending()} pass. */
@Value
public class RelayReport {

  public static final RelayReport EMPTY = new RelayReport(0, 0, 0, 0);

  int processed;
  int failed;
  int deferred;

  /** Corrupt or duplicate records the store skipped while listing. */
  int skippedRecords;

  static RelayReport of(Collection<RelayOutcome> outcomes, int skippedRecords) {
    int processed = 0;
    int failed = 0;
    int deferred = 0;
    for (RelayOutcome outcome : outcomes) {
      switch (outcome) {
        case PROCESSED:
          processed++;
          break;
        case FAILED:
          failed++;
          break;
        default:
          deferred++;
      }
    }
    return new RelayReport(processed, failed, deferred, skippedRecords);
  }

  /**
   * @return The number of events the pass found pending.
   */
  public int getTotal() {
    return processed + failed + deferred;
  }

  /**
   * @return True if the pass moved at least one event to a terminal status.
   */
  public boolean madeProgress() {
    return processed + failed > 0;
  }
}
