package com.gruelbox.outboxrelay;

/** Where a single event ended up after the relay worked on it. */
public enum RelayOutcome {

  /** Delivered and recorded as {@link EventStatus#PROCESSED}. */
  PROCESSED,

  /** Rejected permanently or out of attempts, and recorded as {@link EventStatus#FAILED}. */
  FAILED,

  /**
   * Left {@link EventStatus#PENDING}: shutdown began, the work queue was full, the event was
   * already being worked on, or its new status could not be recorded. A later pass will pick it
   * up again.
   */
  DEFERRED
}
