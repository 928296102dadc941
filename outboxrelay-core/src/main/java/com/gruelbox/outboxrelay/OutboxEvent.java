package com.gruelbox.outboxrelay;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One unit of work to relay. Instances are immutable: a status change produces a new instance,
 * and only the forward transitions {@code PENDING -> PROCESSED} and {@code PENDING -> FAILED} are
 * permitted.
 *
 * <p>Events are created by producers with {@link #of(String, String)} and handed to an {@link
 * OutboxStore}. Only the relay moves them out of {@link EventStatus#PENDING}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboxEvent implements Validatable {

  private static final int DESCRIPTION_PAYLOAD_LENGTH = 64;

  /** Producer-assigned identity. Never changes. */
  String id;

  /** Opaque content handed to the {@link RelaySink}. */
  String payload;

  EventStatus status;

  /** Why the event failed. Only present when {@link #getStatus()} is {@link EventStatus#FAILED}. */
  String failureReason;

  /**
   * Creates a new pending event.
   *
   * @param id A non-blank, unique id.
   * @param payload The payload. May be empty but not null.
   * @return The event.
   */
  public static OutboxEvent of(String id, String payload) {
    return restore(id, payload, EventStatus.PENDING, null);
  }

  /**
   * Recreates an event in any state. Used by record formats and stores when reading persisted
   * events back.
   */
  public static OutboxEvent restore(
      String id, String payload, EventStatus status, String failureReason) {
    OutboxEvent event = new OutboxEvent(id, payload, status, failureReason);
    new Validator().validate(event);
    return event;
  }

  public boolean isPending() {
    return status == EventStatus.PENDING;
  }

  /**
   * @return A copy of this event in {@link EventStatus#PROCESSED}.
   * @throws IllegalStateException If the event has already failed.
   */
  public OutboxEvent processed() {
    if (status == EventStatus.PROCESSED) {
      return this;
    }
    requirePending(EventStatus.PROCESSED);
    return new OutboxEvent(id, payload, EventStatus.PROCESSED, null);
  }

  /**
   * @param reason Why the event could not be delivered.
   * @return A copy of this event in {@link EventStatus#FAILED}.
   * @throws IllegalStateException If the event has already been processed.
   */
  public OutboxEvent failed(String reason) {
    if (status == EventStatus.FAILED) {
      return this;
    }
    requirePending(EventStatus.FAILED);
    return new OutboxEvent(id, payload, EventStatus.FAILED, reason == null ? "" : reason);
  }

  private void requirePending(EventStatus target) {
    if (status != EventStatus.PENDING) {
      throw new IllegalStateException(
          String.format("Event %s cannot move from %s to %s", id, status, target));
    }
  }

  /**
   * @return A short textual description for log output.
   */
  public String description() {
    String preview =
        payload.length() > DESCRIPTION_PAYLOAD_LENGTH
            ? payload.substring(0, DESCRIPTION_PAYLOAD_LENGTH) + "..."
            : payload;
    return String.format("[%s] %s \"%s\"", id, status.getToken(), preview);
  }

  @Override
  public void validate(Validator validator) {
    validator.notBlank("id", id);
    validator.notNull("payload", payload);
    validator.notNull("status", status);
    validator.isTrue(
        "failureReason",
        failureReason == null || status == EventStatus.FAILED,
        "may only be set on failed events, but event %s is %s",
        id,
        status);
  }
}
