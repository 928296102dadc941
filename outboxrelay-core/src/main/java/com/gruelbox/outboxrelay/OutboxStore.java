package com.gruelbox.outboxrelay;

import java.util.List;
import java.util.Optional;

/**
 * Owns the persisted sequence of {@link OutboxEvent}s. All access to the sequence goes through
 * these operations, which implementations must serialize: concurrent appends and status changes
 * may not interleave, and a reader must never observe a partially written record.
 *
 * <p>An appended event must never be lost before it is marked processed. If the process dies
 * between {@link #append(OutboxEvent)} and {@link #markProcessed(String)}, the event must be
 * listed again by {@link #listPending()} after restart.
 *
 * <p>Use {@link FileOutboxStore} for durable storage. {@link InMemoryOutboxStore} has the same
 * semantics without durability.
 */
public interface OutboxStore {

  /**
   * Prepares the persistence medium, e.g. creating files. Called by {@link OutboxRelay} before any
   * other operation. Must be idempotent.
   *
   * @throws OutboxStoreIoException If the medium is unusable. This is a configuration error.
   */
  default void initialize() throws OutboxStoreIoException {
    // No-op
  }

  /**
   * Durably adds a new pending event after all those already held.
   *
   * @param event The event, which must be {@link EventStatus#PENDING}.
   * @throws DuplicateEventException If an event with the same id is already held, whatever its
   *     status.
   * @throws OutboxStoreIoException If the record could not be written.
   */
  void append(OutboxEvent event) throws DuplicateEventException, OutboxStoreIoException;

  /**
   * @return A consistent snapshot of every pending event, in append order, along with a count of
   *     the records skipped because they could not be read.
   * @throws OutboxStoreIoException If the medium could not be read.
   */
  PendingEvents listPending() throws OutboxStoreIoException;

  /**
   * Moves an event to {@link EventStatus#PROCESSED}. Does nothing if it already is.
   *
   * @param id The event id.
   * @throws EventNotFoundException If no such event is held.
   * @throws IllegalStateException If the event has already failed.
   * @throws OutboxStoreIoException If the change could not be written.
   */
  void markProcessed(String id) throws EventNotFoundException, OutboxStoreIoException;

  /**
   * Moves an event to {@link EventStatus#FAILED}, recording why. Does nothing if it already is.
   *
   * @param id The event id.
   * @param reason Why delivery was abandoned.
   * @throws EventNotFoundException If no such event is held.
   * @throws IllegalStateException If the event has already been processed.
   * @throws OutboxStoreIoException If the change could not be written.
   */
  void markFailed(String id, String reason) throws EventNotFoundException, OutboxStoreIoException;

  /**
   * @param id The event id.
   * @return The event in its current status, if held.
   * @throws OutboxStoreIoException If the medium could not be read.
   */
  Optional<OutboxEvent> find(String id) throws OutboxStoreIoException;

  /**
   * @return Every failed event, in append order. Failed events are retained until removed by hand.
   * @throws OutboxStoreIoException If the medium could not be read.
   */
  List<OutboxEvent> listFailed() throws OutboxStoreIoException;

  /**
   * Removes all processed events.
   *
   * @return The number of events removed.
   * @throws OutboxStoreIoException If the change could not be written.
   */
  int deleteProcessed() throws OutboxStoreIoException;

  /**
   * Removes everything. For testing only.
   *
   * @throws OutboxStoreIoException If the change could not be written.
   */
  void clear() throws OutboxStoreIoException;
}
