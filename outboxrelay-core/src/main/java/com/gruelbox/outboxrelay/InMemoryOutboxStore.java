package com.gruelbox.outboxrelay;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Non-durable {@link OutboxStore} holding events in insertion order. Useful in tests and for
 * embedding the relay where durability is handled elsewhere.
 */
@Slf4j
public class InMemoryOutboxStore implements OutboxStore {

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, OutboxEvent> events = new LinkedHashMap<>();

  @Override
  public void append(OutboxEvent event) throws DuplicateEventException {
    requirePending(event);
    lock.lock();
    try {
      if (events.containsKey(event.getId())) {
        throw new DuplicateEventException(event.getId());
      }
      events.put(event.getId(), event);
    } finally {
      lock.unlock();
    }
    log.debug("Appended {}", event.description());
  }

  @Override
  public PendingEvents listPending() {
    lock.lock();
    try {
      return PendingEvents.of(
          events.values().stream().filter(OutboxEvent::isPending).collect(Collectors.toList()),
          0);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void markProcessed(String id) throws EventNotFoundException {
    transition(id, OutboxEvent::processed);
  }

  @Override
  public void markFailed(String id, String reason) throws EventNotFoundException {
    transition(id, event -> event.failed(reason));
  }

  private void transition(String id, UnaryOperator<OutboxEvent> change)
      throws EventNotFoundException {
    lock.lock();
    try {
      OutboxEvent current = events.get(id);
      if (current == null) {
        throw new EventNotFoundException(id);
      }
      events.put(id, change.apply(current));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<OutboxEvent> find(String id) {
    lock.lock();
    try {
      return Optional.ofNullable(events.get(id));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<OutboxEvent> listFailed() {
    lock.lock();
    try {
      return events.values().stream()
          .filter(it -> it.getStatus() == EventStatus.FAILED)
          .collect(Collectors.toUnmodifiableList());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int deleteProcessed() {
    lock.lock();
    try {
      int removed = 0;
      Iterator<OutboxEvent> it = events.values().iterator();
      while (it.hasNext()) {
        if (it.next().getStatus() == EventStatus.PROCESSED) {
          it.remove();
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() {
    lock.lock();
    try {
      events.clear();
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return Every event held, in insertion order, whatever its status.
   */
  public List<OutboxEvent> snapshot() {
    lock.lock();
    try {
      return new ArrayList<>(events.values());
    } finally {
      lock.unlock();
    }
  }

  static void requirePending(OutboxEvent event) {
    if (!event.isPending()) {
      throw new IllegalArgumentException(
          "Only pending events may be appended, got " + event.description());
    }
  }
}
