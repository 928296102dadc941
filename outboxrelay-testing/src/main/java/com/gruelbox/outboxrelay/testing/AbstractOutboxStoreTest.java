package com.gruelbox.outboxrelay.testing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.outboxrelay.DuplicateEventException;
import com.gruelbox.outboxrelay.EventNotFoundException;
import com.gruelbox.outboxrelay.EventStatus;
import com.gruelbox.outboxrelay.OutboxEvent;
import com.gruelbox.outboxrelay.OutboxStore;
import com.gruelbox.outboxrelay.Utils;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behaviour every {@link OutboxStore} must share. Extend and supply the store under test. */
@Slf4j
public abstract class AbstractOutboxStoreTest {

  protected OutboxStore store;

  /**
   * @return A new store instance. Called before each test.
   */
  protected abstract OutboxStore createStore() throws Exception;

  @BeforeEach
  public void beforeEach() throws Exception {
    store = createStore();
    store.initialize();
    log.info("Clearing old records");
    store.clear();
  }

  @Test
  public void testAppendAndListInOrder() throws Exception {
    OutboxEvent one = OutboxEvent.of("1", "a");
    OutboxEvent two = OutboxEvent.of("2", "b");
    OutboxEvent three = OutboxEvent.of("3", "c");
    store.append(one);
    store.append(two);
    store.append(three);
    assertThat(store.listPending().getEvents(), contains(one, two, three));
    assertEquals(0, store.listPending().getSkippedRecords());
  }

  @Test
  public void testInitializeIsIdempotent() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.initialize();
    assertThat(store.listPending().getEvents(), contains(OutboxEvent.of("1", "a")));
  }

  @Test
  public void testAppendDuplicateRejected() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    DuplicateEventException e =
        assertThrows(DuplicateEventException.class, () -> store.append(OutboxEvent.of("1", "b")));
    assertThat(e.getEventId(), equalTo("1"));
    assertThat(store.listPending().getEvents(), contains(OutboxEvent.of("1", "a")));
  }

  @Test
  public void testAppendDuplicateOfTerminalRejected() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.markProcessed("1");
    assertThrows(DuplicateEventException.class, () -> store.append(OutboxEvent.of("1", "a")));
  }

  @Test
  public void testAppendTerminalEventRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> store.append(OutboxEvent.of("1", "a").processed()));
  }

  @Test
  public void testPayloadsWithSpecialCharacters() throws Exception {
    OutboxEvent event = OutboxEvent.of("id|1", "{\"a\":\"b|c\"}\nsecond line\\");
    store.append(event);
    assertThat(store.listPending().getEvents(), contains(event));
    assertThat(store.find("id|1").orElseThrow(), equalTo(event));
  }

  @Test
  public void testMarkProcessed() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.append(OutboxEvent.of("2", "b"));
    store.markProcessed("1");
    assertThat(store.listPending().getEvents(), contains(OutboxEvent.of("2", "b")));
    assertThat(store.find("1").orElseThrow(), equalTo(OutboxEvent.of("1", "a").processed()));
  }

  @Test
  public void testMarkFailed() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.markFailed("1", "no | route\nat all");
    assertThat(store.listPending().getEvents(), empty());
    assertThat(store.listFailed(), contains(OutboxEvent.of("1", "a").failed("no | route\nat all")));
  }

  @Test
  public void testRepeatedTransitionIsHarmless() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.markProcessed("1");
    store.markProcessed("1");
    assertThat(store.find("1").orElseThrow().getStatus(), equalTo(EventStatus.PROCESSED));
  }

  @Test
  public void testTerminalStatusNeverChanges() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.append(OutboxEvent.of("2", "b"));
    store.markProcessed("1");
    store.markFailed("2", "x");
    assertThrows(IllegalStateException.class, () -> store.markFailed("1", "late"));
    assertThrows(IllegalStateException.class, () -> store.markProcessed("2"));
    assertThat(store.find("1").orElseThrow().getStatus(), equalTo(EventStatus.PROCESSED));
    assertThat(store.find("2").orElseThrow().getStatus(), equalTo(EventStatus.FAILED));
  }

  @Test
  public void testUnknownIds() throws Exception {
    EventNotFoundException e =
        assertThrows(EventNotFoundException.class, () -> store.markProcessed("nope"));
    assertThat(e.getEventId(), equalTo("nope"));
    assertThrows(EventNotFoundException.class, () -> store.markFailed("nope", "x"));
    assertTrue(store.find("nope").isEmpty());
  }

  @Test
  public void testDeleteProcessed() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.append(OutboxEvent.of("2", "b"));
    store.append(OutboxEvent.of("3", "c"));
    store.markProcessed("1");
    store.markFailed("3", "x");
    assertEquals(1, store.deleteProcessed());
    assertEquals(0, store.deleteProcessed());
    assertTrue(store.find("1").isEmpty());
    assertThat(store.listPending().getEvents(), contains(OutboxEvent.of("2", "b")));
    assertThat(store.listFailed(), contains(OutboxEvent.of("3", "c").failed("x")));
  }

  @Test
  public void testClear() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.clear();
    assertThat(store.listPending().getEvents(), empty());
    store.append(OutboxEvent.of("1", "a"));
    assertThat(store.listPending().getEvents(), contains(OutboxEvent.of("1", "a")));
  }

  @Test
  public void testConcurrentAppendsAndUpdates() throws Exception {
    int count = 100;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<CompletableFuture<Void>> futures = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        String id = Integer.toString(i);
        futures.add(
            CompletableFuture.runAsync(
                () ->
                    Utils.uncheck(
                        () -> {
                          store.append(OutboxEvent.of(id, "payload " + id));
                          if (Integer.parseInt(id) % 2 == 0) {
                            store.markProcessed(id);
                          }
                        }),
                pool));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } finally {
      pool.shutdown();
    }
    List<String> expected =
        IntStream.range(0, count)
            .filter(i -> i % 2 == 1)
            .mapToObj(Integer::toString)
            .collect(Collectors.toList());
    assertThat(
        store.listPending().getEvents().stream()
            .map(OutboxEvent::getId)
            .collect(Collectors.toList()),
        containsInAnyOrder(expected.toArray()));
    assertEquals(count / 2, store.deleteProcessed());
  }
}
