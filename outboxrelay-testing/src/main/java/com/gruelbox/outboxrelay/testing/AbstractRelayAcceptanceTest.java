package com.gruelbox.outboxrelay.testing;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.outboxrelay.EventStatus;
import com.gruelbox.outboxrelay.OutboxEvent;
import com.gruelbox.outboxrelay.OutboxRelay;
import com.gruelbox.outboxrelay.OutboxStore;
import com.gruelbox.outboxrelay.RelayReport;
import com.gruelbox.outboxrelay.RetryPolicy;
import com.gruelbox.outboxrelay.ShutdownCoordinator;
import com.gruelbox.outboxrelay.Utils;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** End-to-end relay behaviour against a real store. Extend and supply the store under test. */
@Slf4j
public abstract class AbstractRelayAcceptanceTest {

  protected static final RetryPolicy FAST_RETRIES =
      RetryPolicy.exponential(Duration.ofMillis(5), 3);

  protected OutboxStore store;
  protected final ScriptedRelaySink sink = new ScriptedRelaySink();
  protected final RecordingListener listener = new RecordingListener();
  private OutboxRelay relay;

  /**
   * @return A new, empty store. Called before each test.
   */
  protected abstract OutboxStore createStore() throws Exception;

  /**
   * Simulates a process restart. Stores which can be reopened should return a fresh instance
   * reading the same data.
   */
  protected OutboxStore reopen(OutboxStore store) throws Exception {
    return store;
  }

  @BeforeEach
  void beforeEachBase() throws Exception {
    store = createStore();
    store.initialize();
    store.clear();
  }

  @AfterEach
  void afterEachBase() {
    if (relay != null) {
      relay.close();
    }
  }

  protected OutboxRelay.OutboxRelayBuilder relayBuilder() {
    return OutboxRelay.builder()
        .store(store)
        .sink(sink)
        .listener(listener)
        .retryPolicy(FAST_RETRIES)
        .pollInterval(Duration.ofMillis(50));
  }

  private OutboxRelay build(OutboxRelay.OutboxRelayBuilder builder) {
    if (relay != null) {
      relay.close();
    }
    relay = builder.build();
    return relay;
  }

  @Test
  final void deliversOneTwoThreeWithPermanentFailureOnTwo() throws Exception {
    sink.failPermanently("2");
    OutboxRelay relay = build(relayBuilder());
    store.append(OutboxEvent.of("1", "first"));
    store.append(OutboxEvent.of("2", "second"));
    store.append(OutboxEvent.of("3", "third"));

    RelayReport report = relay.relayPending();

    assertEquals(2, report.getProcessed());
    assertEquals(1, report.getFailed());
    assertEquals(1, sink.attempts("2"));
    assertThat(sink.acceptedIds(), containsInAnyOrder("1", "3"));
    assertThat(store.listPending().getEvents(), empty());
    assertThat(store.find("2").orElseThrow().getStatus(), equalTo(EventStatus.FAILED));
  }

  @Test
  final void transientFailuresExhaustRetries() throws Exception {
    sink.failTransientlyForever("1");
    OutboxRelay relay = build(relayBuilder());
    store.append(OutboxEvent.of("1", "a"));

    relay.relayPending();

    assertEquals(3, sink.attempts("1"));
    assertThat(listener.getFailures().size(), equalTo(3));
    assertThat(listener.getFailed().size(), equalTo(1));
    assertThat(
        store.listFailed().stream().map(OutboxEvent::getId).collect(Collectors.toList()),
        contains("1"));
  }

  @Test
  final void transientFailuresRecover() throws Exception {
    sink.failTransiently("1", 2);
    OutboxRelay relay = build(relayBuilder());
    relay.schedule(OutboxEvent.of("1", "a"));

    await().atMost(10, SECONDS).until(() -> listener.terminalCount() == 1);

    assertThat(sink.acceptedIds(), contains("1"));
    assertEquals(3, sink.attempts("1"));
    assertThat(store.find("1").orElseThrow().getStatus(), equalTo(EventStatus.PROCESSED));
  }

  @Test
  final void backgroundPollingDrainsTheStore() throws Exception {
    int count = 30;
    for (int i = 0; i < count; i++) {
      if (i % 5 == 0) {
        sink.failTransiently(Integer.toString(i), 1);
      }
    }
    OutboxRelay relay = build(relayBuilder().concurrency(3));
    relay.start();
    for (int i = 0; i < count; i++) {
      relay.schedule(OutboxEvent.of(Integer.toString(i), "payload " + i));
    }

    await().atMost(30, SECONDS).until(() -> store.listPending().isEmpty());

    List<String> expected =
        IntStream.range(0, count).mapToObj(Integer::toString).collect(Collectors.toList());
    assertThat(store.listFailed(), empty());
    assertTrue(sink.acceptedIds().containsAll(expected));
    assertThat(sink.getMaxConcurrentCalls(), lessThanOrEqualTo(3));
  }

  @Test
  final void concurrencyIsBounded() throws Exception {
    OutboxRelay relay = build(relayBuilder().concurrency(2));
    for (int i = 0; i < 20; i++) {
      store.append(OutboxEvent.of(Integer.toString(i), "x"));
    }

    assertEquals(20, relay.relayPending().getProcessed());
    assertThat(sink.getMaxConcurrentCalls(), lessThanOrEqualTo(2));
  }

  @Test
  final void pendingEventsSurviveRestart() throws Exception {
    store.append(OutboxEvent.of("1", "a"));
    store.append(OutboxEvent.of("2", "b"));
    store.markProcessed("1");

    store = reopen(store);
    OutboxRelay relay = build(relayBuilder());
    RelayReport report = relay.relayPending();

    assertEquals(1, report.getProcessed());
    assertThat(sink.calledIds(), contains("2"));
  }

  @Test
  final void shutdownDrainsInFlightAndLeavesQueuedPending() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    sink.hold("1", entered, release);
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    OutboxRelay relay = build(relayBuilder().concurrency(1).shutdownCoordinator(coordinator));
    store.append(OutboxEvent.of("1", "a"));
    store.append(OutboxEvent.of("2", "b"));
    store.append(OutboxEvent.of("3", "c"));

    CompletableFuture<RelayReport> pass =
        CompletableFuture.supplyAsync(() -> Utils.uncheckedly(relay::relayPending));
    assertTrue(entered.await(10, SECONDS));
    CompletableFuture<Void> closing = CompletableFuture.runAsync(relay::close);
    await().atMost(10, SECONDS).until(coordinator::isShuttingDown);
    assertThat(closing.isDone(), equalTo(false));
    release.countDown();
    closing.get(10, SECONDS);

    RelayReport report = pass.get(10, SECONDS);
    assertEquals(1, report.getProcessed());
    assertEquals(2, report.getDeferred());
    assertThat(sink.calledIds(), contains("1"));
    assertThat(
        store.listPending().getEvents().stream()
            .map(OutboxEvent::getId)
            .collect(Collectors.toList()),
        contains("2", "3"));

    store = reopen(store);
    OutboxRelay restarted = build(relayBuilder());
    assertEquals(2, restarted.relayPending().getProcessed());
    assertThat(sink.acceptedIds(), containsInAnyOrder("1", "2", "3"));
  }

  @Test
  final void purgeProcessedKeepsOnlyUnfinishedWork() throws Exception {
    sink.failPermanently("2");
    OutboxRelay relay = build(relayBuilder().purgeProcessed(true));
    store.append(OutboxEvent.of("1", "a"));
    store.append(OutboxEvent.of("2", "b"));

    relay.relayPending();

    assertTrue(store.find("1").isEmpty());
    assertThat(store.find("2").orElseThrow().getStatus(), equalTo(EventStatus.FAILED));
  }
}
