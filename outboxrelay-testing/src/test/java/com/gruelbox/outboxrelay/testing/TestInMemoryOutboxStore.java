package com.gruelbox.outboxrelay.testing;

import com.gruelbox.outboxrelay.InMemoryOutboxStore;
import com.gruelbox.outboxrelay.OutboxStore;

class TestInMemoryOutboxStore extends AbstractOutboxStoreTest {

  @Override
  protected OutboxStore createStore() {
    return new InMemoryOutboxStore();
  }
}
