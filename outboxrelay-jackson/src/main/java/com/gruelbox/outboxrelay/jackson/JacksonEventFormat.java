package com.gruelbox.outboxrelay.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gruelbox.outboxrelay.EventFormat;
import com.gruelbox.outboxrelay.EventParseException;
import com.gruelbox.outboxrelay.OutboxEvent;
import com.gruelbox.outboxrelay.UncheckedException;
import lombok.Builder;

/**
 * An {@link EventFormat} writing each event as a single-line JSON object (JSON Lines), e.g.
 *
 * <pre>{"id":"42","payload":"{\"amount\":10}","status":"failed","failureReason":"rejected"}</pre>
 *
 * <p>Records are larger than those of {@link EventFormat#delimited()} but can be read by any JSON
 * tooling. Plug into a store with {@code
 * FileOutboxStore.builder().path(path).format(JacksonEventFormat.builder().build())}.
 */
public final class JacksonEventFormat implements EventFormat {

  private final ObjectMapper mapper;

  /**
   * @param mapper The mapper to base this format on. It is copied rather than modified. Defaults
   *     to a plain {@link ObjectMapper}.
   */
  @Builder
  private JacksonEventFormat(ObjectMapper mapper) {
    this.mapper = mapper == null ? new ObjectMapper() : mapper.copy();
    this.mapper.disable(SerializationFeature.INDENT_OUTPUT);
    this.mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.mapper.registerModule(new OutboxRelayJacksonModule());
  }

  @Override
  public String format(OutboxEvent event) {
    try {
      return mapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new UncheckedException(e);
    }
  }

  @Override
  public OutboxEvent parse(String record) throws EventParseException {
    try {
      OutboxEvent event = mapper.readValue(record, OutboxEvent.class);
      if (event == null) {
        throw new EventParseException("Record is JSON null");
      }
      return event;
    } catch (JsonProcessingException e) {
      throw new EventParseException(e.getOriginalMessage(), e);
    }
  }

  @Override
  public String toString() {
    return "JacksonEventFormat";
  }
}
