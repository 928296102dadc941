package com.gruelbox.outboxrelay.jackson;

import static com.gruelbox.outboxrelay.jackson.OutboxEventSerializer.FAILURE_REASON;
import static com.gruelbox.outboxrelay.jackson.OutboxEventSerializer.ID;
import static com.gruelbox.outboxrelay.jackson.OutboxEventSerializer.PAYLOAD;
import static com.gruelbox.outboxrelay.jackson.OutboxEventSerializer.STATUS;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.gruelbox.outboxrelay.EventStatus;
import com.gruelbox.outboxrelay.OutboxEvent;
import java.io.IOException;

class OutboxEventDeserializer extends StdDeserializer<OutboxEvent> {

  OutboxEventDeserializer() {
    super(OutboxEvent.class);
  }

  @Override
  public OutboxEvent deserialize(JsonParser p, DeserializationContext c) throws IOException {
    JsonNode node = p.getCodec().readTree(p);
    if (node == null || !node.isObject()) {
      return c.reportInputMismatch(this, "Expected an event object");
    }
    String id = requiredText(node, ID, c);
    String payload = requiredText(node, PAYLOAD, c);
    String token = requiredText(node, STATUS, c);
    EventStatus status = EventStatus.fromToken(token).orElse(null);
    if (status == null) {
      return c.reportInputMismatch(this, "Unknown status '%s'", token);
    }
    String reason = optionalText(node, FAILURE_REASON, c);
    try {
      return OutboxEvent.restore(id, payload, status, reason);
    } catch (IllegalArgumentException e) {
      return c.reportInputMismatch(this, e.getMessage());
    }
  }

  private String requiredText(JsonNode node, String field, DeserializationContext c)
      throws IOException {
    String value = optionalText(node, field, c);
    if (value == null) {
      return c.reportInputMismatch(this, "Missing field '%s'", field);
    }
    return value;
  }

  private String optionalText(JsonNode node, String field, DeserializationContext c)
      throws IOException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      return c.reportInputMismatch(this, "Field '%s' must be a string", field);
    }
    return value.asText();
  }
}
