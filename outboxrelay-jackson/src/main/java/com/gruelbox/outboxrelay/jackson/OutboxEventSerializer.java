package com.gruelbox.outboxrelay.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.gruelbox.outboxrelay.OutboxEvent;
import java.io.IOException;

class OutboxEventSerializer extends StdSerializer<OutboxEvent> {

  static final String ID = "id";
  static final String PAYLOAD = "payload";
  static final String STATUS = "status";
  static final String FAILURE_REASON = "failureReason";

  OutboxEventSerializer() {
    super(OutboxEvent.class);
  }

  @Override
  public void serialize(OutboxEvent event, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    gen.writeStartObject();
    gen.writeStringField(ID, event.getId());
    gen.writeStringField(PAYLOAD, event.getPayload());
    gen.writeStringField(STATUS, event.getStatus().getToken());
    if (event.getFailureReason() != null) {
      gen.writeStringField(FAILURE_REASON, event.getFailureReason());
    }
    gen.writeEndObject();
  }
}
