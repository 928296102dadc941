package com.gruelbox.outboxrelay.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleDeserializers;
import com.fasterxml.jackson.databind.module.SimpleSerializers;
import com.gruelbox.outboxrelay.OutboxEvent;

/** Teaches an {@link com.fasterxml.jackson.databind.ObjectMapper} to read and write events. */
public class OutboxRelayJacksonModule extends Module {

  @Override
  public String getModuleName() {
    return "OutboxRelayJacksonModule";
  }

  @Override
  public Version version() {
    return Version.unknownVersion();
  }

  @Override
  public void setupModule(SetupContext setupContext) {
    SimpleSerializers serializers = new SimpleSerializers();
    serializers.addSerializer(OutboxEvent.class, new OutboxEventSerializer());
    setupContext.addSerializers(serializers);

    SimpleDeserializers deserializers = new SimpleDeserializers();
    deserializers.addDeserializer(OutboxEvent.class, new OutboxEventDeserializer());
    setupContext.addDeserializers(deserializers);
  }
}
