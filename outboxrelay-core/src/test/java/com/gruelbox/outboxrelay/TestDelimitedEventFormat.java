package com.gruelbox.outboxrelay;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TestDelimitedEventFormat {

  private final EventFormat format = EventFormat.delimited();

  @Test
  void formatsPlainRecords() {
    assertThat(format.format(OutboxEvent.of("1", "a")), equalTo("1|a|pending"));
    assertThat(format.format(OutboxEvent.of("1", "a").processed()), equalTo("1|a|processed"));
    assertThat(
        format.format(OutboxEvent.of("1", "a").failed("no route")),
        equalTo("1|a|failed:no route"));
  }

  @Test
  void parsesPlainRecords() throws EventParseException {
    OutboxEvent event = format.parse("2|b|processed");
    assertThat(event.getId(), equalTo("2"));
    assertThat(event.getPayload(), equalTo("b"));
    assertThat(event.getStatus(), equalTo(EventStatus.PROCESSED));
    assertThat(event.getFailureReason(), nullValue());
  }

  @Test
  void parsesFailedWithoutReason() throws EventParseException {
    OutboxEvent event = format.parse("3|c|failed");
    assertThat(event.getStatus(), equalTo(EventStatus.FAILED));
    assertThat(event.getFailureReason(), nullValue());
  }

  @Test
  void escapesDelimitersAndLineBreaks() throws EventParseException {
    OutboxEvent event = OutboxEvent.of("a|b", "line1\nline2\r\\end|").failed("bad | worse\n");
    String record = format.format(event);
    assertThat(record, not(containsString("\n")));
    assertThat(record, not(containsString("\r")));
    assertThat(record, equalTo("a\\|b|line1\\nline2\\r\\\\end\\||failed:bad \\| worse\\n"));
    assertThat(format.parse(record), equalTo(event));
  }

  @Test
  void reasonMayContainColons() throws EventParseException {
    OutboxEvent event = OutboxEvent.of("4", "d").failed("java.io.IOException: boom");
    assertThat(format.parse(format.format(event)), equalTo(event));
  }

  @Test
  void emptyPayloadSurvives() throws EventParseException {
    OutboxEvent event = OutboxEvent.of("5", "");
    assertThat(format.format(event), equalTo("5||pending"));
    assertThat(format.parse("5||pending"), equalTo(event));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "garbage",
        "1|a",
        "1|a|pending|extra",
        "1|a|done",
        "1|a|PENDING",
        "|a|pending",
        " |a|pending",
        "1|a|pending:why",
        "1|a|processed:why",
        "1|a\\x|pending",
        "1|a|pending\\"
      })
  void rejectsMalformedRecords(String record) {
    assertThrows(EventParseException.class, () -> format.parse(record));
  }

  @Test
  void unknownStatusIsNamed() {
    EventParseException e =
        assertThrows(EventParseException.class, () -> format.parse("1|a|shipped"));
    assertThat(e.getMessage(), containsString("shipped"));
  }
}
