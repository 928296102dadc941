package com.gruelbox.outboxrelay;

import java.util.ArrayList;
import java.util.List;

/**
 * The default record format: {@code id|payload|status}, with {@code status} one of {@code
 * pending}, {@code processed} or {@code failed}. A failed record may carry its reason after a
 * colon, as in {@code 42|{"amount":0}|failed:rejected by sink}.
 *
 * <p>Backslash escapes ({@code \\}, {@code \|}, {@code \n} and {@code \r}) allow ids, payloads and
 * reasons to contain the delimiter or line breaks.
 */
final class DelimitedEventFormat implements EventFormat {

  static final DelimitedEventFormat INSTANCE = new DelimitedEventFormat();

  private static final char DELIMITER = '|';
  private static final char ESCAPE = '\\';
  private static final char REASON_SEPARATOR = ':';
  private static final int FIELD_COUNT = 3;

  private DelimitedEventFormat() {}

  @Override
  public String format(OutboxEvent event) {
    StringBuilder sb = new StringBuilder(event.getId().length() + event.getPayload().length() + 16);
    escape(event.getId(), sb);
    sb.append(DELIMITER);
    escape(event.getPayload(), sb);
    sb.append(DELIMITER);
    sb.append(event.getStatus().getToken());
    if (event.getFailureReason() != null) {
      sb.append(REASON_SEPARATOR);
      escape(event.getFailureReason(), sb);
    }
    return sb.toString();
  }

  @Override
  public OutboxEvent parse(String record) throws EventParseException {
    List<String> fields = split(record);
    if (fields.size() != FIELD_COUNT) {
      throw new EventParseException(
          String.format("Expected %d fields but found %d", FIELD_COUNT, fields.size()));
    }
    String id = unescape(fields.get(0));
    String payload = unescape(fields.get(1));

    String statusField = fields.get(2);
    int separator = statusField.indexOf(REASON_SEPARATOR);
    String token = separator < 0 ? statusField : statusField.substring(0, separator);
    EventStatus status =
        EventStatus.fromToken(token)
            .orElseThrow(() -> new EventParseException("Unknown status '" + token + "'"));
    String reason = separator < 0 ? null : unescape(statusField.substring(separator + 1));
    if (reason != null && status != EventStatus.FAILED) {
      throw new EventParseException("Only failed records may carry a reason");
    }
    try {
      return OutboxEvent.restore(id, payload, status, reason);
    } catch (IllegalArgumentException e) {
      throw new EventParseException(e.getMessage(), e);
    }
  }

  private static void escape(String value, StringBuilder sb) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case ESCAPE:
          sb.append(ESCAPE).append(ESCAPE);
          break;
        case DELIMITER:
          sb.append(ESCAPE).append(DELIMITER);
          break;
        case '\n':
          sb.append(ESCAPE).append('n');
          break;
        case '\r':
          sb.append(ESCAPE).append('r');
          break;
        default:
          sb.append(c);
      }
    }
  }

  /** Splits on unescaped delimiters, leaving escapes in place. */
  private static List<String> split(String record) throws EventParseException {
    List<String> fields = new ArrayList<>(FIELD_COUNT);
    int start = 0;
    for (int i = 0; i < record.length(); i++) {
      char c = record.charAt(i);
      if (c == ESCAPE) {
        if (i + 1 == record.length()) {
          throw new EventParseException("Dangling escape at end of record");
        }
        i++;
      } else if (c == DELIMITER) {
        fields.add(record.substring(start, i));
        start = i + 1;
      }
    }
    fields.add(record.substring(start));
    return fields;
  }

  private static String unescape(String field) throws EventParseException {
    if (field.indexOf(ESCAPE) < 0) {
      return field;
    }
    StringBuilder sb = new StringBuilder(field.length());
    for (int i = 0; i < field.length(); i++) {
      char c = field.charAt(i);
      if (c != ESCAPE) {
        sb.append(c);
        continue;
      }
      if (++i == field.length()) {
        throw new EventParseException("Dangling escape");
      }
      char escaped = field.charAt(i);
      switch (escaped) {
        case ESCAPE:
        case DELIMITER:
          sb.append(escaped);
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        default:
          throw new EventParseException("Unknown escape \\" + escaped);
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "DelimitedEventFormat";
  }
}
