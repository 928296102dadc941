package com.gruelbox.outboxrelay;

/**
 * Converts events to and from the single-line records held by {@link FileOutboxStore}. A formatted
 * record must not contain a line break, and {@link #parse(String)} must return an event equal to
 * the one formatted.
 */
public interface EventFormat {

  /**
   * @return The default {@code id|payload|status} format.
   */
  static EventFormat delimited() {
    return DelimitedEventFormat.INSTANCE;
  }

  /**
   * @param event The event.
   * @return The record, without a line terminator.
   */
  String format(OutboxEvent event);

  /**
   * @param record One record, without its line terminator.
   * @return The event.
   * @throws EventParseException If the record is malformed.
   */
  OutboxEvent parse(String record) throws EventParseException;
}
