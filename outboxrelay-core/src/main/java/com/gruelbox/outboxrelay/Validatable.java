package com.gruelbox.outboxrelay;

/** Implemented by configuration objects which can check their own settings. */
public interface Validatable {

  /**
   * Checks the object's state, reporting the first problem found.
   *
   * @param validator Collects the property path and raises {@link IllegalArgumentException}.
   */
  void validate(Validator validator);
}
