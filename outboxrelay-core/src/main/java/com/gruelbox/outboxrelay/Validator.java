package com.gruelbox.outboxrelay;

import java.time.Duration;

/**
 * Checks {@link Validatable} objects, prefixing every problem with the dotted path of the
 * property that failed, e.g. {@code OutboxRelayImpl.retryPolicy.maxAttempts must be at least 1}.
 */
public final class Validator {

  private final String path;

  Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  public void valid(String propertyName, Object object) {
    notNull(propertyName, object);
    if (!(object instanceof Validatable)) {
      return;
    }
    ((Validatable) object)
        .validate(new Validator(path.isEmpty() ? propertyName : (path + "." + propertyName)));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  public void isTrue(String propertyName, boolean condition, String message, Object... args) {
    if (!condition) {
      error(propertyName, String.format(message, args));
    }
  }

  public void notBlank(String propertyName, String object) {
    notNull(propertyName, object);
    if (object.isBlank()) {
      error(propertyName, "may not be blank");
    }
  }

  public void min(String propertyName, int object, int minimumValue) {
    if (object < minimumValue) {
      error(propertyName, "must be at least " + minimumValue);
    }
  }

  public void positive(String propertyName, Duration duration) {
    notNull(propertyName, duration);
    if (duration.isNegative() || duration.isZero()) {
      error(propertyName, "must be positive");
    }
  }

  public void nullOrPositive(String propertyName, Duration duration) {
    if (duration != null) {
      positive(propertyName, duration);
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
