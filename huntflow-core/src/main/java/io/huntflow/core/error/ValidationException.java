package io.huntflow.core.error;

/** Malformed literal or schema violation while constructing entities in NEW or LOAD. */
public final class ValidationException extends HuntflowException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String category() {
    return "ValidationError";
  }
}
