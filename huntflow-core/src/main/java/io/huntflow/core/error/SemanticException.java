package io.huntflow.core.error;

/** Undefined variable, type mismatch, bad attribute path and similar statement-level errors. */
public class SemanticException extends HuntflowException {

  public SemanticException(String message) {
    super(message);
  }

  public SemanticException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String category() {
    return "SemanticError";
  }
}
