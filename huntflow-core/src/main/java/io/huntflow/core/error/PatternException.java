package io.huntflow.core.error;

/** A WHERE pattern failed to compile: arity or type mismatch, bad qualifier or attribute. */
public final class PatternException extends SemanticException {

  public PatternException(String message) {
    super(message);
  }

  public PatternException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String category() {
    return "PatternError";
  }
}
