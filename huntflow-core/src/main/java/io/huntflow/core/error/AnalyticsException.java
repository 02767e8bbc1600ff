package io.huntflow.core.error;

/** An analytics invocation failed or timed out. */
public final class AnalyticsException extends HuntflowException {

  public AnalyticsException(String message) {
    super(message);
  }

  public AnalyticsException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String category() {
    return "AnalyticsError";
  }
}
