package io.huntflow.core.error;

/** LOAD or SAVE could not read or write a file. */
public final class HuntflowIOException extends HuntflowException {

  public HuntflowIOException(String message, Throwable cause) {
    super(message, cause);
  }

  public HuntflowIOException(String message) {
    super(message);
  }

  @Override
  public String category() {
    return "IOError";
  }
}
