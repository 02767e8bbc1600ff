package io.huntflow.core.error;

/** Huntflow text could not be parsed. Always raised before any statement executes. */
public final class HuntflowSyntaxException extends HuntflowException {
  private final int line;
  private final int column;

  public HuntflowSyntaxException(String message, int line, int column) {
    super(String.format("%s [line %d, column %d]", message, line, column));
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String category() {
    return "SyntaxError";
  }
}
