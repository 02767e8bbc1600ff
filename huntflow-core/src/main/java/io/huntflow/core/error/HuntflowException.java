package io.huntflow.core.error;

/**
 * Base class of every failure raised while parsing or executing a huntflow.
 *
 * <p>The interpreter attaches the failing statement (index and source text) before the exception
 * leaves {@code execute}, so messages shown to the analyst always name the command that failed.
 */
public abstract class HuntflowException extends Exception {
  private int statementIndex = -1;
  private String statementText;

  protected HuntflowException(String message) {
    super(message);
  }

  protected HuntflowException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short category name used in rendered error messages (e.g. "SemanticError"). */
  public abstract String category();

  /**
   * Records the statement this failure belongs to. Only the first call has an effect.
   *
   * @param index zero-based statement index in the huntflow
   * @param text statement source text
   * @return this exception
   */
  public HuntflowException atStatement(int index, String text) {
    if (statementIndex < 0) {
      this.statementIndex = index;
      this.statementText = text;
    }
    return this;
  }

  public int getStatementIndex() {
    return statementIndex;
  }

  public String getStatementText() {
    return statementText;
  }

  /** Message prefixed with category and statement context, for display. */
  public String describe() {
    StringBuilder sb = new StringBuilder(category()).append(": ").append(getMessage());
    if (statementIndex >= 0) {
      sb.append(" (statement ").append(statementIndex + 1);
      if (statementText != null) {
        sb.append(": ").append(statementText);
      }
      sb.append(')');
    }
    if (getCause() != null && getCause().getMessage() != null) {
      sb.append("\n  caused by: ").append(getCause().getMessage());
    }
    return sb.toString();
  }
}
