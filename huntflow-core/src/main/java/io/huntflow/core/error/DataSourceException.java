package io.huntflow.core.error;

/** A datasource connector failed (unknown datasource, network, authentication, timeout). */
public final class DataSourceException extends HuntflowException {

  public DataSourceException(String message) {
    super(message);
  }

  public DataSourceException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String category() {
    return "DataSourceError";
  }
}
