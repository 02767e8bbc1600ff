package io.huntflow.shell.core;

/** Output writer capturing both streams, for assertions on shell output. */
public final class BufferedOutput implements OutputWriter {
  private final StringBuilder out = new StringBuilder();
  private final StringBuilder err = new StringBuilder();

  @Override
  public void println(String s) {
    out.append(s).append('\n');
  }

  @Override
  public void error(String s) {
    err.append(s).append('\n');
  }

  public String out() {
    return out.toString();
  }

  public String err() {
    return err.toString();
  }
}
