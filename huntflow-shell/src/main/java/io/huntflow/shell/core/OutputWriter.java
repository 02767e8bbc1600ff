package io.huntflow.shell.core;

import java.io.PrintStream;

/**
 * Where the shell writes. Rendered rows and listings go to {@link #println}; failures, warnings
 * and truncation footers go to {@link #error}, so batch output stays machine-readable.
 */
public interface OutputWriter {

  void println(String s);

  void error(String s);

  /** One formatted line; the format carries no line terminator. */
  default void line(String fmt, Object... args) {
    println(String.format(fmt, args));
  }

  default void warning(String message) {
    error("Warning: " + message);
  }

  static OutputWriter of(PrintStream out, PrintStream err) {
    return new StreamWriter(out, err);
  }

  static OutputWriter system() {
    return of(System.out, System.err);
  }

  /** Stream pair; stderr is flushed after each message so it interleaves with stdout. */
  final class StreamWriter implements OutputWriter {
    private final PrintStream out;
    private final PrintStream err;

    StreamWriter(PrintStream out, PrintStream err) {
      this.out = out;
      this.err = err;
    }

    @Override
    public void println(String s) {
      out.println(s);
    }

    @Override
    public void error(String s) {
      out.flush();
      err.println(s);
      err.flush();
    }
  }
}
