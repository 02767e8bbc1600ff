package io.huntflow.shell;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.error.HuntflowException;
import io.huntflow.shell.cli.CommandDispatcher;
import io.huntflow.shell.cli.OutputFormat;
import io.huntflow.shell.cli.RenderingDisplaySink;
import io.huntflow.shell.cli.ShellCompleter;
import io.huntflow.shell.core.OutputWriter;
import io.huntflow.shell.core.SessionManager;
import io.huntflow.shell.core.Sessions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Interactive huntflow prompt with history and completion. */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final SessionManager sessions;
  private final CommandDispatcher dispatcher;
  private final DefaultHistory history;
  private final boolean quiet;
  private boolean running = true;

  public Shell(
      HuntflowConfig config, OutputFormat format, Map<String, String> variables, boolean quiet)
      throws IOException {
    this.terminal = TerminalBuilder.builder().system(true).build();
    this.quiet = quiet;
    OutputWriter io =
        new OutputWriter() {
          @Override
          public void println(String s) {
            terminal.writer().println(s);
            terminal.flush();
          }

          @Override
          public void error(String s) {
            terminal.writer().println(s);
            terminal.flush();
          }
        };
    RenderingDisplaySink display = new RenderingDisplaySink(io, format, quiet);
    this.sessions = Sessions.inMemory(config, display);
    this.dispatcher = new CommandDispatcher(sessions, display, io, variables);

    Path histPath = Paths.get(System.getProperty("user.home"), ".huntflow", "history");
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      LOG.warn("Cannot create history directory {}: {}", histPath.getParent(), e.getMessage());
    }
    this.history = new DefaultHistory();
    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variable(LineReader.HISTORY_FILE, histPath)
            .history(history)
            .completer(new ShellCompleter(sessions))
            .build();
  }

  public SessionManager sessions() {
    return sessions;
  }

  public void run() {
    if (!quiet) printBanner();
    while (running) {
      try {
        String input = lineReader.readLine(prompt());
        if (input == null || input.isBlank()) continue;
        input = input.trim();
        if (":quit".equalsIgnoreCase(input) || ":exit".equalsIgnoreCase(input)) {
          running = false;
          continue;
        }
        if (!dispatcher.dispatch(input)) {
          terminal.writer().println("Unknown command. Type ':help'.");
          terminal.flush();
        }
      } catch (HuntflowException e) {
        terminal.writer().println(e.describe());
        terminal.flush();
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        terminal.flush();
        running = false;
      } catch (RuntimeException e) {
        LOG.debug("command failed", e);
        terminal.writer().println("Error: " + e.getMessage());
        terminal.flush();
      }
    }
  }

  private String prompt() {
    return sessions.current().map(ref -> "huntflow[" + ref.label() + "]> ").orElse("huntflow> ");
  }

  private void printBanner() {
    terminal.writer().println("Huntflow shell. Type ':help' for commands, ':quit' to exit.");
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      sessions.closeAll();
    } finally {
      try {
        history.save();
      } catch (IOException e) {
        LOG.warn("Cannot save history: {}", e.getMessage());
      }
      terminal.close();
    }
  }
}
