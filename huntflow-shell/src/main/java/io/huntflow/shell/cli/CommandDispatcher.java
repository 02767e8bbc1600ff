package io.huntflow.shell.cli;

import io.huntflow.core.error.HuntflowException;
import io.huntflow.core.interpreter.ExecutionResult;
import io.huntflow.core.session.HuntflowSession;
import io.huntflow.core.session.Variable;
import io.huntflow.shell.core.OutputWriter;
import io.huntflow.shell.core.SessionManager;
import io.huntflow.shell.core.SessionManager.SessionRef;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes shell input: lines starting with ':' are shell commands, anything else is a huntflow run
 * in the current session.
 */
public class CommandDispatcher {
  static final List<String> COMMANDS =
      List.of(
          ":sessions", ":new", ":use", ":close", ":vars", ":format", ":script", ":help", ":quit");

  private final SessionManager sessions;
  private final RenderingDisplaySink display;
  private final OutputWriter io;
  private final Map<String, String> scriptVariables;

  public CommandDispatcher(
      SessionManager sessions,
      RenderingDisplaySink display,
      OutputWriter io,
      Map<String, String> scriptVariables) {
    this.sessions = sessions;
    this.display = display;
    this.io = io;
    this.scriptVariables = scriptVariables;
  }

  public static boolean isCommand(String line) {
    return line.trim().startsWith(":");
  }

  /**
   * Handles one line of input.
   *
   * @return false for an unknown shell command
   * @throws HuntflowException the failure of a huntflow
   */
  public boolean dispatch(String line) throws HuntflowException {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) return true;
    if (!isCommand(trimmed)) {
      ExecutionResult result = sessions.execute(trimmed);
      if (!result.boundVariables().isEmpty()) {
        io.println("bound: " + String.join(", ", result.boundVariables()));
      }
      return true;
    }

    String[] parts = trimmed.split("\\s+");
    String cmd = parts[0].toLowerCase(Locale.ROOT);
    List<String> args = Arrays.asList(parts).subList(1, parts.length);
    switch (cmd) {
      case ":sessions":
        cmdSessions();
        return true;
      case ":new":
        cmdNew(args);
        return true;
      case ":use":
        cmdUse(args);
        return true;
      case ":close":
        cmdClose(args);
        return true;
      case ":vars":
        cmdVars();
        return true;
      case ":format":
        cmdFormat(args);
        return true;
      case ":script":
        cmdScript(args);
        return true;
      case ":help":
        printHelp();
        return true;
      default:
        return false;
    }
  }

  private void cmdSessions() {
    List<SessionRef> list = sessions.list();
    if (list.isEmpty()) {
      io.println("No sessions.");
      return;
    }
    Optional<SessionRef> current = sessions.current();
    for (SessionRef ref : list) {
      boolean isCurrent = current.isPresent() && current.get().id == ref.id;
      io.line(
          "%s %d%s  %d variable(s)",
          isCurrent ? "*" : " ",
          ref.id,
          ref.alias != null ? " (" + ref.alias + ")" : "",
          ref.session().variableNames().size());
    }
  }

  private void cmdNew(List<String> args) throws HuntflowException {
    String alias = args.isEmpty() ? null : args.get(0);
    try {
      SessionRef ref = sessions.open(alias);
      io.println("Opened session #" + ref.id + (alias != null ? " (" + alias + ")" : ""));
    } catch (IllegalArgumentException e) {
      io.error(e.getMessage());
    }
  }

  private void cmdUse(List<String> args) {
    if (args.isEmpty()) {
      io.error("Usage: :use <id|alias>");
      return;
    }
    if (sessions.use(args.get(0))) {
      io.println("Using session " + args.get(0));
    } else {
      io.error("No such session: " + args.get(0));
    }
  }

  private void cmdClose(List<String> args) {
    if (!args.isEmpty() && "--all".equals(args.get(0))) {
      sessions.closeAll();
      io.println("Closed all sessions");
      return;
    }
    Optional<SessionRef> target =
        args.isEmpty() ? sessions.current() : sessions.get(args.get(0));
    if (target.isEmpty()) {
      io.error(args.isEmpty() ? "No current session" : "No such session: " + args.get(0));
      return;
    }
    sessions.close(String.valueOf(target.get().id));
    io.println("Closed session " + target.get().label());
  }

  private void cmdVars() throws HuntflowException {
    Optional<SessionRef> current = sessions.current();
    if (current.isEmpty() || current.get().session().variableNames().isEmpty()) {
      io.println("No variables.");
      return;
    }
    HuntflowSession session = current.get().session();
    for (Variable v : session.variables()) {
      io.line(
          "  %-16s %-20s %6d rows  (%s)",
          v.name(),
          v.entityType() != null ? v.entityType() : "-",
          session.store().describe(v.rows()).rowCount(),
          v.provenance());
    }
  }

  private void cmdFormat(List<String> args) {
    if (args.isEmpty()) {
      io.println("Output format: " + display.format().name().toLowerCase(Locale.ROOT));
      return;
    }
    try {
      display.setFormat(OutputFormat.parse(args.get(0)));
    } catch (IllegalArgumentException e) {
      io.error(e.getMessage());
    }
  }

  private void cmdScript(List<String> args) throws HuntflowException {
    if (args.isEmpty()) {
      io.error("Usage: :script <path> [--var key=value]...");
      return;
    }
    Map<String, String> variables = new HashMap<>(scriptVariables);
    for (int i = 1; i < args.size(); i += 2) {
      if ("--var".equals(args.get(i)) && i + 1 < args.size()) {
        String[] kv = args.get(i + 1).split("=", 2);
        if (kv.length == 2) variables.put(kv[0], kv[1]);
      }
    }
    Path path = Paths.get(args.get(0));
    if (!Files.isRegularFile(path)) {
      io.error("Script file not found: " + path);
      return;
    }
    try {
      ExecutionResult result = new ScriptRunner(sessions, variables).execute(path);
      io.println(
          "Script executed: " + result.statements() + " statement(s) in "
              + result.elapsed().toMillis() + " ms");
    } catch (IOException | IllegalArgumentException e) {
      io.error("Script execution failed: " + e.getMessage());
    }
  }

  void printHelp() {
    io.println("Huntflow statements run in the current session, e.g.");
    io.println("  procs = GET process FROM ds1 WHERE name = 'cmd.exe' LAST 7 DAYS");
    io.println("  DISP procs ATTR name, pid SORT BY pid DESC LIMIT 10");
    io.println("");
    io.println("Shell commands:");
    io.println("  :sessions                      List sessions (* marks the current one)");
    io.println("  :new [alias]                   Open a new session and switch to it");
    io.println("  :use <id|alias>                Switch current session");
    io.println("  :close [id|alias|--all]        Close session(s)");
    io.println("  :vars                          List variables of the current session");
    io.println("  :format [table|csv|json]       Show or set the DISP output format");
    io.println("  :script <path> [--var k=v]...  Run a huntflow file, substituting ${k}");
    io.println("  :help                          Show this help");
    io.println("  :quit                          Exit");
  }
}
