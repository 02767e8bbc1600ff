package io.huntflow.shell.cli;

import io.huntflow.core.error.HuntflowException;
import io.huntflow.core.interpreter.ExecutionResult;
import io.huntflow.shell.core.SessionManager;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs huntflow files. Variables in the form ${name} are substituted with values provided via the
 * constructor, then the whole file runs as one huntflow in the current session.
 *
 * <p>Example script:
 *
 * <pre>
 * # processes of the last hour
 * procs = GET process FROM ${datasource} WHERE name = '${name}' LAST 60 MINUTES
 * DISP procs ATTR name, pid
 * </pre>
 */
public class ScriptRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

  private static final Pattern VAR_PATTERN = Pattern.compile("\\$\\{([^}]+)\\}");

  private final SessionManager sessions;
  private final Map<String, String> variables;

  /**
   * Creates a script runner.
   *
   * @param sessions sessions the scripts run in
   * @param variables variable map for substitution
   */
  public ScriptRunner(SessionManager sessions, Map<String, String> variables) {
    this.sessions = sessions;
    this.variables = variables;
  }

  /**
   * Executes a script file.
   *
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the script references an undefined variable
   * @throws HuntflowException the failure of the huntflow
   */
  public ExecutionResult execute(Path scriptPath) throws IOException, HuntflowException {
    String text = Files.readString(scriptPath, StandardCharsets.UTF_8);
    LOG.debug("running script {}", scriptPath);
    return execute(text);
  }

  /** Executes script text. */
  public ExecutionResult execute(String script) throws HuntflowException {
    return sessions.execute(substituteVariables(script));
  }

  /**
   * Substitutes variables.
   *
   * @throws IllegalArgumentException if a referenced variable is undefined
   */
  String substituteVariables(String text) {
    StringBuilder result = new StringBuilder();
    Matcher matcher = VAR_PATTERN.matcher(text);
    while (matcher.find()) {
      String varName = matcher.group(1);
      String value = variables.get(varName);
      if (value == null) {
        throw new IllegalArgumentException(
            "Undefined variable: " + varName + ". Define with --var " + varName + "=value");
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
