package io.huntflow.shell;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.error.HuntflowException;
import io.huntflow.core.interpreter.ExecutionResult;
import io.huntflow.shell.cli.OutputFormat;
import io.huntflow.shell.cli.RenderingDisplaySink;
import io.huntflow.shell.cli.ScriptRunner;
import io.huntflow.shell.core.OutputWriter;
import io.huntflow.shell.core.SessionManager;
import io.huntflow.shell.core.Sessions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "huntflow",
    description = "Runs huntflow scripts, or an interactive huntflow shell when none is given",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "Huntflow script to run; repeat to run several in one session")
  private List<Path> files = new ArrayList<>();

  @CommandLine.Option(
      names = {"-e", "--execute"},
      description = "Huntflow text to run after the scripts")
  private String huntflow;

  @CommandLine.Option(
      names = "--var",
      description = "Script variable, substituted for ${key}")
  private Map<String, String> variables = new LinkedHashMap<>();

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Configuration file (default: ~/.huntflow/config.json)")
  private Path config;

  @CommandLine.Option(
      names = "--format",
      description = "DISP output format: table, csv or json (default: ${DEFAULT-VALUE})",
      defaultValue = "table",
      converter = FormatConverter.class)
  private OutputFormat format;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner, titles and row counts")
  private boolean quiet;

  @CommandLine.Option(
      names = "--continue-on-error",
      description = "Run the remaining scripts after one fails")
  private boolean continueOnError;

  static final class FormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
    @Override
    public OutputFormat convert(String value) {
      return OutputFormat.parse(value);
    }
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    HuntflowConfig cfg;
    try {
      cfg = HuntflowConfig.load(config, System.getProperties(), System.getenv());
    } catch (HuntflowException e) {
      System.err.println(e.describe());
      return 2;
    }
    if (files.isEmpty() && huntflow == null) {
      try (Shell shell = new Shell(cfg, format, variables, quiet)) {
        shell.run();
        return 0;
      }
    }
    OutputWriter out = OutputWriter.system();
    SessionManager sessions = Sessions.inMemory(cfg, new RenderingDisplaySink(out, format, quiet));
    try {
      return runBatch(sessions, out);
    } finally {
      sessions.closeAll();
    }
  }

  /** Runs the scripts, then the inline huntflow; exit code 1 if any failed. */
  int runBatch(SessionManager sessions, OutputWriter out) {
    ScriptRunner runner = new ScriptRunner(sessions, variables);
    boolean failed = false;
    for (Path file : files) {
      if (failed && !continueOnError) break;
      if (!Files.isRegularFile(file)) {
        out.error("Error: script file not found: " + file);
        failed = true;
        continue;
      }
      try {
        report(file.toString(), runner.execute(file), out);
      } catch (HuntflowException e) {
        out.error(file + ": " + e.describe());
        failed = true;
      } catch (IOException | IllegalArgumentException e) {
        out.error(file + ": " + e.getMessage());
        failed = true;
      }
    }
    if (huntflow != null && (!failed || continueOnError)) {
      try {
        report("huntflow", runner.execute(huntflow), out);
      } catch (HuntflowException e) {
        out.error(e.describe());
        failed = true;
      } catch (IllegalArgumentException e) {
        out.error(e.getMessage());
        failed = true;
      }
    }
    return failed ? 1 : 0;
  }

  private void report(String what, ExecutionResult result, OutputWriter out) {
    if (quiet) return;
    out.error(
        what + ": " + result.statements() + " statement(s) in " + result.elapsed().toMillis()
            + " ms");
  }
}
