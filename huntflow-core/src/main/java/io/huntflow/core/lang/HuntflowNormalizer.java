package io.huntflow.core.lang;

import static io.huntflow.core.lang.Huntflow.*;

import io.huntflow.core.error.SemanticException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Completes a parsed program: binds result commands written without {@code VAR =} to the default
 * variable, fills omitted variable references in DISP/INFO/SAVE with the default variable, and
 * checks that every variable is bound before it is read.
 */
public final class HuntflowNormalizer {
  private final String defaultVariable;

  public HuntflowNormalizer() {
    this(DEFAULT_VARIABLE);
  }

  public HuntflowNormalizer(String defaultVariable) {
    this.defaultVariable = defaultVariable;
  }

  /**
   * Normalizes a program.
   *
   * @param program parsed program
   * @param alreadyBound variables bound before this program runs (e.g. earlier in the session)
   * @return normalized program
   * @throws SemanticException if a statement reads a variable not bound earlier in program order
   */
  public Program normalize(Program program, Collection<String> alreadyBound)
      throws SemanticException {
    Set<String> bound = new HashSet<>(alreadyBound);
    List<Statement> out = new ArrayList<>(program.statements().size());
    for (int i = 0; i < program.statements().size(); i++) {
      Statement s = program.statements().get(i);
      Command c = fillDefaults(s.command());
      for (String v : c.inputVariables()) {
        if (!bound.contains(v)) {
          throw (SemanticException)
              new SemanticException(
                      "Variable '" + v + "' is referenced before it is defined in "
                          + c.kind() + " statement")
                  .atStatement(i, s.text());
        }
      }
      Statement normalized = s.withCommand(c);
      if (c.kind().producesResult()) {
        if (normalized.output() == null) normalized = normalized.withOutput(defaultVariable);
        bound.add(normalized.output());
      }
      out.add(normalized);
    }
    return new Program(out);
  }

  private Command fillDefaults(Command c) {
    if (c instanceof DispCommand d && d.expression().variable() == null) {
      return new DispCommand(d.expression().withVariable(defaultVariable));
    }
    if (c instanceof InfoCommand info && info.variable() == null) {
      return new InfoCommand(defaultVariable);
    }
    if (c instanceof SaveCommand save && save.variable() == null) {
      return new SaveCommand(defaultVariable, save.path());
    }
    return c;
  }
}
