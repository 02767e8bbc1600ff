package io.huntflow.core.interpreter;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a huntflow that ran to completion.
 *
 * @param statements number of statements executed
 * @param boundVariables variables bound or replaced, in binding order, without repeats
 * @param elapsed wall time of the run
 */
public record ExecutionResult(int statements, List<String> boundVariables, Duration elapsed) {
  public ExecutionResult {
    boundVariables = List.copyOf(boundVariables);
  }
}
