package io.huntflow.core.pattern;

import io.huntflow.core.error.SemanticException;
import java.util.List;
import java.util.Set;

/**
 * What the pattern compiler knows about the subject of a filter.
 *
 * @param subjectType entity type the pattern applies to
 * @param schema attributes of the subject, or null when unknown (e.g. a connector query)
 * @param references resolves {@code variable.attribute} operands, or null to disable them
 */
public record CompileContext(String subjectType, Set<String> schema, ReferenceResolver references) {

  /** Resolves values of bound variables for patterns such as {@code name = procs.name}. */
  public interface ReferenceResolver {
    boolean isVariable(String name);

    /** Distinct non-null values of an attribute of a bound variable. */
    List<Object> attributeValues(String variable, String attribute) throws SemanticException;
  }

  public static CompileContext forType(String subjectType) {
    return new CompileContext(subjectType, null, null);
  }
}
