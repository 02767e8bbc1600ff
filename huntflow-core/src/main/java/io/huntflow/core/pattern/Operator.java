package io.huntflow.core.pattern;

import io.huntflow.core.lang.Huntflow.ComparisonOp;

/** Resolved comparison operator of a compiled pattern. */
public enum Operator {
  EQUALS("=", Arity.SCALAR),
  NOT_EQUALS("!=", Arity.SCALAR),
  GREATER(">", Arity.SCALAR),
  LESS("<", Arity.SCALAR),
  GREATER_OR_EQUAL(">=", Arity.SCALAR),
  LESS_OR_EQUAL("<=", Arity.SCALAR),
  IN("IN", Arity.LIST),
  LIKE("LIKE", Arity.STRING),
  MATCHES("MATCHES", Arity.STRING),
  IS_SUBSET("ISSUBSET", Arity.LIST),
  IS_SUPERSET("ISSUPERSET", Arity.LIST);

  /** Operand shape the operator accepts. */
  public enum Arity {
    SCALAR,
    STRING,
    LIST
  }

  private final String symbol;
  private final Arity arity;

  Operator(String symbol, Arity arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  public String symbol() {
    return symbol;
  }

  public Arity arity() {
    return arity;
  }

  public boolean isOrdering() {
    return this == GREATER || this == LESS || this == GREATER_OR_EQUAL || this == LESS_OR_EQUAL;
  }

  static Operator of(ComparisonOp op) {
    return switch (op) {
      case EQ, EQ2 -> EQUALS;
      case NE -> NOT_EQUALS;
      case GT -> GREATER;
      case LT -> LESS;
      case GE -> GREATER_OR_EQUAL;
      case LE -> LESS_OR_EQUAL;
      case IN -> IN;
      case LIKE -> LIKE;
      case MATCHES -> MATCHES;
      case ISSUBSET -> IS_SUBSET;
      case ISSUPERSET -> IS_SUPERSET;
    };
  }
}
