package io.huntflow.core.lang;

import io.huntflow.core.error.HuntflowException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Huntflow AST. Produced by {@link HuntflowParser}, completed by {@link HuntflowNormalizer}. */
public final class Huntflow {
  private Huntflow() {}

  /** Name bound when a statement has no explicit {@code VAR =}. */
  public static final String DEFAULT_VARIABLE = "_";

  /** A parsed program: statements in source order. */
  public record Program(List<Statement> statements) {
    public Program {
      statements = List.copyOf(statements);
    }
  }

  /**
   * One statement. {@code output} is null for side-effecting commands and, before normalization,
   * for result commands written without a binding.
   */
  public record Statement(String output, Command command, int line, String text) {
    public Statement withOutput(String name) {
      return new Statement(name, command, line, text);
    }

    public Statement withCommand(Command replacement) {
      return new Statement(output, replacement, line, text);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Literals

  /** Tagged literal value: null, boolean, number or string. */
  public sealed interface Literal permits NullLiteral, BoolLiteral, NumberLiteral, StringLiteral {
    /** The plain Java value (null, Boolean, Long/Double, String). */
    Object toJava();
  }

  public enum NullLiteral implements Literal {
    INSTANCE;

    @Override
    public Object toJava() {
      return null;
    }

    @Override
    public String toString() {
      return "null";
    }
  }

  public record BoolLiteral(boolean value) implements Literal {
    @Override
    public Object toJava() {
      return value;
    }
  }

  /** Integral values are held as {@link Long}, all others as {@link Double}. */
  public record NumberLiteral(Number value) implements Literal {
    @Override
    public Object toJava() {
      return value;
    }
  }

  public record StringLiteral(String value) implements Literal {
    @Override
    public Object toJava() {
      return value;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Patterns

  public enum Connective {
    AND,
    OR
  }

  /** Comparison operators. Keyword operators may be prefixed by NOT. */
  public enum ComparisonOp {
    EQ("=", false),
    EQ2("==", false),
    NE("!=", false),
    GT(">", false),
    LT("<", false),
    GE(">=", false),
    LE("<=", false),
    IN("IN", true),
    LIKE("LIKE", true),
    MATCHES("MATCHES", true),
    ISSUBSET("ISSUBSET", true),
    ISSUPERSET("ISSUPERSET", true);

    private final String token;
    private final boolean keyword;

    ComparisonOp(String token, boolean keyword) {
      this.token = token;
      this.keyword = keyword;
    }

    public String token() {
      return token;
    }

    public boolean isKeyword() {
      return keyword;
    }

    /** Keyword operator for the given word, or null. */
    public static ComparisonOp keyword(String word) {
      String w = word.toUpperCase(Locale.ROOT);
      for (ComparisonOp op : values()) {
        if (op.keyword && op.token.equals(w)) return op;
      }
      return null;
    }
  }

  public sealed interface PatternExpr permits BinaryPattern, ComparisonExpr, NullCheckExpr {}

  public record BinaryPattern(Connective connective, PatternExpr left, PatternExpr right)
      implements PatternExpr {
    @Override
    public String toString() {
      return "(" + left + " " + connective + " " + right + ")";
    }
  }

  public record ComparisonExpr(
      AttributePath path, ComparisonOp op, boolean negated, PatternValue value)
      implements PatternExpr {
    @Override
    public String toString() {
      if (negated && !Character.isLetter(op.token().charAt(0))) {
        return "NOT " + path + " " + op.token() + " " + value;
      }
      return path + (negated ? " NOT " : " ") + op.token() + " " + value;
    }
  }

  public record NullCheckExpr(AttributePath path, boolean negated) implements PatternExpr {
    @Override
    public String toString() {
      return path + (negated ? " IS NOT NULL" : " IS NULL");
    }
  }

  /** Right-hand side of a comparison. */
  public sealed interface PatternValue permits ScalarValue, ListValue {}

  /**
   * A scalar operand. {@code bare} is set for unquoted tokens, which the pattern compiler may
   * resolve as {@code variable.attribute} references.
   */
  public record ScalarValue(Literal literal, boolean bare) implements PatternValue {
    @Override
    public String toString() {
      if (literal instanceof StringLiteral s && !bare) return "'" + s.value() + "'";
      return String.valueOf(literal.toJava());
    }
  }

  public record ListValue(List<Literal> items) implements PatternValue {
    public ListValue {
      items = List.copyOf(items);
    }

    @Override
    public String toString() {
      List<String> parts = new ArrayList<>();
      for (Literal l : items) parts.add(String.valueOf(l.toJava()));
      return "(" + String.join(", ", parts) + ")";
    }
  }

  /** One attribute path segment; {@code expand} marks a trailing {@code [*]}. */
  public record Segment(String name, boolean expand) {
    @Override
    public String toString() {
      return expand ? name + "[*]" : name;
    }
  }

  /** {@code [type:]seg(.seg)*} with optional {@code [*]} markers. */
  public record AttributePath(String qualifier, List<Segment> segments) {
    public AttributePath {
      segments = List.copyOf(segments);
    }

    public static AttributePath of(String dotted) {
      List<Segment> segs = new ArrayList<>();
      for (String s : dotted.split("\\.")) segs.add(new Segment(s, false));
      return new AttributePath(null, segs);
    }

    /** Dotted attribute name without qualifier or array markers. */
    public String attributeName() {
      List<String> names = new ArrayList<>(segments.size());
      for (Segment s : segments) names.add(s.name());
      return String.join(".", names);
    }

    public boolean hasExpansion() {
      for (Segment s : segments) if (s.expand()) return true;
      return false;
    }

    @Override
    public String toString() {
      List<String> names = new ArrayList<>(segments.size());
      for (Segment s : segments) names.add(s.toString());
      return (qualifier != null ? qualifier + ":" : "") + String.join(".", names);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Expressions, grouping and NEW literals

  public enum Transform {
    TIMESTAMPED
  }

  public record SortSpec(String attribute, boolean ascending) {}

  /**
   * Variable reference with optional transform and post-processing clauses; evaluated in the
   * order transform, WHERE, SORT, LIMIT/OFFSET, ATTR.
   */
  public record Expression(
      String variable,
      Transform transform,
      PatternExpr where,
      List<String> attributes,
      SortSpec sort,
      Integer limit,
      Integer offset) {
    public Expression {
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static Expression of(String variable) {
      return new Expression(variable, null, null, List.of(), null, null, null);
    }

    public Expression withVariable(String name) {
      return new Expression(name, transform, where, attributes, sort, limit, offset);
    }

    public boolean hasClauses() {
      return transform != null
          || where != null
          || !attributes.isEmpty()
          || sort != null
          || limit != null
          || offset != null;
    }
  }

  public enum AggFunction {
    MIN,
    MAX,
    SUM,
    AVG,
    COUNT,
    NUNIQUE
  }

  public record Aggregation(AggFunction function, String attribute, String alias) {
    /** Output column name: the alias, else {@code func_attr} in lower case. */
    public String outputName() {
      if (alias != null) return alias;
      return function.name().toLowerCase(Locale.ROOT) + "_" + attribute;
    }
  }

  public sealed interface GroupKey permits AttributeKey, BinKey {
    String attribute();

    /** Column name of the key in the grouped result. */
    String outputName();
  }

  public record AttributeKey(String attribute) implements GroupKey {
    @Override
    public String outputName() {
      return attribute;
    }
  }

  /** {@code BIN(attr, size[, unit])}; without unit the attribute is bucketed numerically. */
  public record BinKey(String attribute, long size, TimeUnitName unit) implements GroupKey {
    @Override
    public String outputName() {
      return "bin_" + attribute;
    }
  }

  public enum TimeUnitName {
    DAY(86_400L),
    HOUR(3_600L),
    MINUTE(60L),
    SECOND(1L);

    private final long seconds;

    TimeUnitName(long seconds) {
      this.seconds = seconds;
    }

    public long seconds() {
      return seconds;
    }

    /** Parses singular/plural and single-letter forms; null if not a unit. */
    public static TimeUnitName parse(String word) {
      switch (word.toLowerCase(Locale.ROOT)) {
        case "day", "days", "d":
          return DAY;
        case "hour", "hours", "h":
          return HOUR;
        case "minute", "minutes", "m":
          return MINUTE;
        case "second", "seconds", "s":
          return SECOND;
        default:
          return null;
      }
    }
  }

  /** Element of a NEW literal array. */
  public sealed interface NewItem permits ScalarItem, ObjectItem {}

  public record ScalarItem(Literal value) implements NewItem {}

  public record ObjectItem(Map<String, Literal> fields) implements NewItem {
    public ObjectItem {
      fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Commands

  public enum CommandKind {
    ASSIGN(true),
    FIND(true),
    GET(true),
    GROUP(true),
    JOIN(true),
    LOAD(true),
    MERGE(true),
    NEW(true),
    SORT(true),
    APPLY(false),
    DISP(false),
    INFO(false),
    SAVE(false);

    private final boolean producesResult;

    CommandKind(boolean producesResult) {
      this.producesResult = producesResult;
    }

    public boolean producesResult() {
      return producesResult;
    }
  }

  /** One handler per command kind; adding a command breaks every visitor at compile time. */
  public interface Visitor<R> {
    R visitAssign(AssignCommand c) throws HuntflowException;

    R visitFind(FindCommand c) throws HuntflowException;

    R visitGet(GetCommand c) throws HuntflowException;

    R visitGroup(GroupCommand c) throws HuntflowException;

    R visitJoin(JoinCommand c) throws HuntflowException;

    R visitLoad(LoadCommand c) throws HuntflowException;

    R visitMerge(MergeCommand c) throws HuntflowException;

    R visitNew(NewCommand c) throws HuntflowException;

    R visitSort(SortCommand c) throws HuntflowException;

    R visitApply(ApplyCommand c) throws HuntflowException;

    R visitDisp(DispCommand c) throws HuntflowException;

    R visitInfo(InfoCommand c) throws HuntflowException;

    R visitSave(SaveCommand c) throws HuntflowException;
  }

  public sealed interface Command
      permits AssignCommand,
          FindCommand,
          GetCommand,
          GroupCommand,
          JoinCommand,
          LoadCommand,
          MergeCommand,
          NewCommand,
          SortCommand,
          ApplyCommand,
          DispCommand,
          InfoCommand,
          SaveCommand {
    CommandKind kind();

    /** Variables this command reads, in source order. Null entries stand for the default. */
    List<String> inputVariables();

    <R> R accept(Visitor<R> visitor) throws HuntflowException;
  }

  public record AssignCommand(Expression expression) implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.ASSIGN;
    }

    @Override
    public List<String> inputVariables() {
      return Collections.singletonList(expression.variable());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitAssign(this);
    }
  }

  public record FindCommand(
      String entityType,
      String relation,
      boolean reversed,
      String variable,
      PatternExpr where,
      Timespan timespan)
      implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.FIND;
    }

    @Override
    public List<String> inputVariables() {
      return List.of(variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitFind(this);
    }
  }

  /** {@code source} is a datasource locator or a variable name; null means the default. */
  public record GetCommand(String entityType, String source, PatternExpr where, Timespan timespan)
      implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.GET;
    }

    @Override
    public List<String> inputVariables() {
      return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitGet(this);
    }
  }

  public record GroupCommand(String variable, List<GroupKey> keys, List<Aggregation> aggregations)
      implements Command {
    public GroupCommand {
      keys = List.copyOf(keys);
      aggregations = List.copyOf(aggregations);
    }

    @Override
    public CommandKind kind() {
      return CommandKind.GROUP;
    }

    @Override
    public List<String> inputVariables() {
      return List.of(variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitGroup(this);
    }
  }

  /** Key attributes are both null when the default join key applies. */
  public record JoinCommand(String left, String right, String leftKey, String rightKey)
      implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.JOIN;
    }

    @Override
    public List<String> inputVariables() {
      return List.of(left, right);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitJoin(this);
    }
  }

  public record LoadCommand(String path, String entityType) implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.LOAD;
    }

    @Override
    public List<String> inputVariables() {
      return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitLoad(this);
    }
  }

  public record MergeCommand(List<String> variables) implements Command {
    public MergeCommand {
      variables = List.copyOf(variables);
    }

    @Override
    public CommandKind kind() {
      return CommandKind.MERGE;
    }

    @Override
    public List<String> inputVariables() {
      return variables;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitMerge(this);
    }
  }

  public record NewCommand(String entityType, List<NewItem> items) implements Command {
    public NewCommand {
      items = List.copyOf(items);
    }

    @Override
    public CommandKind kind() {
      return CommandKind.NEW;
    }

    @Override
    public List<String> inputVariables() {
      return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitNew(this);
    }
  }

  public record SortCommand(String variable, String attribute, boolean ascending)
      implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.SORT;
    }

    @Override
    public List<String> inputVariables() {
      return List.of(variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitSort(this);
    }
  }

  public record ApplyCommand(String analytics, List<String> variables, Map<String, String> args)
      implements Command {
    public ApplyCommand {
      variables = List.copyOf(variables);
      args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    @Override
    public CommandKind kind() {
      return CommandKind.APPLY;
    }

    @Override
    public List<String> inputVariables() {
      return variables;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitApply(this);
    }
  }

  public record DispCommand(Expression expression) implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.DISP;
    }

    @Override
    public List<String> inputVariables() {
      return Collections.singletonList(expression.variable());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitDisp(this);
    }
  }

  public record InfoCommand(String variable) implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.INFO;
    }

    @Override
    public List<String> inputVariables() {
      return Collections.singletonList(variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitInfo(this);
    }
  }

  public record SaveCommand(String variable, String path) implements Command {
    @Override
    public CommandKind kind() {
      return CommandKind.SAVE;
    }

    @Override
    public List<String> inputVariables() {
      return Collections.singletonList(variable);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws HuntflowException {
      return visitor.visitSave(this);
    }
  }
}
