package io.huntflow.core.lang;

import static io.huntflow.core.lang.Huntflow.*;

import io.huntflow.core.error.HuntflowSyntaxException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for huntflow text.
 *
 * <p>Keywords are case-insensitive, whitespace and {@code #} line comments are insignificant
 * outside string terminals, and statements need no separator: each statement ends where the
 * grammar cannot extend it. Example:
 *
 * <pre>
 * procs = GET process FROM host-1 WHERE name = 'svchost.exe' LAST 1 DAY
 * parents = FIND process CREATED procs
 * DISP parents ATTR name, pid SORT BY pid DESC LIMIT 10
 * </pre>
 */
public final class HuntflowParser {

  private static final Set<String> RESERVED =
      Set.of(
          "FIND", "GET", "GROUP", "JOIN", "LOAD", "NEW", "SORT", "APPLY", "DISP", "INFO", "SAVE",
          "WHERE", "ATTR", "BY", "LIMIT", "OFFSET", "ASC", "DESC", "AND", "OR", "NOT", "IN",
          "LIKE", "MATCHES", "ISSUBSET", "ISSUPERSET", "IS", "NULL", "START", "STOP", "LAST",
          "FROM", "AS", "TO", "ON", "WITH", "TIMESTAMPED", "BIN");

  private static final Pattern INTEGER = Pattern.compile("-?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?|-?\\d+[eE][-+]?\\d+");

  private final String input;
  private int pos = 0;

  private HuntflowParser(String input) {
    this.input = input;
  }

  /**
   * Parses a complete huntflow.
   *
   * @param input huntflow source text
   * @return statements in source order, not yet normalized
   * @throws HuntflowSyntaxException on the first syntax error
   */
  public static Program parse(String input) throws HuntflowSyntaxException {
    return new HuntflowParser(input).parseProgram();
  }

  /** Parses a standalone pattern, as written after WHERE. */
  public static PatternExpr parsePattern(String input) throws HuntflowSyntaxException {
    HuntflowParser p = new HuntflowParser(input);
    PatternExpr e = p.parseDisjunction();
    p.skipWs();
    if (!p.eof()) throw p.error("Unexpected input after pattern");
    return e;
  }

  private Program parseProgram() throws HuntflowSyntaxException {
    List<Statement> statements = new ArrayList<>();
    skipWs();
    while (!eof()) {
      statements.add(parseStatement());
      skipWs();
    }
    return new Program(statements);
  }

  private Statement parseStatement() throws HuntflowSyntaxException {
    int start = pos;
    int line = lineAt(start);
    String output = null;
    if (looksLikeBinding()) {
      String name = readWord();
      if (isReserved(name)) throw error("Reserved word cannot be a variable name: " + name);
      skipWs();
      pos++; // '='
      skipWs();
      output = name;
    }
    Command command = parseCommand();
    String text = stripComments(input.substring(start, pos)).trim();
    if (output != null && !command.kind().producesResult()) {
      throw errorAt(start, command.kind() + " does not produce a result and cannot be assigned");
    }
    return new Statement(output, command, line, text);
  }

  private Command parseCommand() throws HuntflowSyntaxException {
    skipWs();
    int save = pos;
    String word = readWord();
    if (word.isEmpty()) throw error("Expected a command or variable");
    switch (word.toUpperCase(Locale.ROOT)) {
      case "FIND":
        return parseFind();
      case "GET":
        return parseGet();
      case "GROUP":
        return parseGroup();
      case "JOIN":
        return parseJoin();
      case "LOAD":
        return parseLoad();
      case "NEW":
        return parseNew();
      case "SORT":
        return parseSort();
      case "APPLY":
        return parseApply();
      case "DISP":
        return parseDisp();
      case "INFO":
        return parseInfo();
      case "SAVE":
        return parseSave();
      case "TIMESTAMPED":
        pos = save;
        return new AssignCommand(parseExpression(true));
      default:
        if (isReserved(word)) throw errorAt(save, "Unexpected keyword: " + word);
        if (!isVariableName(word)) throw errorAt(save, "Invalid variable name: " + word);
        skipWs();
        if (peek() == '+') {
          return parseMerge(word);
        }
        pos = save;
        return new AssignCommand(parseExpression(true));
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Commands

  private Command parseFind() throws HuntflowSyntaxException {
    String type = readEntityType();
    skipWs();
    String relation = readWord();
    if (relation.isEmpty() || isReserved(relation)) {
      throw error("Expected relation after entity type");
    }
    boolean reversed = acceptKeyword("BY");
    String variable = readVariable();
    PatternExpr where = acceptKeyword("WHERE") ? parseDisjunction() : null;
    Timespan span = parseOptionalTimespan();
    return new FindCommand(
        type.toLowerCase(Locale.ROOT),
        relation.toLowerCase(Locale.ROOT),
        reversed,
        variable,
        where,
        span);
  }

  private Command parseGet() throws HuntflowSyntaxException {
    String type = readEntityType();
    String source = null;
    if (acceptKeyword("FROM")) {
      source = readLocator("datasource");
    }
    if (!acceptKeyword("WHERE")) throw error("GET requires a WHERE clause");
    PatternExpr where = parseDisjunction();
    Timespan span = parseOptionalTimespan();
    return new GetCommand(type.toLowerCase(Locale.ROOT), source, where, span);
  }

  private Command parseGroup() throws HuntflowSyntaxException {
    String variable = readVariable();
    expectKeyword("BY");
    List<GroupKey> keys = new ArrayList<>();
    do {
      keys.add(parseGroupKey());
    } while (acceptChar(','));
    List<Aggregation> aggs = new ArrayList<>();
    if (acceptKeyword("WITH")) {
      do {
        aggs.add(parseAggregation());
      } while (acceptChar(','));
    }
    return new GroupCommand(variable, keys, aggs);
  }

  private GroupKey parseGroupKey() throws HuntflowSyntaxException {
    skipWs();
    if (peekKeyword("BIN")) {
      int save = pos;
      pos += 3;
      skipWs();
      if (peek() == '(') {
        pos++;
        String attr = parseAttributeName();
        expectChar(',');
        skipWs();
        long size = readInteger("bin size");
        Huntflow.TimeUnitName unit = null;
        if (acceptChar(',')) {
          skipWs();
          String u = readWord();
          unit = Huntflow.TimeUnitName.parse(u);
          if (unit == null) throw error("Unknown time unit: " + u);
        }
        expectChar(')');
        return new BinKey(attr, size, unit);
      }
      pos = save;
    }
    return new AttributeKey(parseAttributeName());
  }

  private Aggregation parseAggregation() throws HuntflowSyntaxException {
    skipWs();
    String fn = readWord();
    AggFunction function;
    try {
      function = AggFunction.valueOf(fn.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw error("Unknown aggregation function: " + fn);
    }
    expectChar('(');
    String attr = parseAttributeName();
    expectChar(')');
    String alias = null;
    if (acceptKeyword("AS")) {
      skipWs();
      alias = readWord();
      if (alias.isEmpty()) throw error("Expected alias after AS");
    }
    return new Aggregation(function, attr, alias);
  }

  private Command parseJoin() throws HuntflowSyntaxException {
    String left = readVariable();
    expectChar(',');
    String right = readVariable();
    String leftKey = null;
    String rightKey = null;
    if (acceptKeyword("BY")) {
      leftKey = parseAttributeName();
      expectChar(',');
      rightKey = parseAttributeName();
    }
    return new JoinCommand(left, right, leftKey, rightKey);
  }

  private Command parseLoad() throws HuntflowSyntaxException {
    String path = readLocator("file path");
    String type = null;
    if (acceptKeyword("AS")) {
      type = readEntityType().toLowerCase(Locale.ROOT);
    }
    return new LoadCommand(path, type);
  }

  private Command parseMerge(String first) throws HuntflowSyntaxException {
    List<String> vars = new ArrayList<>();
    vars.add(first);
    while (acceptChar('+')) {
      vars.add(readVariable());
    }
    return new MergeCommand(vars);
  }

  private Command parseNew() throws HuntflowSyntaxException {
    skipWs();
    String type = null;
    if (peek() != '[') {
      type = readEntityType().toLowerCase(Locale.ROOT);
      skipWs();
    }
    expectChar('[');
    List<NewItem> items = new ArrayList<>();
    skipWs();
    if (peek() != ']') {
      do {
        skipWs();
        items.add(parseNewItem());
      } while (acceptChar(','));
    }
    expectChar(']');
    return new NewCommand(type, items);
  }

  private NewItem parseNewItem() throws HuntflowSyntaxException {
    if (peek() == '[') throw error("Nested arrays are not allowed in NEW literals");
    if (peek() != '{') {
      return new ScalarItem(parseScalar().literal());
    }
    pos++; // {
    Map<String, Literal> fields = new LinkedHashMap<>();
    skipWs();
    if (peek() != '}') {
      do {
        skipWs();
        String key;
        if (peek() == '"' || peek() == '\'') {
          key = readQuoted();
        } else {
          key = readWord();
          if (key.isEmpty()) throw error("Expected object key");
        }
        expectChar(':');
        skipWs();
        if (peek() == '{' || peek() == '[') {
          throw error("NEW literals allow only scalar attribute values");
        }
        fields.put(key, parseScalar().literal());
      } while (acceptChar(','));
    }
    expectChar('}');
    return new ObjectItem(fields);
  }

  private Command parseSort() throws HuntflowSyntaxException {
    String variable = readVariable();
    expectKeyword("BY");
    String attr = parseAttributeName();
    return new SortCommand(variable, attr, parseDirection());
  }

  private Command parseApply() throws HuntflowSyntaxException {
    String analytics = readLocator("analytics");
    expectKeyword("ON");
    List<String> vars = new ArrayList<>();
    do {
      vars.add(readVariable());
    } while (acceptChar(','));
    Map<String, String> args = new LinkedHashMap<>();
    if (acceptKeyword("WITH")) {
      do {
        skipWs();
        String key = readWord();
        if (key.isEmpty()) throw error("Expected argument name");
        expectChar('=');
        skipWs();
        Object v = parseScalar().literal().toJava();
        args.put(key, String.valueOf(v));
      } while (acceptChar(','));
    }
    return new ApplyCommand(analytics, vars, args);
  }

  private Command parseDisp() throws HuntflowSyntaxException {
    return new DispCommand(parseExpression(false));
  }

  private Command parseInfo() throws HuntflowSyntaxException {
    return new InfoCommand(atVariable() ? readVariable() : null);
  }

  private Command parseSave() throws HuntflowSyntaxException {
    String variable = atVariable() ? readVariable() : null;
    expectKeyword("TO");
    return new SaveCommand(variable, readLocator("file path"));
  }

  /**
   * expression := (VAR | TIMESTAMPED '(' VAR ')') clauses. When {@code variableRequired} is false
   * the variable may be omitted and is left null for the normalizer.
   */
  private Expression parseExpression(boolean variableRequired) throws HuntflowSyntaxException {
    skipWs();
    String variable = null;
    Transform transform = null;
    if (peekKeyword("TIMESTAMPED")) {
      pos += "TIMESTAMPED".length();
      expectChar('(');
      variable = readVariable();
      expectChar(')');
      transform = Transform.TIMESTAMPED;
    } else if (variableRequired || atVariable()) {
      variable = readVariable();
    }
    PatternExpr where = acceptKeyword("WHERE") ? parseDisjunction() : null;
    List<String> attrs = new ArrayList<>();
    if (acceptKeyword("ATTR")) {
      do {
        attrs.add(parseAttributeName());
      } while (acceptChar(','));
    }
    SortSpec sort = null;
    if (peekSortClause()) {
      expectKeyword("SORT");
      expectKeyword("BY");
      String attr = parseAttributeName();
      sort = new SortSpec(attr, parseDirection());
    }
    Integer limit = null;
    if (acceptKeyword("LIMIT")) {
      skipWs();
      limit = (int) readNonNegative("LIMIT");
    }
    Integer offset = null;
    if (acceptKeyword("OFFSET")) {
      skipWs();
      offset = (int) readNonNegative("OFFSET");
    }
    return new Expression(variable, transform, where, attrs, sort, limit, offset);
  }

  private boolean parseDirection() throws HuntflowSyntaxException {
    if (acceptKeyword("DESC")) return false;
    acceptKeyword("ASC");
    return true;
  }

  // ---------------------------------------------------------------------------------------------
  // Timespans

  private Timespan parseOptionalTimespan() throws HuntflowSyntaxException {
    if (acceptKeyword("START")) {
      skipWs();
      int at = pos;
      Instant start = readTimestamp();
      expectKeyword("STOP");
      skipWs();
      Instant stop = readTimestamp();
      try {
        return new Timespan.Absolute(start, stop);
      } catch (IllegalArgumentException e) {
        throw errorAt(at, e.getMessage());
      }
    }
    if (acceptKeyword("LAST")) {
      skipWs();
      int at = pos;
      long n = readInteger("LAST count");
      if (n <= 0) throw errorAt(at, "LAST requires a positive count");
      skipWs();
      String u = readWord();
      Huntflow.TimeUnitName unit = Huntflow.TimeUnitName.parse(u);
      if (unit == null || u.length() == 1) throw error("Expected DAYS, HOURS, MINUTES or SECONDS");
      try {
        return new Timespan.Relative(n, unit);
      } catch (IllegalArgumentException e) {
        throw errorAt(at, e.getMessage());
      }
    }
    return null;
  }

  /** Accepts {@code 2021-01-01T00:00:00Z}, {@code '...'}, {@code "..."} and {@code t'...'}. */
  private Instant readTimestamp() throws HuntflowSyntaxException {
    int at = pos;
    String text;
    if ((peek() == 't' || peek() == 'T') && (peekAt(1) == '\'' || peekAt(1) == '"')) {
      pos++;
      text = readQuoted();
    } else if (peek() == '\'' || peek() == '"') {
      text = readQuoted();
    } else {
      text = readBareToken();
    }
    Instant t = parseInstant(text);
    if (t == null) throw errorAt(at, "Invalid timestamp: " + text);
    return t;
  }

  /** ISO-8601 date-time; a value without offset is taken as UTC. Returns null if unparsable. */
  public static Instant parseInstant(String text) {
    try {
      return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException ignore) {
      // fall through to the zone-less form
    }
    try {
      return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Patterns

  // disjunction := conjunction ( OR conjunction )*
  private PatternExpr parseDisjunction() throws HuntflowSyntaxException {
    PatternExpr left = parseConjunction();
    while (acceptKeyword("OR")) {
      PatternExpr right = parseConjunction();
      left = new BinaryPattern(Connective.OR, left, right);
    }
    return left;
  }

  // conjunction := atom ( AND atom )*
  private PatternExpr parseConjunction() throws HuntflowSyntaxException {
    PatternExpr left = parseAtom();
    while (acceptKeyword("AND")) {
      PatternExpr right = parseAtom();
      left = new BinaryPattern(Connective.AND, left, right);
    }
    return left;
  }

  // atom := NOT atom | '(' disjunction ')' | path IS [NOT] NULL | path [NOT] op value
  private PatternExpr parseAtom() throws HuntflowSyntaxException {
    if (acceptKeyword("NOT")) {
      return negate(parseAtom());
    }
    skipWs();
    if (peek() == '(') {
      pos++;
      PatternExpr e = parseDisjunction();
      expectChar(')');
      return e;
    }
    AttributePath path = parseAttributePath();
    skipWs();
    if (acceptKeyword("IS")) {
      boolean negated = acceptKeyword("NOT");
      expectKeyword("NULL");
      return new NullCheckExpr(path, negated);
    }
    boolean negated = acceptKeyword("NOT");
    ComparisonOp op = readOperator(negated);
    skipWs();
    PatternValue value = peek() == '(' ? parseList() : parseScalar();
    return new ComparisonExpr(path, op, negated, value);
  }

  /** Complement of a pattern; groups are pushed down to the leaves (De Morgan). */
  private static PatternExpr negate(PatternExpr e) {
    if (e instanceof BinaryPattern b) {
      Connective flipped = b.connective() == Connective.AND ? Connective.OR : Connective.AND;
      return new BinaryPattern(flipped, negate(b.left()), negate(b.right()));
    }
    if (e instanceof NullCheckExpr n) {
      return new NullCheckExpr(n.path(), !n.negated());
    }
    ComparisonExpr c = (ComparisonExpr) e;
    return new ComparisonExpr(c.path(), c.op(), !c.negated(), c.value());
  }

  private ComparisonOp readOperator(boolean afterNot) throws HuntflowSyntaxException {
    skipWs();
    int save = pos;
    String word = readWord();
    if (!word.isEmpty()) {
      ComparisonOp op = ComparisonOp.keyword(word);
      if (op != null) return op;
      pos = save;
      throw error("Unknown operator: " + word);
    }
    if (afterNot) throw error("NOT must be followed by IN, LIKE, MATCHES, ISSUBSET or ISSUPERSET");
    if (match(">=")) return ComparisonOp.GE;
    if (match("<=")) return ComparisonOp.LE;
    if (match("==")) return ComparisonOp.EQ2;
    if (match("!=")) return ComparisonOp.NE;
    if (match("=")) return ComparisonOp.EQ;
    if (match(">")) return ComparisonOp.GT;
    if (match("<")) return ComparisonOp.LT;
    throw error("Expected comparison operator");
  }

  private ListValue parseList() throws HuntflowSyntaxException {
    expectChar('(');
    List<Literal> items = new ArrayList<>();
    skipWs();
    if (peek() != ')') {
      do {
        skipWs();
        items.add(parseScalar().literal());
      } while (acceptChar(','));
    }
    expectChar(')');
    return new ListValue(items);
  }

  /** Quoted string, {@code t'...'} timestamp, or a bare token typed as bool/null/number/string. */
  private ScalarValue parseScalar() throws HuntflowSyntaxException {
    skipWs();
    if ((peek() == 't' || peek() == 'T') && (peekAt(1) == '\'' || peekAt(1) == '"')) {
      int at = pos;
      pos++;
      String text = readQuoted();
      Instant t = parseInstant(text);
      if (t == null) throw errorAt(at, "Invalid timestamp: " + text);
      return new ScalarValue(new StringLiteral(t.toString()), false);
    }
    if (peek() == '\'' || peek() == '"') {
      return new ScalarValue(new StringLiteral(readQuoted()), false);
    }
    String tok = readBareToken();
    if (tok.isEmpty()) throw error("Expected value");
    return new ScalarValue(classifyBare(tok), true);
  }

  private static Literal classifyBare(String tok) {
    String lower = tok.toLowerCase(Locale.ROOT);
    if ("true".equals(lower)) return new BoolLiteral(true);
    if ("false".equals(lower)) return new BoolLiteral(false);
    if ("null".equals(lower)) return NullLiteral.INSTANCE;
    if (INTEGER.matcher(tok).matches()) {
      try {
        return new NumberLiteral(Long.parseLong(tok));
      } catch (NumberFormatException e) {
        return new NumberLiteral(Double.parseDouble(tok));
      }
    }
    if (DECIMAL.matcher(tok).matches()) return new NumberLiteral(Double.parseDouble(tok));
    return new StringLiteral(tok);
  }

  /** {@code [type:]segment(.segment)*}, segments bare or quoted, each optionally marked [*]. */
  private AttributePath parseAttributePath() throws HuntflowSyntaxException {
    skipWs();
    String qualifier = null;
    int save = pos;
    String maybeType = readTypeName();
    if (!maybeType.isEmpty() && peek() == ':') {
      pos++;
      qualifier = maybeType.toLowerCase(Locale.ROOT);
    } else {
      pos = save;
    }
    List<Segment> segments = new ArrayList<>();
    while (true) {
      String name;
      if (peek() == '\'' || peek() == '"') {
        name = readQuoted();
      } else {
        name = readTypeName();
      }
      if (name.isEmpty()) throw error("Expected attribute name");
      boolean expand = false;
      if (input.startsWith("[*]", pos)) {
        pos += 3;
        expand = true;
      }
      segments.add(new Segment(name, expand));
      if (peek() == '.') {
        pos++;
        continue;
      }
      break;
    }
    return new AttributePath(qualifier, segments);
  }

  private String parseAttributeName() throws HuntflowSyntaxException {
    skipWs();
    return parseAttributePath().attributeName();
  }

  // ---------------------------------------------------------------------------------------------
  // Lookahead helpers

  /** {@code ident '='} but not {@code ident '=='}. */
  private boolean looksLikeBinding() {
    int save = pos;
    try {
      String w = readWord();
      if (w.isEmpty()) return false;
      skipWs();
      return peek() == '=' && peekAt(1) != '=';
    } finally {
      pos = save;
    }
  }

  /** Next token is a variable reference (not a keyword and not the start of a new binding). */
  private boolean atVariable() {
    skipWs();
    int save = pos;
    String w = readWord();
    pos = save;
    if (w.isEmpty() || isReserved(w) || !isVariableName(w)) return false;
    return !looksLikeBinding();
  }

  /** {@code SORT BY} is a clause; {@code SORT var BY} starts a SORT command. */
  private boolean peekSortClause() {
    skipWs();
    if (!peekKeyword("SORT")) return false;
    int save = pos;
    pos += 4;
    skipWs();
    boolean clause = peekKeyword("BY");
    pos = save;
    return clause;
  }

  /** Reserved words, upper case; none of them can name a variable. */
  public static Set<String> keywords() {
    return RESERVED;
  }

  private static boolean isReserved(String word) {
    return RESERVED.contains(word.toUpperCase(Locale.ROOT));
  }

  private static boolean isVariableName(String word) {
    if (word.isEmpty()) return false;
    char c = word.charAt(0);
    return Character.isLetter(c) || c == '_';
  }

  // ---------------------------------------------------------------------------------------------
  // Terminals

  private String readVariable() throws HuntflowSyntaxException {
    skipWs();
    int at = pos;
    String w = readWord();
    if (w.isEmpty()) throw error("Expected variable name");
    if (isReserved(w)) throw errorAt(at, "Expected variable name but found keyword " + w);
    if (!isVariableName(w)) throw errorAt(at, "Invalid variable name: " + w);
    return w;
  }

  private String readEntityType() throws HuntflowSyntaxException {
    skipWs();
    String t = readTypeName();
    if (t.isEmpty() || isReserved(t)) throw error("Expected entity type");
    return t;
  }

  /** Quoted string or bare token: datasource/analytics locators and file paths. */
  private String readLocator(String what) throws HuntflowSyntaxException {
    skipWs();
    if (peek() == '\'' || peek() == '"') return readQuoted();
    String tok = readBareToken();
    if (tok.isEmpty()) throw error("Expected " + what);
    return tok;
  }

  private long readInteger(String what) throws HuntflowSyntaxException {
    int start = pos;
    if (peek() == '-') pos++;
    while (!eof() && Character.isDigit(input.charAt(pos))) pos++;
    String num = input.substring(start, pos);
    if (num.isEmpty() || "-".equals(num)) {
      pos = start;
      throw error("Expected integer for " + what);
    }
    try {
      return Long.parseLong(num);
    } catch (NumberFormatException e) {
      throw errorAt(start, "Integer out of range for " + what + ": " + num);
    }
  }

  private long readNonNegative(String what) throws HuntflowSyntaxException {
    int at = pos;
    long n = readInteger(what);
    if (n < 0 || n > Integer.MAX_VALUE) throw errorAt(at, what + " must be a non-negative integer");
    return n;
  }

  private String readQuoted() throws HuntflowSyntaxException {
    int start = pos;
    char quote = (char) peek();
    pos++;
    StringBuilder sb = new StringBuilder();
    while (!eof() && peek() != quote) {
      char c = input.charAt(pos);
      if (c == '\\') {
        pos++;
        if (eof()) break;
        c = input.charAt(pos);
        switch (c) {
          case 'n' -> c = '\n';
          case 't' -> c = '\t';
          case 'r' -> c = '\r';
          default -> {}
        }
      }
      sb.append(c);
      pos++;
    }
    if (eof()) throw errorAt(start, "Unterminated string");
    pos++; // closing quote
    return sb.toString();
  }

  /** Run of characters up to whitespace or one of {@code ( ) [ ] { } , ' "}. */
  private String readBareToken() {
    int start = pos;
    while (!eof()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c) || "()[]{},'\"".indexOf(c) >= 0) break;
      pos++;
    }
    return input.substring(start, pos);
  }

  private String readWord() {
    int start = pos;
    while (!eof()) {
      char c = input.charAt(pos);
      if (Character.isLetterOrDigit(c) || c == '_') {
        pos++;
      } else break;
    }
    return input.substring(start, pos);
  }

  /** Entity types and attribute names may contain '-' (e.g. network-traffic, x-oca-asset). */
  private String readTypeName() {
    int start = pos;
    while (!eof()) {
      char c = input.charAt(pos);
      if (Character.isLetterOrDigit(c) || c == '_' || (c == '-' && pos > start)) {
        pos++;
      } else break;
    }
    return input.substring(start, pos);
  }

  private void skipWs() {
    while (!eof()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '#') {
        while (!eof() && input.charAt(pos) != '\n') pos++;
      } else {
        break;
      }
    }
  }

  private boolean peekKeyword(String kw) {
    int n = kw.length();
    if (pos + n > input.length()) return false;
    if (!input.regionMatches(true, pos, kw, 0, n)) return false;
    if (pos + n < input.length()) {
      char next = input.charAt(pos + n);
      if (Character.isLetterOrDigit(next) || next == '_') return false;
    }
    return true;
  }

  private boolean acceptKeyword(String kw) {
    skipWs();
    if (peekKeyword(kw)) {
      pos += kw.length();
      return true;
    }
    return false;
  }

  private void expectKeyword(String kw) throws HuntflowSyntaxException {
    if (!acceptKeyword(kw)) throw error("Expected " + kw);
  }

  private boolean acceptChar(char c) {
    skipWs();
    if (peek() == c) {
      pos++;
      return true;
    }
    return false;
  }

  private void expectChar(char c) throws HuntflowSyntaxException {
    skipWs();
    if (eof() || input.charAt(pos) != c) throw error("Expected '" + c + "'");
    pos++;
  }

  private boolean match(String s) {
    if (input.startsWith(s, pos)) {
      pos += s.length();
      return true;
    }
    return false;
  }

  private int peek() {
    return eof() ? -1 : input.charAt(pos);
  }

  private int peekAt(int offset) {
    int p = pos + offset;
    return p >= input.length() ? -1 : input.charAt(p);
  }

  private boolean eof() {
    return pos >= input.length();
  }

  private static String stripComments(String text) {
    StringBuilder sb = new StringBuilder();
    for (String line : text.split("\n", -1)) {
      int hash = commentStart(line);
      String kept = hash >= 0 ? line.substring(0, hash) : line;
      if (!kept.isBlank()) {
        if (sb.length() > 0) sb.append(' ');
        sb.append(kept.trim());
      }
    }
    return sb.toString();
  }

  /** Index of a '#' that starts a comment (outside quotes and not inside a bare token). */
  private static int commentStart(String line) {
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == '\\') i++;
        else if (c == quote) quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '#' && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
        return i;
      }
    }
    return -1;
  }

  private int lineAt(int offset) {
    int line = 1;
    for (int i = 0; i < offset && i < input.length(); i++) {
      if (input.charAt(i) == '\n') line++;
    }
    return line;
  }

  private HuntflowSyntaxException error(String msg) {
    return errorAt(pos, msg);
  }

  private HuntflowSyntaxException errorAt(int offset, String msg) {
    int line = 1;
    int col = 1;
    for (int i = 0; i < offset && i < input.length(); i++) {
      if (input.charAt(i) == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }
    String near = offset < input.length() ? " near '" + snippet(offset) + "'" : " at end of input";
    return new HuntflowSyntaxException(msg + near, line, col);
  }

  private String snippet(int offset) {
    int end = offset;
    while (end < input.length() && end - offset < 20 && input.charAt(end) != '\n') end++;
    return input.substring(offset, end);
  }
}
