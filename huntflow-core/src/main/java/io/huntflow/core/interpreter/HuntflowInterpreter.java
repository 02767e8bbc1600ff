package io.huntflow.core.interpreter;

import io.huntflow.core.analytics.AnalyticsRegistry;
import io.huntflow.core.analytics.AnalyticsRunner.AnalyticsInput;
import io.huntflow.core.analytics.AnalyticsRunner.AnalyticsResult;
import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.connector.ConnectorRegistry;
import io.huntflow.core.connector.DatasourceConnector.FetchResult;
import io.huntflow.core.entity.EntityRelations;
import io.huntflow.core.entity.EntityRelations.Traversal;
import io.huntflow.core.entity.EntityTypes;
import io.huntflow.core.error.AnalyticsException;
import io.huntflow.core.error.DataSourceException;
import io.huntflow.core.error.HuntflowException;
import io.huntflow.core.error.HuntflowIOException;
import io.huntflow.core.error.SemanticException;
import io.huntflow.core.error.ValidationException;
import io.huntflow.core.io.EntityFileIO;
import io.huntflow.core.lang.Huntflow.ApplyCommand;
import io.huntflow.core.lang.Huntflow.AssignCommand;
import io.huntflow.core.lang.Huntflow.Command;
import io.huntflow.core.lang.Huntflow.DispCommand;
import io.huntflow.core.lang.Huntflow.FindCommand;
import io.huntflow.core.lang.Huntflow.GetCommand;
import io.huntflow.core.lang.Huntflow.GroupCommand;
import io.huntflow.core.lang.Huntflow.InfoCommand;
import io.huntflow.core.lang.Huntflow.JoinCommand;
import io.huntflow.core.lang.Huntflow.Literal;
import io.huntflow.core.lang.Huntflow.LoadCommand;
import io.huntflow.core.lang.Huntflow.MergeCommand;
import io.huntflow.core.lang.Huntflow.NewCommand;
import io.huntflow.core.lang.Huntflow.NewItem;
import io.huntflow.core.lang.Huntflow.ObjectItem;
import io.huntflow.core.lang.Huntflow.Program;
import io.huntflow.core.lang.Huntflow.SaveCommand;
import io.huntflow.core.lang.Huntflow.ScalarItem;
import io.huntflow.core.lang.Huntflow.SortCommand;
import io.huntflow.core.lang.Huntflow.Statement;
import io.huntflow.core.lang.Huntflow.Visitor;
import io.huntflow.core.lang.HuntflowNormalizer;
import io.huntflow.core.lang.HuntflowParser;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.Predicate;
import io.huntflow.core.session.HuntflowSession;
import io.huntflow.core.session.Variable;
import io.huntflow.core.store.RowSetDescription;
import io.huntflow.core.store.RowSetRef;
import io.huntflow.core.store.StoreAdapter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes huntflows against a session, one statement after another.
 *
 * <p>Each command kind has one handler. A handler either returns the row set the statement binds
 * or, for APPLY, DISP, INFO and SAVE, acts and returns null. The first failing statement stops the
 * huntflow; variables bound by earlier statements stay in the session.
 */
public final class HuntflowInterpreter implements Visitor<HuntflowInterpreter.Produced> {
  private static final Logger LOG = LoggerFactory.getLogger(HuntflowInterpreter.class);

  /** Rows a command produced, with their entity type. */
  public record Produced(String entityType, RowSetRef rows) {}

  private final HuntflowSession session;
  private final ConnectorRegistry connectors;
  private final AnalyticsRegistry analytics;
  private final EntityFileIO files;
  private final HuntflowConfig config;
  private final DisplaySink display;
  private final TransformEvaluator transforms;
  private final HuntflowNormalizer normalizer;

  public HuntflowInterpreter(
      HuntflowSession session,
      ConnectorRegistry connectors,
      AnalyticsRegistry analytics,
      EntityFileIO files,
      HuntflowConfig config,
      DisplaySink display) {
    this.session = session;
    this.connectors = connectors;
    this.analytics = analytics;
    this.files = files;
    this.config = config;
    this.display = display;
    this.transforms = new TransformEvaluator(session);
    this.normalizer = new HuntflowNormalizer(session.defaultVariable());
  }

  public HuntflowSession session() {
    return session;
  }

  /**
   * Parses, checks and runs a huntflow.
   *
   * @throws HuntflowException the syntax error, or the failure of the first failing statement
   *     with the statement attached
   */
  public ExecutionResult execute(String huntflow) throws HuntflowException {
    return execute(HuntflowParser.parse(huntflow));
  }

  /** Checks and runs a parsed huntflow. */
  public ExecutionResult execute(Program program) throws HuntflowException {
    long start = System.nanoTime();
    Program normalized = normalizer.normalize(program, session.variableNames());
    Set<String> bound = new LinkedHashSet<>();
    List<Statement> statements = normalized.statements();
    for (int i = 0; i < statements.size(); i++) {
      Statement s = statements.get(i);
      LOG.debug("session {}: statement {}: {}", session.id(), i + 1, s.text());
      try {
        Produced produced = s.command().accept(this);
        if (produced != null) {
          session.bind(
              new Variable(
                  s.output(), produced.entityType(), produced.rows(), s.command().kind()));
          bound.add(s.output());
        } else if (s.command() instanceof ApplyCommand apply) {
          bound.addAll(apply.variables());
        }
      } catch (HuntflowException e) {
        LOG.debug("statement {} failed: {}", i + 1, e.getMessage());
        throw e.atStatement(i, s.text());
      }
    }
    return new ExecutionResult(
        statements.size(), new ArrayList<>(bound), Duration.ofNanos(System.nanoTime() - start));
  }

  /** Runs one command outside a program, for callers that build commands directly. */
  public Produced run(Command command) throws HuntflowException {
    return command.accept(this);
  }

  private StoreAdapter store() {
    return session.store();
  }

  private Set<String> schemaOf(RowSetRef ref) throws SemanticException {
    return new HashSet<>(store().describe(ref).attributes());
  }

  private Timespan.Absolute window(Timespan timespan) {
    return timespan == null ? null : timespan.resolve(session.clock());
  }

  // ---------------------------------------------------------------------------------------------

  @Override
  public Produced visitAssign(AssignCommand c) throws HuntflowException {
    Variable source = session.get(c.expression().variable());
    return new Produced(source.entityType(), transforms.evaluate(c.expression(), source));
  }

  @Override
  public Produced visitFind(FindCommand c) throws HuntflowException {
    Variable input = session.get(c.variable());
    if (input.entityType() == null) {
      throw new SemanticException(
          "FIND needs a typed input, variable " + c.variable() + " has none");
    }
    if (!EntityRelations.isKnown(c.relation())) {
      throw new SemanticException(
          "Unknown relation '" + c.relation() + "'; known: "
              + String.join(", ", EntityRelations.names()));
    }
    List<Traversal> traversals =
        EntityRelations.resolve(c.entityType(), c.relation(), input.entityType(), c.reversed());
    if (traversals.isEmpty()) {
      throw new SemanticException(
          "No relation " + c.relation().toLowerCase(Locale.ROOT) + (c.reversed() ? " BY" : "")
              + " between " + c.entityType() + " and " + input.entityType()
              + " (variable " + c.variable() + ")");
    }
    Predicate where =
        c.where() == null ? null : transforms.compile(c.where(), c.entityType(), null);
    RowSetRef candidatesRef = store().query(c.entityType(), where, window(c.timespan()));
    try {
      List<Map<String, Object>> inputRows = store().rows(input.rows());
      Set<String> inputIds = new HashSet<>();
      for (Map<String, Object> r : inputRows) {
        Object id = r.get(EntityTypes.ID);
        if (id != null) inputIds.add(id.toString());
      }
      List<Map<String, Object>> found = new ArrayList<>();
      for (Map<String, Object> candidate : store().rows(candidatesRef)) {
        for (Traversal t : traversals) {
          if (related(candidate, t, inputRows, inputIds)) {
            found.add(candidate);
            break;
          }
        }
      }
      LOG.debug(
          "FIND {} {} {}: {} entities", c.entityType(), c.relation(), c.variable(), found.size());
      return new Produced(c.entityType(), store().materialize(c.entityType(), found));
    } finally {
      store().release(candidatesRef);
    }
  }

  /**
   * Whether a candidate is linked to any input entity by the traversal. On the relation's source
   * side the source reference attributes point at the target; on the target side the target
   * reference attributes point back at the source.
   */
  private static boolean related(
      Map<String, Object> candidate,
      Traversal t,
      List<Map<String, Object>> inputRows,
      Set<String> inputIds) {
    Object candidateId = candidate.get(EntityTypes.ID);
    List<String> candidateSideRefs =
        t.returnIsSource() ? t.relation().sourceRefs() : t.relation().targetRefs();
    List<String> inputSideRefs =
        t.returnIsSource() ? t.relation().targetRefs() : t.relation().sourceRefs();
    for (String id : referencedIds(candidate, candidateSideRefs)) {
      if (inputIds.contains(id)) return true;
    }
    if (candidateId == null) return false;
    for (Map<String, Object> in : inputRows) {
      if (referencedIds(in, inputSideRefs).contains(candidateId.toString())) return true;
    }
    return false;
  }

  private static Set<String> referencedIds(Map<String, Object> row, List<String> attributes) {
    Set<String> ids = new HashSet<>();
    for (String a : attributes) {
      Object v = row.get(a);
      if (v instanceof Collection<?> col) {
        for (Object o : col) if (o != null) ids.add(o.toString());
      } else if (v != null) {
        ids.add(v.toString());
      }
    }
    return ids;
  }

  @Override
  public Produced visitGet(GetCommand c) throws HuntflowException {
    String source = c.source();
    Timespan.Absolute window = window(c.timespan());
    if (source != null && session.isBound(source)) {
      Variable v = session.get(source);
      if (v.entityType() != null && !v.entityType().equals(c.entityType())) {
        throw new SemanticException(
            "GET " + c.entityType() + " FROM variable " + source + " of type " + v.entityType());
      }
      Predicate where = transforms.compile(c.where(), c.entityType(), schemaOf(v.rows()));
      return new Produced(c.entityType(), store().filter(v.rows(), where, window));
    }

    String datasource = source;
    if (datasource == null) datasource = session.lastDatasource();
    if (datasource == null) datasource = config.defaultDatasource();
    if (datasource == null) {
      throw new SemanticException(
          "GET " + c.entityType() + " has no FROM, no datasource was used before and no default"
              + " datasource is configured");
    }
    ConnectorRegistry.Resolved resolved = connectors.resolve(datasource);
    Predicate where = transforms.compile(c.where(), c.entityType(), null);
    String what = "GET " + c.entityType() + " FROM " + datasource;
    LOG.info("{} WHERE {}{}", what, where.render(), window == null ? "" : " " + window);
    FetchResult fetched =
        session
            .timeouts()
            .call(
                what,
                config.getTimeout(),
                () -> resolved.connector().fetch(resolved.locator(), c.entityType(), where, window),
                DataSourceException::new);
    store().ingest(fetched.related());
    RowSetRef rows = store().materialize(c.entityType(), fetched.entities());
    session.setLastDatasource(datasource);
    return new Produced(c.entityType(), rows);
  }

  @Override
  public Produced visitGroup(GroupCommand c) throws HuntflowException {
    Variable v = session.get(c.variable());
    // aggregate rows are not entities of the source type
    return new Produced(null, store().aggregate(v.rows(), c.keys(), c.aggregations()));
  }

  @Override
  public Produced visitJoin(JoinCommand c) throws HuntflowException {
    Variable left = session.get(c.left());
    Variable right = session.get(c.right());
    String leftKey = c.leftKey() != null ? c.leftKey() : EntityTypes.ID;
    String rightKey = c.rightKey() != null ? c.rightKey() : EntityTypes.ID;
    return new Produced(
        left.entityType(), store().join(left.rows(), right.rows(), leftKey, rightKey));
  }

  @Override
  public Produced visitLoad(LoadCommand c) throws HuntflowException {
    Path path = Paths.get(c.path());
    List<Map<String, Object>> rows = files.load(path);
    String type = c.entityType();
    if (type == null) {
      Set<Object> types = new LinkedHashSet<>();
      for (Map<String, Object> r : rows) types.add(r.get(EntityTypes.TYPE));
      if (types.isEmpty() || types.contains(null)) {
        throw new ValidationException(
            "LOAD " + c.path() + ": entity type unknown; add AS <type> or a 'type' attribute to"
                + " every entity");
      }
      if (types.size() > 1) {
        throw new ValidationException(
            "LOAD " + c.path() + ": entities of several types " + types + "; a variable holds one");
      }
      type = types.iterator().next().toString();
    }
    LOG.debug("LOAD {} as {}: {} entities", path, type, rows.size());
    return new Produced(type, store().materialize(type, rows));
  }

  @Override
  public Produced visitMerge(MergeCommand c) throws HuntflowException {
    List<RowSetRef> refs = new ArrayList<>();
    String type = null;
    for (int i = 0; i < c.variables().size(); i++) {
      Variable v = session.get(c.variables().get(i));
      if (i == 0) {
        type = v.entityType();
      } else if (!Objects.equals(type, v.entityType())) {
        throw new SemanticException(
            "MERGE of incompatible types: " + c.variables().get(0) + " is " + type + ", "
                + v.name() + " is " + v.entityType());
      }
      refs.add(v.rows());
    }
    return new Produced(type, store().union(refs));
  }

  @Override
  public Produced visitNew(NewCommand c) throws HuntflowException {
    List<Map<String, Object>> rows = new ArrayList<>(c.items().size());
    String type = c.entityType();
    if (c.items().isEmpty()) {
      if (type == null) throw new ValidationException("NEW [] needs an entity type");
      return new Produced(type, store().materialize(type, List.of()));
    }
    boolean scalars = c.items().get(0) instanceof ScalarItem;
    for (NewItem item : c.items()) {
      if ((item instanceof ScalarItem) != scalars) {
        throw new ValidationException("NEW mixes raw values and objects in one list");
      }
      Map<String, Object> fields = new LinkedHashMap<>();
      if (item instanceof ScalarItem s) {
        if (type == null) {
          throw new ValidationException(
              "NEW with raw values needs an entity type, e.g. NEW file [...]");
        }
        fields.put(EntityTypes.scalarAttribute(type), s.value().toJava());
      } else {
        for (Map.Entry<String, Literal> e : ((ObjectItem) item).fields().entrySet()) {
          fields.put(e.getKey(), e.getValue().toJava());
        }
      }
      rows.add(fields);
    }
    if (type == null) type = commonType(rows);

    List<Map<String, Object>> entities = new ArrayList<>(rows.size());
    for (Map<String, Object> fields : rows) {
      Object declared = fields.get(EntityTypes.TYPE);
      if (declared != null && !type.equals(declared)) {
        throw new ValidationException(
            "NEW " + type + ": entity declares type '" + declared + "': " + fields);
      }
      Map<String, Object> entity = new LinkedHashMap<>();
      entity.put(EntityTypes.TYPE, type);
      Object id = fields.get(EntityTypes.ID);
      entity.put(EntityTypes.ID, id != null ? id : newId(type, fields));
      for (Map.Entry<String, Object> e : fields.entrySet()) {
        entity.putIfAbsent(e.getKey(), e.getValue());
      }
      entities.add(entity);
    }
    return new Produced(type, store().materialize(type, entities));
  }

  private static String commonType(List<Map<String, Object>> rows) throws ValidationException {
    String type = null;
    for (Map<String, Object> r : rows) {
      Object t = r.get(EntityTypes.TYPE);
      if (!(t instanceof String s) || s.isEmpty()) {
        throw new ValidationException(
            "NEW without an entity type needs a \"type\" in every object: " + r);
      }
      if (type != null && !type.equals(s)) {
        throw new ValidationException("NEW objects of several types: " + type + ", " + s);
      }
      type = s;
    }
    return type;
  }

  /** Deterministic id {@code type--uuid} from the entity's attribute values. */
  static String newId(String type, Map<String, Object> fields) {
    Map<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      if (!e.getKey().equals(EntityTypes.TYPE)) sorted.put(e.getKey(), e.getValue());
    }
    String seed = type + sorted;
    return type + "--" + UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public Produced visitSort(SortCommand c) throws HuntflowException {
    Variable v = session.get(c.variable());
    return new Produced(v.entityType(), store().sort(v.rows(), c.attribute(), c.ascending()));
  }

  @Override
  public Produced visitApply(ApplyCommand c) throws HuntflowException {
    AnalyticsRegistry.Resolved resolved = analytics.resolve(c.analytics());
    List<AnalyticsInput> inputs = new ArrayList<>();
    Map<String, Variable> byName = new LinkedHashMap<>();
    for (String name : c.variables()) {
      Variable v = session.get(name);
      byName.put(name, v);
      RowSetDescription d = store().describe(v.rows());
      inputs.add(new AnalyticsInput(name, v.entityType(), d.attributes(), store().rows(v.rows())));
    }
    String what = "APPLY " + c.analytics() + " ON " + String.join(", ", c.variables());
    LOG.info("{} WITH {}", what, c.args());
    AnalyticsResult result =
        session
            .timeouts()
            .call(
                what,
                config.applyTimeout(),
                () -> resolved.runner().invoke(resolved.locator(), inputs, c.args()),
                AnalyticsException::new);
    for (String w : result.warnings()) {
      LOG.warn("{}: {}", what, w);
      display.warning(w);
    }
    for (Map.Entry<String, List<Map<String, Object>>> out : result.outputs().entrySet()) {
      Variable v = byName.get(out.getKey());
      if (v == null) {
        String w = "ignored output for '" + out.getKey() + "', which is not an input variable";
        LOG.warn("{}: {}", what, w);
        display.warning(w);
        continue;
      }
      RowSetRef rows = store().materialize(v.entityType(), out.getValue());
      session.bind(new Variable(v.name(), v.entityType(), rows, c.kind()));
    }
    if (result.display() != null && !result.display().isEmpty()) display.text(result.display());
    return null;
  }

  @Override
  public Produced visitDisp(DispCommand c) throws HuntflowException {
    Variable source = session.get(c.expression().variable());
    RowSetRef ref = transforms.evaluate(c.expression(), source);
    try {
      RowSetDescription d = store().describe(ref);
      List<Map<String, Object>> rows = store().rows(ref);
      int limit = config.displayLimit();
      List<Map<String, Object>> shown =
          limit > 0 && rows.size() > limit ? rows.subList(0, limit) : rows;
      display.rows(source.name(), source.entityType(), d.attributes(), shown, rows.size());
      return null;
    } finally {
      store().release(ref);
    }
  }

  @Override
  public Produced visitInfo(InfoCommand c) throws HuntflowException {
    Variable v = session.get(c.variable());
    RowSetDescription d = store().describe(v.rows());
    display.info(
        new DisplaySink.VariableInfo(
            v.name(), v.entityType(), v.provenance().name(), d.rowCount(), d.attributes()));
    return null;
  }

  @Override
  public Produced visitSave(SaveCommand c) throws HuntflowException {
    Variable v = session.get(c.variable());
    RowSetDescription d = store().describe(v.rows());
    Path path = Paths.get(c.path());
    try {
      files.save(d.attributes(), store().rows(v.rows()), path);
    } catch (HuntflowIOException e) {
      throw new HuntflowIOException("SAVE " + v.name() + ": " + e.getMessage(), e.getCause());
    }
    LOG.info("saved {} ({} rows) to {}", v.name(), d.rowCount(), path);
    return null;
  }
}
