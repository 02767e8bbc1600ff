package io.huntflow.core.pattern;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.lang.HuntflowParser;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PredicateEvaluatorTest {

  private static boolean test(String pattern, Map<String, Object> row) throws Exception {
    return test(pattern, row, PredicateEvaluator.NO_REFERENCES);
  }

  private static boolean test(
      String pattern, Map<String, Object> row, PredicateEvaluator.Dereferencer refs)
      throws Exception {
    Predicate p =
        PatternCompiler.compile(
            HuntflowParser.parsePattern(pattern), CompileContext.forType("process"));
    return PredicateEvaluator.test(p, row, refs);
  }

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @Test
  void likeIsCaseInsensitiveWithSqlWildcards() throws Exception {
    assertTrue(test("name LIKE 'svc%'", row("name", "SVChost.exe")));
    assertTrue(test("name LIKE 'cmd._xe'", row("name", "cmd.exe")));
    assertFalse(test("name LIKE 'cmd'", row("name", "cmd.exe")));
    assertTrue(test("name LIKE 'a.c'", row("name", "a.c")));
    assertFalse(test("name LIKE 'a.c'", row("name", "abc")));
  }

  @Test
  void matchesFindsAnywhere() throws Exception {
    assertTrue(test("command_line MATCHES '-enc\\\\s'", row("command_line", "ps -enc AAA")));
    assertFalse(test("command_line MATCHES '^-enc'", row("command_line", "ps -enc AAA")));
  }

  @Test
  void numbersCompareAcrossRepresentations() throws Exception {
    assertTrue(test("pid = 4", row("pid", 4.0)));
    assertTrue(test("pid > 3", row("pid", "10")));
    assertTrue(test("pid <= 4", row("pid", 4L)));
    assertFalse(test("pid < 4", row("pid", 4L)));
  }

  @Test
  void missingAttributeEqualsNull() throws Exception {
    assertTrue(test("parent_ref = null", row("pid", 1L)));
    assertFalse(test("parent_ref != null", row("pid", 1L)));
    assertTrue(test("parent_ref IS NULL", row("pid", 1L)));
    assertFalse(test("pid IS NULL", row("pid", 1L)));
    assertFalse(test("pid > 0", row("name", "a")));
  }

  @Test
  void listAttributesMatchExistentially() throws Exception {
    Map<String, Object> r = row("dst_ports", List.of(80L, 443L));
    assertTrue(test("dst_ports = 443", r));
    assertTrue(test("dst_ports IN (22, 80)", r));
    assertFalse(test("dst_ports IN (22, 23)", r));
  }

  @Test
  void subsetAndSuperset() throws Exception {
    Map<String, Object> r = row("protocols", List.of("tcp", "ipv4"));
    assertTrue(test("protocols ISSUBSET ('tcp', 'ipv4', 'udp')", r));
    assertFalse(test("protocols ISSUBSET ('tcp')", r));
    assertTrue(test("protocols ISSUPERSET ('tcp')", r));
    assertFalse(test("protocols ISSUPERSET ('tcp', 'udp')", r));
    assertFalse(test("protocols ISSUBSET ('tcp')", row("name", "x")));
  }

  @Test
  void dottedKeysResolveBeforeNesting() throws Exception {
    Map<String, Object> r = row("hashes.SHA-256", "abc");
    assertTrue(test("hashes.'SHA-256' = 'abc'", r));
    Map<String, Object> nested = row("extensions", row("tcp", row("src_flags", 2L)));
    assertTrue(test("extensions.tcp.src_flags = 2", nested));
  }

  @Test
  void expansionIteratesLists() throws Exception {
    Map<String, Object> r =
        row("values", List.of(row("name", "Run", "data", "a"), row("name", "Other", "data", "b")));
    assertTrue(test("values[*].name = 'Run'", r));
    assertFalse(test("values[*].name = 'Missing'", r));
  }

  @Test
  void referencesAreDereferenced() throws Exception {
    Map<String, Map<String, Object>> universe = new HashMap<>();
    universe.put("file--1", row("id", "file--1", "name", "cmd.exe"));
    universe.put("process--0", row("id", "process--0", "name", "explorer.exe"));
    Map<String, Object> child =
        row("id", "process--2", "binary_ref", "file--1", "parent_ref", "process--0");
    assertTrue(test("binary_ref.name = 'cmd.exe'", child, universe::get));
    assertTrue(test("parent_ref.name LIKE 'explorer%'", child, universe::get));
    assertFalse(test("binary_ref.name = 'cmd.exe'", child));
  }
}
