package io.huntflow.core.pattern;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.lang.HuntflowParser;
import java.util.LinkedHashMap;
import java.util.Map;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

class PatternPropertiesTest {

  private static Predicate compile(String pattern) throws Exception {
    return PatternCompiler.compile(
        HuntflowParser.parsePattern(pattern), CompileContext.forType("process"));
  }

  private static Map<String, Object> row(long a, long b, long c) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("a", a);
    row.put("b", b);
    row.put("c", c);
    return row;
  }

  @Property
  void andBindsTighterThanOrOnTheLeft(
      @ForAll @IntRange(min = 0, max = 2) int a,
      @ForAll @IntRange(min = 0, max = 2) int b,
      @ForAll @IntRange(min = 0, max = 2) int c)
      throws Exception {
    Map<String, Object> r = row(a, b, c);
    assertEquals(
        PredicateEvaluator.test(compile("(a = 1 AND b = 1) OR c = 1"), r),
        PredicateEvaluator.test(compile("a = 1 AND b = 1 OR c = 1"), r));
  }

  @Property
  void andBindsTighterThanOrOnTheRight(
      @ForAll @IntRange(min = 0, max = 2) int a,
      @ForAll @IntRange(min = 0, max = 2) int b,
      @ForAll @IntRange(min = 0, max = 2) int c)
      throws Exception {
    Map<String, Object> r = row(a, b, c);
    assertEquals(
        PredicateEvaluator.test(compile("a = 1 OR (b = 1 AND c = 1)"), r),
        PredicateEvaluator.test(compile("a = 1 OR b = 1 AND c = 1"), r));
  }

  @Property
  void notInIsTheComplementOfIn(@ForAll @IntRange(min = -3, max = 5) int a) throws Exception {
    Map<String, Object> r = row(a, 0, 0);
    boolean in = PredicateEvaluator.test(compile("a IN (1, 2)"), r);
    boolean notIn = PredicateEvaluator.test(compile("a NOT IN (1, 2)"), r);
    boolean leadingNot = PredicateEvaluator.test(compile("NOT a IN (1, 2)"), r);
    assertNotEquals(in, notIn);
    assertEquals(notIn, leadingNot);
  }

  @Property
  void notBeforeGroupIsItsExactComplement(
      @ForAll @IntRange(min = 0, max = 2) int a,
      @ForAll @IntRange(min = 0, max = 2) int b,
      @ForAll boolean missing)
      throws Exception {
    Map<String, Object> r = row(a, b, 0);
    if (missing) r.remove("b");
    String group = "(a = 1 OR b >= 1 AND c IS NULL)";
    boolean positive = PredicateEvaluator.test(compile(group), r);
    boolean negative = PredicateEvaluator.test(compile("NOT " + group), r);
    assertNotEquals(positive, negative);
  }

  @Property
  void notEqualsIsTheComplementOfEquals(
      @ForAll @IntRange(min = 0, max = 3) int a, @ForAll boolean missing) throws Exception {
    Map<String, Object> r = row(a, 0, 0);
    if (missing) r.remove("a");
    boolean eq = PredicateEvaluator.test(compile("a = 2"), r);
    boolean ne = PredicateEvaluator.test(compile("a != 2"), r);
    assertNotEquals(eq, ne);
  }

  @Property
  void notLikeIsTheComplementOfLike(@ForAll("names") String name) throws Exception {
    Map<String, Object> r = new LinkedHashMap<>();
    r.put("name", name);
    boolean like = PredicateEvaluator.test(compile("name LIKE 'svc%'"), r);
    boolean notLike = PredicateEvaluator.test(compile("name NOT LIKE 'svc%'"), r);
    assertNotEquals(like, notLike);
  }

  @net.jqwik.api.Provide
  net.jqwik.api.Arbitrary<String> names() {
    return net.jqwik.api.Arbitraries.of("svchost.exe", "SVC", "cmd.exe", "", "xsvc");
  }
}
