package io.huntflow.core.analytics;

import io.huntflow.core.error.AnalyticsException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * In-process analytics under {@code builtin://NAME}:
 *
 * <ul>
 *   <li>{@code tag}: adds attribute {@code attribute} (default {@code x_tag}) with {@code value}
 *       (default {@code suspicious}) to every row
 *   <li>{@code sample}: keeps the first {@code n} rows (default 10) of every input
 *   <li>{@code summary}: displays type, row count and attributes of every input
 * </ul>
 */
public final class BuiltinAnalytics implements AnalyticsRunner {
  public static final String SCHEME = "builtin";

  @Override
  public String scheme() {
    return SCHEME;
  }

  @Override
  public AnalyticsResult invoke(
      String locator, List<AnalyticsInput> inputs, Map<String, String> args)
      throws AnalyticsException {
    String name = locator.substring(locator.indexOf(':') + 1);
    if (name.startsWith("//")) name = name.substring(2);
    switch (name.toLowerCase(Locale.ROOT)) {
      case "tag":
        return tag(inputs, args);
      case "sample":
        return sample(inputs, args);
      case "summary":
        return summary(inputs);
      default:
        throw new AnalyticsException(
            "Unknown builtin analytics '" + name + "'; available: tag, sample, summary");
    }
  }

  private static AnalyticsResult tag(List<AnalyticsInput> inputs, Map<String, String> args) {
    String attribute = args.getOrDefault("attribute", "x_tag");
    String value = args.getOrDefault("value", "suspicious");
    Map<String, List<Map<String, Object>>> outputs = new LinkedHashMap<>();
    for (AnalyticsInput in : inputs) {
      List<Map<String, Object>> rows = new ArrayList<>(in.rows().size());
      for (Map<String, Object> r : in.rows()) {
        Map<String, Object> tagged = new LinkedHashMap<>(r);
        tagged.put(attribute, value);
        rows.add(tagged);
      }
      outputs.put(in.variable(), rows);
    }
    return new AnalyticsResult(outputs, null, List.of());
  }

  private static AnalyticsResult sample(List<AnalyticsInput> inputs, Map<String, String> args)
      throws AnalyticsException {
    int n;
    try {
      n = Integer.parseInt(args.getOrDefault("n", "10"));
    } catch (NumberFormatException e) {
      throw new AnalyticsException("sample: argument n must be an integer, got " + args.get("n"));
    }
    if (n < 0) throw new AnalyticsException("sample: argument n must not be negative");
    Map<String, List<Map<String, Object>>> outputs = new LinkedHashMap<>();
    List<String> warnings = new ArrayList<>();
    for (AnalyticsInput in : inputs) {
      if (n >= in.rows().size()) {
        warnings.add(
            "sample: " + in.variable() + " has only " + in.rows().size() + " rows, kept all");
      }
      outputs.put(in.variable(), in.rows().subList(0, Math.min(n, in.rows().size())));
    }
    return new AnalyticsResult(outputs, null, warnings);
  }

  private static AnalyticsResult summary(List<AnalyticsInput> inputs) {
    StringBuilder sb = new StringBuilder();
    for (AnalyticsInput in : inputs) {
      if (sb.length() > 0) sb.append('\n');
      sb.append(in.variable())
          .append(": ")
          .append(in.entityType() != null ? in.entityType() : "untyped")
          .append(", ")
          .append(in.rows().size())
          .append(" rows, attributes ")
          .append(String.join(", ", in.columns()));
    }
    return new AnalyticsResult(Map.of(), sb.toString(), List.of());
  }
}
