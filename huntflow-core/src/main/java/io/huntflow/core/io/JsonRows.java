package io.huntflow.core.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Gson trees and entity rows. Integral JSON numbers become {@link Long}, all
 * other numbers {@link Double}.
 */
public final class JsonRows {
  private JsonRows() {}

  public static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  public static Object toJava(JsonElement e) {
    if (e == null || e.isJsonNull()) return null;
    if (e.isJsonPrimitive()) {
      JsonPrimitive p = e.getAsJsonPrimitive();
      if (p.isBoolean()) return p.getAsBoolean();
      if (p.isNumber()) {
        String text = p.getAsString();
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
          try {
            return Long.parseLong(text);
          } catch (NumberFormatException overflow) {
            return p.getAsDouble();
          }
        }
        return p.getAsDouble();
      }
      return p.getAsString();
    }
    if (e.isJsonArray()) {
      List<Object> list = new ArrayList<>();
      for (JsonElement item : e.getAsJsonArray()) list.add(toJava(item));
      return list;
    }
    return toRow(e.getAsJsonObject());
  }

  public static Map<String, Object> toRow(JsonObject o) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> f : o.entrySet()) row.put(f.getKey(), toJava(f.getValue()));
    return row;
  }

  /** Rows of an array of objects; non-object elements are rejected with the index. */
  public static List<Map<String, Object>> toRows(JsonArray array) {
    List<Map<String, Object>> rows = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonElement e = array.get(i);
      if (!e.isJsonObject()) {
        throw new IllegalArgumentException("element " + i + " is not a JSON object: " + e);
      }
      rows.add(toRow(e.getAsJsonObject()));
    }
    return rows;
  }

  public static JsonElement toJson(Object v) {
    if (v == null) return JsonNull.INSTANCE;
    if (v instanceof Boolean b) return new JsonPrimitive(b);
    if (v instanceof Number n) return new JsonPrimitive(n);
    if (v instanceof Map<?, ?> m) {
      JsonObject o = new JsonObject();
      for (Map.Entry<?, ?> e : m.entrySet()) {
        o.add(String.valueOf(e.getKey()), toJson(e.getValue()));
      }
      return o;
    }
    if (v instanceof Iterable<?> it) {
      JsonArray a = new JsonArray();
      for (Object item : it) a.add(toJson(item));
      return a;
    }
    return new JsonPrimitive(v.toString());
  }

  /** Rows restricted to the columns, in column order. */
  public static JsonArray toJson(List<String> columns, List<Map<String, Object>> rows) {
    JsonArray array = new JsonArray();
    for (Map<String, Object> row : rows) {
      JsonObject o = new JsonObject();
      for (String c : columns) o.add(c, toJson(row.get(c)));
      array.add(o);
    }
    return array;
  }
}
