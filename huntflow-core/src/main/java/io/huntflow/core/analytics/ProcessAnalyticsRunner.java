package io.huntflow.core.analytics;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.huntflow.core.error.AnalyticsException;
import io.huntflow.core.io.JsonRows;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external program as analytics: {@code exec:/path/to/tool arg1 arg2}.
 *
 * <p>The program receives one JSON document on stdin:
 *
 * <pre>
 * {"args": {"k": "v"}, "inputs": [{"variable": "x", "type": "process", "rows": [...]}]}
 * </pre>
 *
 * and must print one JSON document on stdout and exit with status 0:
 *
 * <pre>
 * {"outputs": {"x": [...]}, "display": "text", "warnings": ["..."]}
 * </pre>
 *
 * All fields of the reply are optional. A non-zero exit status fails the APPLY with the tail of
 * stderr in the message.
 */
public final class ProcessAnalyticsRunner implements AnalyticsRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ProcessAnalyticsRunner.class);

  public static final String SCHEME = "exec";

  private static final int STDERR_TAIL = 2000;

  @Override
  public String scheme() {
    return SCHEME;
  }

  @Override
  public AnalyticsResult invoke(
      String locator, List<AnalyticsInput> inputs, Map<String, String> args)
      throws AnalyticsException {
    List<String> command = commandOf(locator);
    String request = JsonRows.GSON.toJson(request(inputs, args));
    Path stderr = null;
    Process process = null;
    try {
      stderr = Files.createTempFile("huntflow-analytics", ".err");
      process =
          new ProcessBuilder(command)
              .redirectError(ProcessBuilder.Redirect.to(stderr.toFile()))
              .start();
      LOG.debug("started analytics {} (pid {})", command, process.pid());
      Process p = process;
      CompletableFuture<Void> writer =
          CompletableFuture.runAsync(
              () -> {
                try (OutputStream out = p.getOutputStream()) {
                  out.write(request.getBytes(StandardCharsets.UTF_8));
                } catch (IOException e) {
                  // the program may exit without reading its input
                  LOG.debug("analytics {} closed stdin early: {}", command, e.toString());
                }
              });
      CompletableFuture<String> reader =
          CompletableFuture.supplyAsync(
              () -> {
                try (InputStream in = p.getInputStream()) {
                  return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
      // waitFor is interruptible, so a timeout kills the process in the finally block
      int status = process.waitFor();
      String reply = reader.get();
      writer.get();
      if (status != 0) {
        throw new AnalyticsException(
            "Analytics " + locator + " exited with status " + status + ": " + tail(stderr));
      }
      return parseReply(locator, reply);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AnalyticsException("Analytics " + locator + " was interrupted", e);
    } catch (ExecutionException e) {
      throw new AnalyticsException(
          "Analytics " + locator + " failed: " + e.getCause(), e.getCause());
    } catch (IOException e) {
      throw new AnalyticsException("Cannot run analytics " + locator + ": " + e.getMessage(), e);
    } finally {
      if (process != null && process.isAlive()) process.destroyForcibly();
      if (stderr != null) deleteQuietly(stderr);
    }
  }

  static List<String> commandOf(String locator) throws AnalyticsException {
    String rest = locator.substring(locator.indexOf(':') + 1);
    if (rest.startsWith("//")) rest = rest.substring(2);
    rest = rest.trim();
    if (rest.isEmpty()) {
      throw new AnalyticsException("Analytics locator has no command: " + locator);
    }
    return Arrays.asList(rest.split("\\s+"));
  }

  private static JsonObject request(List<AnalyticsInput> inputs, Map<String, String> args) {
    JsonObject root = new JsonObject();
    root.add("args", JsonRows.toJson(args));
    JsonArray in = new JsonArray();
    for (AnalyticsInput input : inputs) {
      JsonObject o = new JsonObject();
      o.addProperty("variable", input.variable());
      o.addProperty("type", input.entityType());
      o.add("rows", JsonRows.toJson(input.columns(), input.rows()));
      in.add(o);
    }
    root.add("inputs", in);
    return root;
  }

  static AnalyticsResult parseReply(String locator, String reply) throws AnalyticsException {
    if (reply.isBlank()) return new AnalyticsResult(Map.of(), null, List.of());
    try {
      JsonElement root = JsonParser.parseString(reply);
      if (!root.isJsonObject()) throw new JsonParseException("reply is not a JSON object");
      JsonObject o = root.getAsJsonObject();
      Map<String, List<Map<String, Object>>> outputs = new LinkedHashMap<>();
      if (o.has("outputs") && o.get("outputs").isJsonObject()) {
        for (Map.Entry<String, JsonElement> e : o.getAsJsonObject("outputs").entrySet()) {
          outputs.put(e.getKey(), JsonRows.toRows(e.getValue().getAsJsonArray()));
        }
      }
      String display = null;
      if (o.has("display") && !o.get("display").isJsonNull()) {
        display = o.get("display").getAsString();
      }
      List<String> warnings = new ArrayList<>();
      if (o.has("warnings") && o.get("warnings").isJsonArray()) {
        for (JsonElement w : o.getAsJsonArray("warnings")) warnings.add(w.getAsString());
      }
      return new AnalyticsResult(outputs, display, warnings);
    } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
      throw new AnalyticsException(
          "Analytics " + locator + " returned a malformed reply: " + e.getMessage(), e);
    }
  }

  private static String tail(Path file) {
    try {
      String text = Files.readString(file, StandardCharsets.UTF_8).strip();
      if (text.length() <= STDERR_TAIL) return text;
      return "..." + text.substring(text.length() - STDERR_TAIL);
    } catch (IOException e) {
      return "(stderr unavailable: " + e.getMessage() + ")";
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOG.debug("cannot delete {}: {}", file, e.toString());
    }
  }
}
