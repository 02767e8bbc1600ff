package io.huntflow.shell.cli;

import io.huntflow.core.lang.HuntflowParser;
import io.huntflow.shell.core.SessionManager;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * Completes shell commands at the start of a line, huntflow keywords and the variables of the
 * current session elsewhere.
 */
public class ShellCompleter implements Completer {
  private static final List<String> KEYWORDS =
      List.copyOf(new TreeSet<>(HuntflowParser.keywords()));

  private final SessionManager sessions;

  public ShellCompleter(SessionManager sessions) {
    this.sessions = sessions;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String word = line.word().substring(0, line.wordCursor());
    if (line.wordIndex() == 0 && word.startsWith(":")) {
      for (String c : CommandDispatcher.COMMANDS) {
        if (c.startsWith(word)) candidates.add(new Candidate(c));
      }
      return;
    }
    String upper = word.toUpperCase(Locale.ROOT);
    for (String k : KEYWORDS) {
      if (k.startsWith(upper)) candidates.add(new Candidate(k));
    }
    sessions
        .current()
        .ifPresent(
            ref -> {
              for (String v : ref.session().variableNames()) {
                if (v.startsWith(word)) candidates.add(new Candidate(v));
              }
            });
  }
}
