package io.huntflow.shell.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.interpreter.CollectingDisplaySink;
import io.huntflow.shell.core.SessionManager;
import io.huntflow.shell.core.Sessions;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ShellCompleterTest {
  private final SessionManager sessions =
      Sessions.inMemory(HuntflowConfig.defaults(), new CollectingDisplaySink());
  private final ShellCompleter completer = new ShellCompleter(sessions);

  @AfterEach
  void closeAll() {
    sessions.closeAll();
  }

  private List<String> complete(String word, int wordIndex) {
    ParsedLine line = mock(ParsedLine.class);
    when(line.word()).thenReturn(word);
    when(line.wordCursor()).thenReturn(word.length());
    when(line.wordIndex()).thenReturn(wordIndex);
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(mock(LineReader.class), line, candidates);
    List<String> values = new ArrayList<>();
    for (Candidate c : candidates) values.add(c.value());
    return values;
  }

  @Test
  void shellCommandsAtLineStart() {
    assertEquals(List.of(":sessions", ":script"), complete(":s", 0));
  }

  @Test
  void keywordsIgnoreCase() {
    List<String> values = complete("gr", 2);
    assertTrue(values.contains("GROUP"), values.toString());
  }

  @Test
  void variablesOfCurrentSession() throws Exception {
    sessions.execute("procs = NEW process [{\"pid\": 1}]\nprocs2 = procs");
    assertEquals(List.of("procs", "procs2"), complete("pro", 1));
  }
}
