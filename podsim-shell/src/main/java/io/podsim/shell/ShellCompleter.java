package io.podsim.shell;

import io.podsim.core.TerminalSession;
import io.podsim.core.completion.CompletionEngine;
import io.podsim.core.completion.CompletionResult;
import java.util.List;
import java.util.Locale;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * JLine adapter over {@link CompletionEngine}. Inside an interactive tool the line is completed as
 * arguments of that tool.
 */
public class ShellCompleter implements Completer {
  private final CompletionEngine engine;
  private final TerminalSession session;

  public ShellCompleter(CompletionEngine engine, TerminalSession session) {
    this.engine = engine;
    this.session = session;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String upToCursor = line.line().substring(0, line.cursor());
    String text =
        session.activeTool().map(tool -> tool + " " + upToCursor).orElse(upToCursor);
    CompletionResult result = engine.complete(text);
    boolean single = result.completions().size() == 1;
    String group = result.type().name().toLowerCase(Locale.ROOT);
    for (String value : result.completions()) {
      candidates.add(new Candidate(value, value, group, null, null, null, single));
    }
  }
}
