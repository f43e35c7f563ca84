package io.podsim.shell;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

import io.podsim.core.TerminalSession;
import io.podsim.core.completion.CompletionEngine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.jline.reader.Candidate;
import org.jline.reader.ParsedLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ShellCompleterTest {

  static class SimpleParsedLine implements ParsedLine {
    private final String line;
    private final List<String> words;
    private final int wordIndex;

    SimpleParsedLine(String line) {
      this.line = line;
      List<String> w = new ArrayList<>(Arrays.asList(line.stripLeading().split("\\s+")));
      if (line.endsWith(" ")) {
        w.add("");
      }
      this.words = List.copyOf(w);
      this.wordIndex = words.size() - 1;
    }

    @Override
    public String word() {
      return words.get(wordIndex);
    }

    @Override
    public int wordCursor() {
      return word().length();
    }

    @Override
    public int wordIndex() {
      return wordIndex;
    }

    @Override
    public List<String> words() {
      return words;
    }

    @Override
    public String line() {
      return line;
    }

    @Override
    public int cursor() {
      return line.length();
    }
  }

  private TerminalSession session;
  private ShellCompleter completer;

  @BeforeEach
  void setUp() {
    session = Mockito.mock(TerminalSession.class);
    when(session.activeTool()).thenReturn(Optional.empty());
    completer = new ShellCompleter(new CompletionEngine(), session);
  }

  private List<String> complete(String line) {
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(null, new SimpleParsedLine(line), candidates);
    return candidates.stream().map(Candidate::value).toList();
  }

  @Test
  void completesCommandNames() {
    assertEquals(List.of("nvidia-smi"), complete("nvidia-s"));
    assertTrue(complete("s").containsAll(List.of("sinfo", "squeue", "scontrol", "sbatch")));
  }

  @Test
  void singleCandidateIsComplete() {
    List<Candidate> candidates = new ArrayList<>();
    completer.complete(null, new SimpleParsedLine("ibdev"), candidates);

    assertEquals(1, candidates.size());
    assertTrue(candidates.get(0).complete());
    assertEquals("command", candidates.get(0).group());
  }

  @Test
  void completesSubcommandsAndFlags() {
    assertEquals(List.of("diag", "discovery", "dmon"), complete("dcgmi d"));
    assertTrue(complete("nvidia-smi -").contains("--query-gpu"));
    assertTrue(complete("lspci -v").containsAll(List.of("-v", "-vv", "-vvv")));
  }

  @Test
  void completesPathsAndServices() {
    assertEquals(List.of("/etc/slurm"), complete("cat /etc/sl"));
    assertEquals(List.of("slurmctld", "slurmd", "slurmdbd"), complete("systemctl restart slurm"));
  }

  @Test
  void insideInteractiveToolCompletesItsArguments() {
    when(session.activeTool()).thenReturn(Optional.of("cmsh"));

    assertEquals(List.of("device"), complete("dev"));
  }

  @Test
  void unknownPrefixYieldsNothing() {
    assertTrue(complete("zzz").isEmpty());
  }
}
