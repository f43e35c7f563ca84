package io.podsim.core.completion;

import io.podsim.core.CommandGrammar;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tab completion over the command grammar: command names, subcommands, flags, simulated paths and
 * systemd service names. Completion is read-only; it never touches cluster state.
 */
public final class CompletionEngine {
  private static final String HOME = "/root";
  private static final Set<String> PATH_COMMANDS = Set.of("cat", "ls", "cd", "less", "tail", "vi");
  private static final Set<String> SERVICE_VERBS =
      Set.of("start", "stop", "restart", "status", "enable", "disable", "is-active");

  private final CommandGrammar grammar;

  public CompletionEngine() {
    this(CommandGrammar.standard());
  }

  public CompletionEngine(CommandGrammar grammar) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
  }

  /** Locates the word under a cursor at the end of {@code line}. */
  public static CompletionContext parseContext(String line) {
    String text = line == null ? "" : line;
    List<String> words = new ArrayList<>();
    for (String w : text.trim().split("\\s+")) {
      if (!w.isEmpty()) {
        words.add(w);
      }
    }
    boolean trailingSpace =
        !text.isEmpty() && Character.isWhitespace(text.charAt(text.length() - 1));
    if (words.isEmpty()) {
      return new CompletionContext(text, "", 0, List.of());
    }
    if (trailingSpace) {
      return new CompletionContext(text, "", words.size(), words);
    }
    String current = words.remove(words.size() - 1);
    return new CompletionContext(text, current, words.size(), words);
  }

  public static String findCommonPrefix(List<String> values) {
    if (values.isEmpty()) {
      return "";
    }
    String prefix = values.get(0);
    for (String value : values) {
      int i = 0;
      while (i < prefix.length() && i < value.length() && prefix.charAt(i) == value.charAt(i)) {
        i++;
      }
      prefix = prefix.substring(0, i);
    }
    return prefix;
  }

  /** Case-insensitive prefix filter, sorted. */
  public static List<String> filterCompletions(Collection<String> candidates, String prefix) {
    String lower = prefix.toLowerCase(Locale.ROOT);
    return candidates.stream()
        .filter(c -> c.toLowerCase(Locale.ROOT).startsWith(lower))
        .distinct()
        .sorted()
        .toList();
  }

  public CompletionResult completeCommand(String partial) {
    return CompletionResult.of(
        filterCompletions(grammar.commands(), partial), CompletionType.COMMAND);
  }

  /** Flags when the partial word starts with a dash, subcommands otherwise. */
  public CompletionResult completeSubcommand(String command, String partial) {
    if (partial.startsWith("-")) {
      return CompletionResult.of(
          filterCompletions(grammar.flagsOf(command), partial), CompletionType.FLAG);
    }
    return CompletionResult.of(
        filterCompletions(grammar.subcommandsOf(command), partial), CompletionType.SUBCOMMAND);
  }

  public CompletionResult completePath(String partial) {
    boolean absolute = partial.startsWith("/");
    String full = absolute ? partial : HOME + "/" + partial;
    int slash = full.lastIndexOf('/');
    String dir = slash == 0 ? "/" : full.substring(0, slash);
    Map<String, List<String>> tree = grammar.paths();
    List<String> children = tree.getOrDefault(dir, List.of());
    List<String> candidates = new ArrayList<>();
    for (String child : children) {
      String path = "/".equals(dir) ? "/" + child : dir + "/" + child;
      candidates.add(absolute ? path : path.substring(HOME.length() + 1));
    }
    return CompletionResult.of(filterCompletions(candidates, partial), CompletionType.PATH);
  }

  public CompletionResult completeSystemctlService(String partial) {
    return CompletionResult.of(
        filterCompletions(grammar.services(), partial), CompletionType.VALUE);
  }

  /** Completes the last word of {@code line}. */
  public CompletionResult complete(String line) {
    CompletionContext ctx = parseContext(line);
    if (ctx.wordIndex() == 0) {
      return completeCommand(ctx.currentWord());
    }
    String command = ctx.previousWords().get(0);
    String word = ctx.currentWord();
    if (word.startsWith("/") || word.startsWith("./")) {
      return completePath(word);
    }
    if ("systemctl".equals(command)
        && ctx.wordIndex() >= 2
        && SERVICE_VERBS.contains(ctx.previousWords().get(1))) {
      return completeSystemctlService(word);
    }
    if (PATH_COMMANDS.contains(command) && !word.startsWith("-")) {
      return completePath(word);
    }
    if (ctx.wordIndex() == 1) {
      return completeSubcommand(command, word);
    }
    return CompletionResult.of(
        filterCompletions(grammar.flagsOf(command), word), CompletionType.FLAG);
  }

  /**
   * Lays candidates out in columns for a terminal of the given width. Lines are separated by
   * {@code \r\n}; an empty list yields an empty string.
   */
  public static String formatCompletionsForDisplay(List<String> completions, int terminalWidth) {
    if (completions.isEmpty()) {
      return "";
    }
    int longest = completions.stream().mapToInt(String::length).max().orElse(0);
    int colWidth = longest + 2;
    int columns = Math.max(1, terminalWidth / colWidth);
    int rows = (completions.size() + columns - 1) / columns;
    String[] lines = new String[rows];
    Arrays.fill(lines, "");
    for (int i = 0; i < completions.size(); i++) {
      int row = i % rows;
      String cell = completions.get(i);
      boolean lastInRow = i + rows >= completions.size();
      lines[row] += lastInRow ? cell : cell + " ".repeat(colWidth - cell.length());
    }
    return String.join("\r\n", lines);
  }

  /** Replaces the word under the cursor with the completion. */
  public static String applyCompletion(String line, String completion, CompletionContext ctx) {
    String head = line.substring(0, line.length() - ctx.currentWord().length());
    return head + completion;
  }

  /** A space after a single, complete candidate; nothing while ambiguous. */
  public static String getCompletionSuffix(CompletionResult result) {
    return result.completions().size() == 1 && !result.isPartial() ? " " : "";
  }
}
