package io.podsim.core.completion;

import java.util.List;

/**
 * Candidates for the current word.
 *
 * @param completions sorted candidates
 * @param commonPrefix longest prefix shared by all candidates
 * @param isPartial true when more than one candidate remains
 * @param type kind of word being completed
 */
public record CompletionResult(
    List<String> completions, String commonPrefix, boolean isPartial, CompletionType type) {

  public CompletionResult {
    completions = List.copyOf(completions);
  }

  static CompletionResult of(List<String> completions, CompletionType type) {
    return new CompletionResult(
        completions, CompletionEngine.findCommonPrefix(completions), completions.size() > 1, type);
  }

  public boolean isEmpty() {
    return completions.isEmpty();
  }
}
