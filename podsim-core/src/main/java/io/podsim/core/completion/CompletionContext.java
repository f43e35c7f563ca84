package io.podsim.core.completion;

import java.util.List;

/**
 * Position of the cursor within a line, assuming the cursor sits at the end.
 *
 * @param line the full line
 * @param currentWord the partial word being completed, empty after a trailing space
 * @param wordIndex zero-based index of the word being completed
 * @param previousWords complete words before the current one
 */
public record CompletionContext(
    String line, String currentWord, int wordIndex, List<String> previousWords) {

  public CompletionContext {
    previousWords = List.copyOf(previousWords);
  }

  public String command() {
    return previousWords.isEmpty() ? currentWord : previousWords.get(0);
  }
}
