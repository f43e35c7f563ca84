package io.podsim.core;

import java.util.Optional;

/**
 * Outcome of one command.
 *
 * @param output text to print, possibly with ANSI color codes
 * @param exitCode process-style exit code, 0 on success
 * @param prompt prompt of the interactive session this command leaves active; empty when no
 *     session is active (or the session just ended)
 */
public record CommandResult(String output, int exitCode, Optional<String> prompt) {

  public CommandResult {
    output = output == null ? "" : output;
    prompt = prompt == null ? Optional.empty() : prompt;
  }

  public static CommandResult success(String output) {
    return new CommandResult(output, 0, Optional.empty());
  }

  public static CommandResult error(String output) {
    return new CommandResult(output, 1, Optional.empty());
  }

  public static CommandResult error(String output, int exitCode) {
    return new CommandResult(output, exitCode, Optional.empty());
  }

  /** A result that keeps an interactive session open with the given prompt. */
  public static CommandResult interactive(String output, int exitCode, String prompt) {
    return new CommandResult(output, exitCode, Optional.of(prompt));
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }

  public boolean isInteractive() {
    return prompt.isPresent();
  }
}
